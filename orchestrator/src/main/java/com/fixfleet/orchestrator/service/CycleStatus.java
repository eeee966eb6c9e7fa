package com.fixfleet.orchestrator.service;

/**
 * Terminal status of one dispatch cycle.
 *
 *   COMPLETED: every planned wave ran
 *   HALTED:    a wave's fix rate stopped the later waves
 *   CANCELLED: cancelled through the API or by interrupt
 *   FAILED:    aborted (registry or state store unusable) or too many
 *              session creations failed; meant for alerting
 */
public enum CycleStatus {
    COMPLETED,
    HALTED,
    CANCELLED,
    FAILED
}
