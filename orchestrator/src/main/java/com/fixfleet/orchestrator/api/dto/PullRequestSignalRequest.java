package com.fixfleet.orchestrator.api.dto;

/** Request body for POST /signals/pull-requests. state: open, merged or closed. */
public record PullRequestSignalRequest(String prUrl, String state) {}
