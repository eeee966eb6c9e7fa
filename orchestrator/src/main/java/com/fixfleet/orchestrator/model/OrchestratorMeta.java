package com.fixfleet.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Singleton row holding orchestrator-wide state that is not per fingerprint.
 *
 * The rate-limiter window, objective progress and last cycle report are JSON
 * blobs written by the state store. The version column makes concurrent
 * writers fail instead of silently overwriting each other.
 *
 * DB table: orchestrator_meta  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "orchestrator_meta")
public class OrchestratorMeta {

    public static final short SINGLETON_ID = 1;

    @Id
    private Short id = SINGLETON_ID;

    @Version
    @Column(nullable = false)
    private Long version;   // null until first insert

    @Column(name = "last_cycle_id")
    private String lastCycleId;

    @Column(name = "last_cycle_at")
    private Instant lastCycleAt;

    @Column(name = "last_cycle_status")
    private String lastCycleStatus;

    @Column(name = "rate_window_json", columnDefinition = "TEXT")
    private String rateWindowJson;

    @Column(name = "objective_progress_json", columnDefinition = "TEXT")
    private String objectiveProgressJson;

    @Column(name = "last_cycle_report_json", columnDefinition = "TEXT")
    private String lastCycleReportJson;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    public OrchestratorMeta() {}

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Short   getId()                    { return id; }
    public Long    getVersion()               { return version; }
    public String  getLastCycleId()           { return lastCycleId; }
    public Instant getLastCycleAt()           { return lastCycleAt; }
    public String  getLastCycleStatus()       { return lastCycleStatus; }
    public String  getRateWindowJson()        { return rateWindowJson; }
    public String  getObjectiveProgressJson() { return objectiveProgressJson; }
    public String  getLastCycleReportJson()   { return lastCycleReportJson; }
    public Instant getUpdatedAt()             { return updatedAt; }

    public void setLastCycleId(String v)           { this.lastCycleId = v; }
    public void setLastCycleAt(Instant v)          { this.lastCycleAt = v; }
    public void setLastCycleStatus(String v)       { this.lastCycleStatus = v; }
    public void setRateWindowJson(String v)        { this.rateWindowJson = v; }
    public void setObjectiveProgressJson(String v) { this.objectiveProgressJson = v; }
    public void setLastCycleReportJson(String v)   { this.lastCycleReportJson = v; }
    public void setUpdatedAt(Instant v)            { this.updatedAt = v; }
}
