package com.fixfleet.orchestrator.config;

import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for the dispatch orchestrator, bound from fixfleet.orchestrator.*.
 *
 * Every field has a working default so unit tests can use `new OrchestratorProperties()`.
 * Combinations that would break the cycle lease are rejected at startup.
 */
@Component
@ConfigurationProperties(prefix = "fixfleet.orchestrator")
public class OrchestratorProperties implements InitializingBean {

    /** Path of the repo registry JSON file. */
    private String registryPath = "config/repo-registry.json";

    /** Consecutive failed attempts after which an issue needs a human. */
    private int maxDispatchAttempts = 3;

    /** Waves whose fix rate falls below this halt the remaining waves. */
    private double fixRateThreshold = 0.5;

    /** A cycle whose session-creation failure rate exceeds this is reported FAILED. */
    private double creationFailureThreshold = 0.5;

    /** Parallel session creations within one wave. */
    private int creationConcurrency = 4;

    private Duration pollInterval = Duration.ofSeconds(30);

    /** How long one wave waits for its sessions before moving on. */
    private Duration waveTimeout = Duration.ofHours(2);

    /**
     * Lease length of the cycle lock. Renewed after every wave, so it must
     * outlast one wave: the wave timeout plus one poll interval.
     */
    private Duration lockTtl = Duration.ofHours(6);

    /**
     * Treat every finding of a repo with pre-fingerprint scans as recurring,
     * since its earlier appearances cannot be matched.
     */
    private boolean legacyScansImplyRecurring = true;

    private final RateLimit rateLimit = new RateLimit();
    private final Sla sla = new Sla();
    private final FixLearning fixLearning = new FixLearning();
    private final Scheduler scheduler = new Scheduler();

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    /**
     * @throws IllegalStateException if the lock TTL cannot cover one wave
     */
    public void validate() {
        Duration longestWave = waveTimeout.plus(pollInterval);
        if (lockTtl.compareTo(longestWave) <= 0) {
            throw new IllegalStateException("fixfleet.orchestrator.lock-ttl (" + lockTtl
                    + ") must exceed wave-timeout plus poll-interval (" + longestWave + ")");
        }
    }

    // ------------------------------------------------------------------
    // Nested groups
    // ------------------------------------------------------------------

    /** Global sliding-window limit on session creation. */
    public static class RateLimit {
        private int maxSessions = 20;
        private int periodHours = 24;

        public int  getMaxSessions()      { return maxSessions; }
        public int  getPeriodHours()      { return periodHours; }
        public void setMaxSessions(int v) { this.maxSessions = v; }
        public void setPeriodHours(int v) { this.periodHours = v; }
    }

    /** Remediation deadlines per severity, in hours since first seen. */
    public static class Sla {
        private int criticalHours = 72;
        private int highHours     = 168;
        private int mediumHours   = 720;
        private int lowHours      = 2160;
        private double atRiskFraction = 0.25;

        public int    getCriticalHours()       { return criticalHours; }
        public int    getHighHours()           { return highHours; }
        public int    getMediumHours()         { return mediumHours; }
        public int    getLowHours()            { return lowHours; }
        public double getAtRiskFraction()      { return atRiskFraction; }
        public void   setCriticalHours(int v)  { this.criticalHours = v; }
        public void   setHighHours(int v)      { this.highHours = v; }
        public void   setMediumHours(int v)    { this.mediumHours = v; }
        public void   setLowHours(int v)       { this.lowHours = v; }
        public void   setAtRiskFraction(double v) { this.atRiskFraction = v; }
    }

    /** Per-CWE-family learning from past sessions. */
    public static class FixLearning {
        /** Families with at least this many sessions and a lower fix rate are skipped. */
        private int    lowFixRateMinSessions = 3;
        private double lowFixRateThreshold   = 0.1;
        private int    baseAcuBudget = 10;
        private int    minAcuBudget  = 3;
        private int    maxAcuBudget  = 30;

        public int    getLowFixRateMinSessions()      { return lowFixRateMinSessions; }
        public double getLowFixRateThreshold()        { return lowFixRateThreshold; }
        public int    getBaseAcuBudget()              { return baseAcuBudget; }
        public int    getMinAcuBudget()               { return minAcuBudget; }
        public int    getMaxAcuBudget()               { return maxAcuBudget; }
        public void   setLowFixRateMinSessions(int v) { this.lowFixRateMinSessions = v; }
        public void   setLowFixRateThreshold(double v){ this.lowFixRateThreshold = v; }
        public void   setBaseAcuBudget(int v)         { this.baseAcuBudget = v; }
        public void   setMinAcuBudget(int v)          { this.minAcuBudget = v; }
        public void   setMaxAcuBudget(int v)          { this.maxAcuBudget = v; }
    }

    /** Background triggers. */
    public static class Scheduler {
        private boolean enabled = true;
        /** Spring cron for the unattended cycle; "-" disables it. */
        private String  cycleCron = "0 0 */6 * * *";
        private long    refreshIntervalMs = 300_000;

        public boolean isEnabled()            { return enabled; }
        public String  getCycleCron()         { return cycleCron; }
        public long    getRefreshIntervalMs() { return refreshIntervalMs; }
        public void setEnabled(boolean v)        { this.enabled = v; }
        public void setCycleCron(String v)       { this.cycleCron = v; }
        public void setRefreshIntervalMs(long v) { this.refreshIntervalMs = v; }
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String   getRegistryPath()              { return registryPath; }
    public int      getMaxDispatchAttempts()       { return maxDispatchAttempts; }
    public double   getFixRateThreshold()          { return fixRateThreshold; }
    public double   getCreationFailureThreshold()  { return creationFailureThreshold; }
    public int      getCreationConcurrency()       { return creationConcurrency; }
    public Duration getPollInterval()              { return pollInterval; }
    public Duration getWaveTimeout()               { return waveTimeout; }
    public Duration getLockTtl()                   { return lockTtl; }
    public boolean  isLegacyScansImplyRecurring()  { return legacyScansImplyRecurring; }
    public RateLimit   getRateLimit()              { return rateLimit; }
    public Sla         getSla()                    { return sla; }
    public FixLearning getFixLearning()            { return fixLearning; }
    public Scheduler   getScheduler()              { return scheduler; }

    public void setRegistryPath(String v)               { this.registryPath = v; }
    public void setMaxDispatchAttempts(int v)           { this.maxDispatchAttempts = v; }
    public void setFixRateThreshold(double v)           { this.fixRateThreshold = v; }
    public void setCreationFailureThreshold(double v)   { this.creationFailureThreshold = v; }
    public void setCreationConcurrency(int v)           { this.creationConcurrency = v; }
    public void setPollInterval(Duration v)             { this.pollInterval = v; }
    public void setWaveTimeout(Duration v)              { this.waveTimeout = v; }
    public void setLockTtl(Duration v)                  { this.lockTtl = v; }
    public void setLegacyScansImplyRecurring(boolean v) { this.legacyScansImplyRecurring = v; }
}
