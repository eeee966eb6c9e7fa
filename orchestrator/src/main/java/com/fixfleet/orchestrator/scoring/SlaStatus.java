package com.fixfleet.orchestrator.scoring;

/** Where an open issue stands against its remediation deadline. */
public enum SlaStatus {
    ON_TRACK("on-track", 0.0),
    AT_RISK("at-risk", 0.2),
    BREACHED("breached", 0.4);

    private final String label;
    private final double urgency;

    SlaStatus(String label, double urgency) {
        this.label   = label;
        this.urgency = urgency;
    }

    public String label()   { return label; }
    public double urgency() { return urgency; }
}
