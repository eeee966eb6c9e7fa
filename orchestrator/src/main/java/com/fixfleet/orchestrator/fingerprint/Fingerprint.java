package com.fixfleet.orchestrator.fingerprint;

/** A computed fingerprint and the tier that produced it. */
public record Fingerprint(String value, FingerprintTier tier) {

    @Override
    public String toString() {
        return value;
    }
}
