package com.fixfleet.orchestrator.fingerprint;

/**
 * Which identity source produced a fingerprint, most stable first.
 *
 * CONTENT_HASH survives line shifts and message rewording. POSITION breaks as
 * soon as a line is inserted above the finding; it is the last resort.
 */
public enum FingerprintTier {
    CONTENT_HASH,
    MESSAGE,
    SNIPPET,
    POSITION
}
