package com.fixfleet.orchestrator.dispatch;

/** What happened to one batch during execution. */
public record BatchResult(
        Batch batch,
        BatchStatus status,
        String sessionId,
        String sessionUrl,
        String error
) {
    public static BatchResult created(Batch batch, String sessionId, String sessionUrl) {
        return new BatchResult(batch, BatchStatus.CREATED, sessionId, sessionUrl, null);
    }

    public static BatchResult failed(Batch batch, String error) {
        return new BatchResult(batch, BatchStatus.FAILED, null, null, error);
    }

    public static BatchResult deferred(Batch batch) {
        return new BatchResult(batch, BatchStatus.DEFERRED, null, null, null);
    }

    public static BatchResult skipped(Batch batch) {
        return new BatchResult(batch, BatchStatus.SKIPPED, null, null, null);
    }
}
