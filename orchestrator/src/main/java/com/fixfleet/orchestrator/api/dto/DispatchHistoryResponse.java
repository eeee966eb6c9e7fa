package com.fixfleet.orchestrator.api.dto;

import com.fixfleet.orchestrator.service.FingerprintHistory;

import java.util.List;

/** Response body for GET /orchestrator/dispatch-history/{fingerprint}. */
public record DispatchHistoryResponse(
        HistoryEntryResponse       history,
        List<SessionResponse>      sessions,
        List<VerificationResponse> verifications
) {
    public static DispatchHistoryResponse from(FingerprintHistory h) {
        return new DispatchHistoryResponse(
                HistoryEntryResponse.from(h.entry()),
                h.sessions().stream().map(SessionResponse::from).toList(),
                h.verifications().stream().map(VerificationResponse::from).toList()
        );
    }
}
