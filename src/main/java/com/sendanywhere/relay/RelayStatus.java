package com.sendanywhere.relay;

import java.util.List;

/**
 * Upload progress of one relay transfer, recomputed from storage on each call.
 * {@code complete} compares counts only, not which ids are present.
 */
public record RelayStatus(
        String transferId,
        int totalChunks,
        int uploadedChunks,
        double progress,
        List<Integer> availableChunks,
        boolean complete) {

    public RelayStatus {
        availableChunks = List.copyOf(availableChunks);
    }

    static RelayStatus of(String transferId, int totalChunks, List<Integer> available) {
        int uploaded = available.size();
        double progress = totalChunks > 0 ? Math.round(uploaded * 10000.0 / totalChunks) / 100.0 : 0.0;
        return new RelayStatus(transferId, totalChunks, uploaded, progress, available, uploaded == totalChunks);
    }
}
