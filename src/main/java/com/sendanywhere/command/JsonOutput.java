package com.sendanywhere.command;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sendanywhere.chunk.FolderManifest;
import com.sendanywhere.chunk.Manifest;
import com.sendanywhere.config.Json;
import com.sendanywhere.signal.PairCodeInfo;
import com.sendanywhere.transfer.DownloadReport;
import com.sendanywhere.transfer.TransferProgress;

/**
 * Emits newline-delimited JSON events to stdout for machine-readable output.
 * Used by SendCommand and ReceiveCommand when --json flag is set.
 */
final class JsonOutput {

    private JsonOutput() {}

    static void status(String state) {
        emit(event("status").put("state", state));
    }

    static void manifest(Manifest manifest, String transferId) {
        emit(event("manifest")
                .put("name", manifest.name())
                .put("kind", manifest instanceof FolderManifest ? "folder" : "file")
                .put("size", manifest.totalBytes())
                .put("chunks", manifest.totalChunks())
                .put("transfer_id", transferId));
    }

    static void pairCode(PairCodeInfo info) {
        emit(event("pair_code")
                .put("pair_code", info.code())
                .put("transfer_id", info.transferId())
                .put("expires_in", info.expiresIn()));
    }

    static void lanServer(String address, int port) {
        emit(event("lan_server").put("address", address).put("port", port));
    }

    static void progress(TransferProgress p) {
        emit(event("progress")
                .put("chunks", p.completedChunks())
                .put("total_chunks", p.totalChunks())
                .put("bytes", p.transferredBytes())
                .put("total", p.totalBytes())
                .put("speed_bps", Math.round(p.speed()))
                .put("eta_seconds", p.etaSeconds())
                .put("percent", Math.round(p.percentComplete() * 10) / 10.0));
    }

    static void uploaded(long bytes, int chunks, long durationMs) {
        emit(event("complete").put("bytes", bytes).put("chunks", chunks).put("duration_ms", durationMs));
    }

    static void downloaded(DownloadReport report, long durationMs) {
        emit(event("complete")
                .put("path", report.output().toString())
                .put("chunks", report.chunksFetched())
                .put("files", report.files().size())
                .put("verified", report.verified())
                .put("duration_ms", durationMs));
    }

    static void error(String message) {
        emit(event("error").put("message", message == null ? "" : message));
    }

    private static ObjectNode event(String name) {
        return Json.mapper().createObjectNode().put("event", name);
    }

    private static void emit(ObjectNode node) {
        System.out.println(node.toString());
        System.out.flush();
    }
}
