package com.sendanywhere.chunk;

/**
 * Transport flavours. Each one has its own default chunk size.
 */
public enum TransferMode {
    LAN(2 * 1024 * 1024),
    WEBRTC(512 * 1024),
    RELAY(1024 * 1024);

    private final int defaultChunkSize;

    TransferMode(int defaultChunkSize) {
        this.defaultChunkSize = defaultChunkSize;
    }

    public int defaultChunkSize() {
        return defaultChunkSize;
    }
}
