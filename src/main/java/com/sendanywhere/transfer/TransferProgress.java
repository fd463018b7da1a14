package com.sendanywhere.transfer;

/**
 * Tracks chunk progress, speed, and ETA for display.
 */
public class TransferProgress implements ProgressListener {

    private final long totalBytes;
    private final int chunkSize;
    private volatile int completedChunks;
    private volatile int totalChunks;
    private final long startTimeMs;

    public TransferProgress(long totalBytes, int chunkSize, int totalChunks) {
        this.totalBytes = totalBytes;
        this.chunkSize = chunkSize;
        this.totalChunks = totalChunks;
        this.startTimeMs = System.currentTimeMillis();
    }

    @Override
    public void onChunk(int completed, int total) {
        this.completedChunks = completed;
        this.totalChunks = total;
    }

    public int completedChunks() { return completedChunks; }
    public int totalChunks() { return totalChunks; }
    public long totalBytes() { return totalBytes; }
    public long startTimeMs() { return startTimeMs; }

    /** Bytes covered by finished chunks; the last chunk may be short, so cap at the total. */
    public long transferredBytes() {
        return Math.min(totalBytes, (long) completedChunks * chunkSize);
    }

    public double percentComplete() {
        if (totalChunks == 0) return 100.0;
        return (completedChunks * 100.0) / totalChunks;
    }

    /** Bytes per second. */
    public double speed() {
        long elapsed = System.currentTimeMillis() - startTimeMs;
        if (elapsed <= 0) return 0;
        return (transferredBytes() * 1000.0) / elapsed;
    }

    /** Human-readable speed string. */
    public String speedString() {
        double bps = speed();
        if (bps >= 1_000_000) return String.format("%.1f MB/s", bps / 1_000_000);
        if (bps >= 1_000) return String.format("%.1f KB/s", bps / 1_000);
        return String.format("%.0f B/s", bps);
    }

    /** Estimated seconds remaining, or -1 if unknown. */
    public long etaSeconds() {
        double bps = speed();
        if (bps <= 0) return -1;
        long remaining = totalBytes - transferredBytes();
        return (long) (remaining / bps);
    }

    public String etaString() {
        long secs = etaSeconds();
        if (secs < 0) return "?";
        if (secs < 60) return secs + "s";
        if (secs < 3600) return String.format("%d:%02d", secs / 60, secs % 60);
        return String.format("%d:%02d:%02d", secs / 3600, (secs % 3600) / 60, secs % 60);
    }

    /** Progress bar: [=========>       ] 56% 12/21 chunks 2.3 MB/s ETA 0:45 */
    public String progressBar(int width) {
        double pct = percentComplete();
        int filled = (int) (width * pct / 100);
        StringBuilder bar = new StringBuilder("[");
        for (int i = 0; i < width; i++) {
            if (i < filled) bar.append('=');
            else if (i == filled) bar.append('>');
            else bar.append(' ');
        }
        bar.append(String.format("] %3.0f%% %d/%d chunks %s ETA %s",
                pct, completedChunks, totalChunks, speedString(), etaString()));
        return bar.toString();
    }

    public boolean isComplete() {
        return completedChunks >= totalChunks;
    }
}
