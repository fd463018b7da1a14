package com.sendanywhere.transfer;

/**
 * Called once per finished chunk with the running count and the total.
 * Exceptions thrown from here are logged and otherwise ignored.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (completed, total) -> { };

    void onChunk(int completed, int total);
}
