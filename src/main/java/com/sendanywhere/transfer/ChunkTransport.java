package com.sendanywhere.transfer;

import com.sendanywhere.chunk.ChunkReceipt;
import com.sendanywhere.chunk.Manifest;
import com.sendanywhere.error.TransferException;

/**
 * The chunk contract {@link TransferEngine} drives, scoped to one transfer.
 * Chunk ids are global: a folder's files share one contiguous id space.
 */
public interface ChunkTransport {

    /** Register the transfer and its manifest with the far side. */
    void create(Manifest manifest) throws TransferException;

    ChunkReceipt put(int chunkId, byte[] data) throws TransferException;

    byte[] get(int chunkId) throws TransferException;

    Manifest manifest() throws TransferException;

    /** Human-readable description for logs. */
    String describe();
}
