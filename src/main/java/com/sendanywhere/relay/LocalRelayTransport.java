package com.sendanywhere.relay;

import com.sendanywhere.chunk.ChunkReceipt;
import com.sendanywhere.chunk.Manifest;
import com.sendanywhere.error.TransferException;
import com.sendanywhere.transfer.ChunkTransport;

/**
 * {@link ChunkTransport} straight onto a {@link RelayStore} in the same process.
 */
final class LocalRelayTransport implements ChunkTransport {

    private final RelayStore store;
    private final String transferId;

    LocalRelayTransport(RelayStore store, String transferId) {
        this.store = store;
        this.transferId = transferId;
    }

    @Override
    public void create(Manifest manifest) throws TransferException {
        store.create(transferId, manifest);
    }

    @Override
    public ChunkReceipt put(int chunkId, byte[] data) throws TransferException {
        return store.putChunk(transferId, chunkId, data);
    }

    @Override
    public byte[] get(int chunkId) throws TransferException {
        return store.getChunk(transferId, chunkId);
    }

    @Override
    public Manifest manifest() throws TransferException {
        return store.getManifest(transferId);
    }

    @Override
    public String describe() {
        return "relay store " + store.root() + " / " + transferId;
    }
}
