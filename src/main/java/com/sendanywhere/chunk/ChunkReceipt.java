package com.sendanywhere.chunk;

/**
 * What a store reports back after accepting a chunk, so the uploader can
 * cross-check the digest and length it sent.
 */
public record ChunkReceipt(int chunkId, String hash, int size) {

    public boolean matches(byte[] sent) {
        return size == sent.length && Digests.sha256Hex(sent).equalsIgnoreCase(hash);
    }
}
