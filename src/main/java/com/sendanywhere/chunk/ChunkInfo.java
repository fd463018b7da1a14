package com.sendanywhere.chunk;

/**
 * One chunk of a file: its index within the file, its SHA-256 and its length.
 */
public record ChunkInfo(int id, String hash, int size) {
}
