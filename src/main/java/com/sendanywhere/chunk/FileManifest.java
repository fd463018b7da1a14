package com.sendanywhere.chunk;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Manifest of a single file. {@code relativePath} is only set when the file
 * belongs to a {@link FolderManifest}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileManifest(
        String fileName,
        String filePath,
        long size,
        int chunkSize,
        int totalChunks,
        String hash,
        List<ChunkInfo> chunks,
        String relativePath) implements Manifest {

    public FileManifest {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public FileManifest withRelativePath(String path) {
        return new FileManifest(fileName, filePath, size, chunkSize, totalChunks, hash, chunks, path);
    }

    @Override
    public String name() {
        return fileName;
    }

    @Override
    public long totalBytes() {
        return size;
    }

    /** {@code ceil(size / chunkSize)}. */
    public static int chunkCount(long size, int chunkSize) {
        return (int) ((size + chunkSize - 1) / chunkSize);
    }
}
