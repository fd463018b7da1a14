package com.sendanywhere.chunk;

import java.util.List;

/**
 * Manifest of a folder: every regular file under the root, in a fixed order.
 * That order defines the flattened chunk id space (see {@link ChunkLayout}).
 */
public record FolderManifest(
        String folderName,
        String folderPath,
        long totalSize,
        int totalFiles,
        int chunkSize,
        List<FileManifest> files) implements Manifest {

    public FolderManifest {
        files = files == null ? List.of() : List.copyOf(files);
    }

    @Override
    public String name() {
        return folderName;
    }

    @Override
    public long totalBytes() {
        return totalSize;
    }

    @Override
    public int totalChunks() {
        int total = 0;
        for (FileManifest f : files) {
            total += f.totalChunks();
        }
        return total;
    }
}
