package com.sendanywhere.chunk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps a manifest onto the single, contiguous chunk id space used by the
 * transports. File 0's chunks come first, then file 1's, and so on; a single
 * file manifest is one slot starting at 0. Upload, download and the LAN client
 * all go through this class so the arithmetic exists in one place only.
 */
public final class ChunkLayout {

    /**
     * One file's share of the global id space: ids
     * {@code [firstChunk, firstChunk + chunkCount)}.
     */
    public record FileSlot(int fileIndex, FileManifest file, int firstChunk, int chunkCount) {

        public int globalId(int localChunkId) {
            return firstChunk + localChunkId;
        }

        public boolean contains(int globalId) {
            return globalId >= firstChunk && globalId < firstChunk + chunkCount;
        }
    }

    /** Position of a global chunk id inside one file. */
    public record ChunkRef(int fileIndex, int localChunkId) {}

    private final boolean folder;
    private final List<FileSlot> slots;
    private final int totalChunks;

    private ChunkLayout(boolean folder, List<FileSlot> slots, int totalChunks) {
        this.folder = folder;
        this.slots = slots;
        this.totalChunks = totalChunks;
    }

    public static ChunkLayout of(Manifest manifest) {
        if (manifest instanceof FileManifest file) {
            return new ChunkLayout(false, List.of(new FileSlot(0, file, 0, file.totalChunks())), file.totalChunks());
        }
        FolderManifest folderManifest = (FolderManifest) manifest;
        List<FileSlot> slots = new ArrayList<>(folderManifest.files().size());
        int offset = 0;
        int index = 0;
        for (FileManifest file : folderManifest.files()) {
            slots.add(new FileSlot(index++, file, offset, file.totalChunks()));
            offset += file.totalChunks();
        }
        return new ChunkLayout(true, Collections.unmodifiableList(slots), offset);
    }

    public boolean isFolder() {
        return folder;
    }

    public List<FileSlot> slots() {
        return slots;
    }

    public FileSlot slot(int fileIndex) {
        if (fileIndex < 0 || fileIndex >= slots.size()) {
            throw new IndexOutOfBoundsException("File index " + fileIndex + " out of range (" + slots.size() + " files)");
        }
        return slots.get(fileIndex);
    }

    public int totalChunks() {
        return totalChunks;
    }

    public int globalId(int fileIndex, int localChunkId) {
        FileSlot slot = slot(fileIndex);
        if (localChunkId < 0 || localChunkId >= slot.chunkCount()) {
            throw new IndexOutOfBoundsException("Chunk " + localChunkId + " out of range for file " + fileIndex);
        }
        return slot.globalId(localChunkId);
    }

    /**
     * Resolve a global chunk id to its file and local id.
     */
    public ChunkRef locate(int globalId) {
        if (globalId < 0 || globalId >= totalChunks) {
            throw new IndexOutOfBoundsException("Chunk " + globalId + " out of range (" + totalChunks + " chunks)");
        }
        // Slots are sorted by firstChunk; binary search skips empty files naturally.
        int lo = 0;
        int hi = slots.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            FileSlot s = slots.get(mid);
            if (globalId < s.firstChunk()) {
                hi = mid - 1;
            } else if (globalId >= s.firstChunk() + s.chunkCount()) {
                lo = mid + 1;
            } else {
                return new ChunkRef(s.fileIndex(), globalId - s.firstChunk());
            }
        }
        throw new IllegalStateException("No slot for chunk " + globalId);
    }
}
