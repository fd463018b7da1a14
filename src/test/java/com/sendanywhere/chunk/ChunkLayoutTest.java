package com.sendanywhere.chunk;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChunkLayoutTest {

    private static FileManifest file(String name, long size, int chunkSize) {
        int total = FileManifest.chunkCount(size, chunkSize);
        List<ChunkInfo> chunks = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            chunks.add(new ChunkInfo(i, "00".repeat(32), (int) Math.min(chunkSize, size - (long) i * chunkSize)));
        }
        return new FileManifest(name, "/src/" + name, size, chunkSize, total, "00".repeat(32), chunks, name);
    }

    @Test
    void singleFileStartsAtZero() {
        FileManifest f = file("a", 25, 10);
        ChunkLayout layout = ChunkLayout.of(f);

        assertFalse(layout.isFolder());
        assertEquals(3, layout.totalChunks());
        assertEquals(new ChunkLayout.ChunkRef(0, 2), layout.locate(2));
        assertEquals(2, layout.globalId(0, 2));
    }

    @Test
    void folderOffsetsAccumulateInFileOrder() {
        FolderManifest folder = new FolderManifest("root", "/src", 0, 4, 10, List.of(
                file("a", 25, 10),   // ids 0..2
                file("b", 0, 10),    // no chunks
                file("c", 10, 10),   // id 3
                file("d", 41, 10))); // ids 4..8
        ChunkLayout layout = ChunkLayout.of(folder);

        assertTrue(layout.isFolder());
        assertEquals(9, layout.totalChunks());
        assertEquals(0, layout.slot(0).firstChunk());
        assertEquals(3, layout.slot(1).firstChunk());
        assertEquals(0, layout.slot(1).chunkCount());
        assertEquals(3, layout.slot(2).firstChunk());
        assertEquals(4, layout.slot(3).firstChunk());

        assertEquals(new ChunkLayout.ChunkRef(0, 0), layout.locate(0));
        assertEquals(new ChunkLayout.ChunkRef(0, 2), layout.locate(2));
        assertEquals(new ChunkLayout.ChunkRef(2, 0), layout.locate(3));
        assertEquals(new ChunkLayout.ChunkRef(3, 4), layout.locate(8));
    }

    @Test
    void locateInvertsGlobalId() {
        FolderManifest folder = new FolderManifest("root", "/src", 0, 3, 4, List.of(
                file("a", 9, 4), file("b", 4, 4), file("c", 17, 4)));
        ChunkLayout layout = ChunkLayout.of(folder);

        int expected = 0;
        for (ChunkLayout.FileSlot slot : layout.slots()) {
            for (int local = 0; local < slot.chunkCount(); local++) {
                int global = layout.globalId(slot.fileIndex(), local);
                assertEquals(expected++, global);
                assertEquals(new ChunkLayout.ChunkRef(slot.fileIndex(), local), layout.locate(global));
            }
        }
        assertEquals(layout.totalChunks(), expected);
    }

    @Test
    void outOfRangeIdsAreRejected() {
        ChunkLayout layout = ChunkLayout.of(file("a", 25, 10));
        assertThrows(IndexOutOfBoundsException.class, () -> layout.locate(3));
        assertThrows(IndexOutOfBoundsException.class, () -> layout.locate(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> layout.globalId(0, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> layout.slot(1));
    }
}
