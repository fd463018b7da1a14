package com.sendanywhere.transfer;

import com.sendanywhere.chunk.ChunkInfo;
import com.sendanywhere.chunk.FileManifest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PartialDownloadStateTest {

    private static FileManifest manifest(String name, long size, int chunkSize, byte[] sha256) {
        int total = FileManifest.chunkCount(size, chunkSize);
        List<ChunkInfo> chunks = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            int len = (int) Math.min(chunkSize, size - (long) i * chunkSize);
            chunks.add(new ChunkInfo(i, "00".repeat(32), len));
        }
        return new FileManifest(name, "/tmp/" + name, size, chunkSize, total,
                HexFormat.of().formatHex(sha256), chunks, null);
    }

    @Test
    void saveAndLoad(@TempDir Path tempDir) throws Exception {
        Path outputFile = tempDir.resolve("test.bin");
        Files.writeString(outputFile, "dummy");

        byte[] sha256 = new byte[32];
        new Random(1).nextBytes(sha256);
        BitSet done = new BitSet();
        done.set(0);
        done.set(3);
        done.set(9);

        PartialDownloadState state = new PartialDownloadState(1_000_000, 100_000, 10, sha256, "test.bin", done);
        state.save(outputFile);

        assertTrue(Files.exists(PartialDownloadState.partialPath(outputFile)));
        assertEquals("test.bin.sa-partial", PartialDownloadState.partialPath(outputFile).getFileName().toString());

        PartialDownloadState loaded = PartialDownloadState.load(outputFile);
        assertNotNull(loaded);
        assertEquals(1_000_000, loaded.fileSize());
        assertEquals(100_000, loaded.chunkSize());
        assertEquals(10, loaded.totalChunks());
        assertEquals("test.bin", loaded.filename());
        assertEquals(3, loaded.doneCount());
        assertEquals(List.of(1, 2, 4, 5, 6, 7, 8), loaded.missingChunks());
    }

    @Test
    void forFileMarksEverythingOutsideMissingAsDone() {
        byte[] sha256 = new byte[32];
        PartialDownloadState state = PartialDownloadState.forFile(manifest("a.bin", 500, 100, sha256), List.of(1, 4));
        assertEquals(3, state.doneCount());
        assertTrue(state.isDone(0));
        assertFalse(state.isDone(1));

        state.markDone(4);
        assertEquals(List.of(1), state.missingChunks());
    }

    @Test
    void loadReturnsNullWhenMissing(@TempDir Path tempDir) {
        assertNull(PartialDownloadState.load(tempDir.resolve("nonexistent.bin")));
    }

    @Test
    void loadReturnsNullForCorruptFile(@TempDir Path tempDir) throws Exception {
        Path outputFile = tempDir.resolve("corrupt.bin");
        Files.write(PartialDownloadState.partialPath(outputFile), new byte[]{1, 2, 3});
        assertNull(PartialDownloadState.load(outputFile));
    }

    @Test
    void loadReturnsNullForTruncatedBitmap(@TempDir Path tempDir) throws Exception {
        Path outputFile = tempDir.resolve("torn.bin");
        BitSet done = new BitSet();
        done.set(0, 40);
        new PartialDownloadState(4000, 100, 40, new byte[32], "torn.bin", done).save(outputFile);

        Path sidecar = PartialDownloadState.partialPath(outputFile);
        byte[] data = Files.readAllBytes(sidecar);
        Files.write(sidecar, Arrays.copyOf(data, data.length - 2));
        assertNull(PartialDownloadState.load(outputFile));
    }

    @Test
    void deleteRemovesSidecar(@TempDir Path tempDir) throws Exception {
        Path outputFile = tempDir.resolve("del.bin");
        new PartialDownloadState(100, 50, 2, new byte[32], "del.bin", new BitSet()).save(outputFile);
        assertTrue(Files.exists(PartialDownloadState.partialPath(outputFile)));

        PartialDownloadState.delete(outputFile);
        assertFalse(Files.exists(PartialDownloadState.partialPath(outputFile)));
        PartialDownloadState.delete(outputFile);
    }

    @Test
    void matchesChecksAllFields() {
        byte[] sha256 = new byte[32];
        new Random(42).nextBytes(sha256);
        PartialDownloadState state = new PartialDownloadState(1000, 100, 10, sha256, "file.txt", new BitSet());

        assertTrue(state.matches(manifest("file.txt", 1000, 100, sha256)));
        assertFalse(state.matches(manifest("other.txt", 1000, 100, sha256)));
        assertFalse(state.matches(manifest("file.txt", 2000, 100, sha256)));
        assertFalse(state.matches(manifest("file.txt", 1000, 250, sha256)));

        byte[] otherHash = new byte[32];
        new Random(99).nextBytes(otherHash);
        assertFalse(state.matches(manifest("file.txt", 1000, 100, otherHash)));
    }
}
