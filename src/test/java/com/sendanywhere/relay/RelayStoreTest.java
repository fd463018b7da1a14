package com.sendanywhere.relay;

import com.sendanywhere.chunk.ChunkManager;
import com.sendanywhere.chunk.ChunkReceipt;
import com.sendanywhere.chunk.Digests;
import com.sendanywhere.chunk.FileManifest;
import com.sendanywhere.error.ErrorCategory;
import com.sendanywhere.error.NotFoundException;
import com.sendanywhere.error.NotFoundReason;
import com.sendanywhere.error.TransferException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RelayStoreTest {

    private static final int MB = 1024 * 1024;
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static FileManifest manifestOf(Path dir, String name, int size, int chunkSize) throws Exception {
        byte[] data = new byte[size];
        new Random(size).nextBytes(data);
        Path f = dir.resolve(name);
        Files.write(f, data);
        return new ChunkManager(chunkSize).createFileManifest(f);
    }

    private static RelayStore storeAt(Path root, Instant now) {
        return new RelayStore(root, Duration.ofHours(24), Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void fiveMegabytesInOneMegabyteChunksCompletes(@TempDir Path tempDir) throws Exception {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        FileManifest manifest = manifestOf(src, "five.bin", 5 * MB, MB);
        assertEquals(5, manifest.totalChunks());

        RelayStore store = new RelayStore(tempDir.resolve("uploads"), Duration.ofHours(24));
        store.create("t-5mb", manifest);

        ChunkManager cm = new ChunkManager(MB);
        for (int i = 0; i < 5; i++) {
            RelayStatus before = store.status("t-5mb");
            assertEquals(i, before.uploadedChunks());
            assertFalse(before.complete());
            store.putChunk("t-5mb", i, cm.readChunk(src.resolve("five.bin"), i));
        }

        RelayStatus status = store.status("t-5mb");
        assertTrue(status.complete());
        assertEquals(100.0, status.progress());
        assertEquals(5, status.totalChunks());
        assertEquals(List.of(0, 1, 2, 3, 4), status.availableChunks());
    }

    @Test
    void progressIsRoundedToTwoDecimals(@TempDir Path tempDir) throws Exception {
        FileManifest manifest = manifestOf(tempDir, "three.bin", 3 * 10, 10);
        RelayStore store = new RelayStore(tempDir.resolve("uploads"), Duration.ofHours(24));
        store.create("t3", manifest);
        store.putChunk("t3", 1, new byte[10]);

        RelayStatus status = store.status("t3");
        assertEquals(33.33, status.progress());
        assertEquals(List.of(1), status.availableChunks());
        assertFalse(status.complete());
    }

    @Test
    void unknownTransferAndPendingChunkAreDistinguished(@TempDir Path tempDir) throws Exception {
        RelayStore store = new RelayStore(tempDir.resolve("uploads"), Duration.ofHours(24));

        NotFoundException unknown = assertThrows(NotFoundException.class, () -> store.getChunk("nobody", 3));
        assertEquals(NotFoundReason.TRANSFER_UNKNOWN, unknown.reason());
        assertFalse(unknown.isRetryable());

        store.create("registered", manifestOf(tempDir, "f.bin", 50, 10));
        NotFoundException pending = assertThrows(NotFoundException.class, () -> store.getChunk("registered", 3));
        assertEquals(NotFoundReason.CHUNK_PENDING, pending.reason());
        assertTrue(pending.isRetryable());
    }

    @Test
    void putReturnsReceiptAndGetReturnsBytes(@TempDir Path tempDir) throws Exception {
        RelayStore store = new RelayStore(tempDir.resolve("uploads"), Duration.ofHours(24));
        store.create("abc", manifestOf(tempDir, "f.bin", 25, 10));

        byte[] chunk = "0123456789".getBytes();
        ChunkReceipt receipt = store.putChunk("abc", 0, chunk);
        assertEquals(0, receipt.chunkId());
        assertEquals(10, receipt.size());
        assertEquals(Digests.sha256Hex(chunk), receipt.hash());
        assertTrue(receipt.matches(chunk));
        assertArrayEquals(chunk, store.getChunk("abc", 0));

        assertTrue(Files.exists(tempDir.resolve("uploads/abc/chunks/chunk_000000")));
        assertTrue(Files.exists(tempDir.resolve("uploads/abc/manifest.json")));
    }

    @Test
    void manifestRoundTripsThroughStorage(@TempDir Path tempDir) throws Exception {
        FileManifest manifest = manifestOf(tempDir, "f.bin", 25, 10);
        RelayStore store = storeAt(tempDir.resolve("uploads"), T0);
        store.create("m1", manifest);

        assertEquals(manifest, store.getManifest("m1"));
        assertEquals(T0, store.createdAt("m1"));
    }

    @Test
    void invalidIdsAreRejected(@TempDir Path tempDir) throws Exception {
        RelayStore store = new RelayStore(tempDir.resolve("uploads"), Duration.ofHours(24));
        FileManifest manifest = manifestOf(tempDir, "f.bin", 25, 10);

        TransferException traversal = assertThrows(TransferException.class, () -> store.create("../evil", manifest));
        assertEquals(ErrorCategory.INVALID_INPUT, traversal.category());

        store.create("ok", manifest);
        TransferException negative = assertThrows(TransferException.class, () -> store.putChunk("ok", -1, new byte[1]));
        assertEquals(ErrorCategory.INVALID_INPUT, negative.category());
    }

    @Test
    void corruptManifestIsReportedAsSuch(@TempDir Path tempDir) throws Exception {
        Path root = tempDir.resolve("uploads");
        RelayStore store = new RelayStore(root, Duration.ofHours(24));
        store.create("bad", manifestOf(tempDir, "f.bin", 25, 10));
        Files.writeString(root.resolve("bad/manifest.json"), "{ truncated");

        TransferException e = assertThrows(TransferException.class, () -> store.status("bad"));
        assertEquals(ErrorCategory.MANIFEST_CORRUPT, e.category());
    }

    @Test
    void deleteRemovesEverything(@TempDir Path tempDir) throws Exception {
        Path root = tempDir.resolve("uploads");
        RelayStore store = new RelayStore(root, Duration.ofHours(24));
        store.create("gone", manifestOf(tempDir, "f.bin", 25, 10));
        store.putChunk("gone", 0, new byte[10]);

        store.delete("gone");
        assertFalse(Files.exists(root.resolve("gone")));
        assertThrows(NotFoundException.class, () -> store.status("gone"));
        assertThrows(NotFoundException.class, () -> store.delete("gone"));
    }

    @Test
    void sweepRemovesOnlyEntriesOlderThanRetention(@TempDir Path tempDir) throws Exception {
        Path root = tempDir.resolve("uploads");
        FileManifest manifest = manifestOf(tempDir, "f.bin", 25, 10);

        storeAt(root, T0).create("old", manifest);
        storeAt(root, T0.plus(Duration.ofHours(20))).create("recent", manifest);
        storeAt(root, T0.plus(Duration.ofHours(25))).create("fresh", manifest);

        RelayStore sweeper = storeAt(root, T0.plus(Duration.ofHours(26)));
        assertEquals(List.of("old"), sweeper.sweep());
        assertEquals(List.of("fresh", "recent"), sweeper.transferIds());

        assertTrue(sweeper.sweep().isEmpty());
    }

    @Test
    void sweepAgesDirectoriesWithoutManifestByModificationTime(@TempDir Path tempDir) throws Exception {
        Path root = tempDir.resolve("uploads");
        Path stale = Files.createDirectories(root.resolve("abandoned/chunks"));
        Path fresh = Files.createDirectories(root.resolve("starting/chunks"));
        Files.setLastModifiedTime(stale.getParent(), FileTime.from(T0));
        Files.setLastModifiedTime(fresh.getParent(), FileTime.from(T0.plus(Duration.ofHours(47))));

        RelayStore store = storeAt(root, T0.plus(Duration.ofHours(48)));
        assertEquals(List.of("abandoned"), store.sweep());
        assertFalse(Files.exists(root.resolve("abandoned")));
        assertTrue(Files.exists(root.resolve("starting")));
    }

    @Test
    void sweepOnMissingRootIsEmpty(@TempDir Path tempDir) throws Exception {
        RelayStore store = new RelayStore(tempDir.resolve("never-created"), Duration.ofHours(24));
        assertTrue(store.sweep().isEmpty());
        assertTrue(store.transferIds().isEmpty());
    }
}
