package com.sendanywhere.chunk;

import com.sendanywhere.error.ErrorCategory;
import com.sendanywhere.error.NotFoundException;
import com.sendanywhere.error.NotFoundReason;
import com.sendanywhere.error.TransferException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ChunkManagerTest {

    private static final int CHUNK = 1024;

    private static byte[] randomBytes(int n, long seed) {
        byte[] data = new byte[n];
        new Random(seed).nextBytes(data);
        return data;
    }

    @Test
    void totalChunksIsCeilOfSizeOverChunkSize(@TempDir Path tempDir) throws Exception {
        ChunkManager cm = new ChunkManager(CHUNK);
        for (int size : new int[]{0, 1, CHUNK - 1, CHUNK, CHUNK + 1, 5 * CHUNK, 5 * CHUNK + 7}) {
            Path f = tempDir.resolve("f" + size);
            Files.write(f, randomBytes(size, size));
            FileManifest m = cm.createFileManifest(f);
            assertEquals((size + CHUNK - 1) / CHUNK, m.totalChunks(), "size " + size);
            assertEquals(m.totalChunks(), m.chunks().size());
            assertEquals(size, m.size());
        }
    }

    @Test
    void manifestHashesMatchReadChunks(@TempDir Path tempDir) throws Exception {
        byte[] data = randomBytes(3 * CHUNK + 100, 7);
        Path f = tempDir.resolve("data.bin");
        Files.write(f, data);

        ChunkManager cm = new ChunkManager(CHUNK);
        FileManifest m = cm.createFileManifest(f);

        assertEquals("data.bin", m.fileName());
        assertEquals(Digests.sha256Hex(data), m.hash());
        assertNull(m.relativePath());
        for (ChunkInfo info : m.chunks()) {
            byte[] chunk = cm.readChunk(f, info.id());
            assertEquals(info.hash(), Digests.sha256Hex(chunk));
            assertEquals(info.size(), chunk.length);
        }
        assertEquals(100, m.chunks().get(3).size());
    }

    @Test
    void createManifestRejectsMissingAndNonRegular(@TempDir Path tempDir) {
        ChunkManager cm = new ChunkManager(CHUNK);

        NotFoundException nf = assertThrows(NotFoundException.class,
                () -> cm.createFileManifest(tempDir.resolve("nope")));
        assertEquals(NotFoundReason.FILE_UNKNOWN, nf.reason());

        TransferException dir = assertThrows(TransferException.class, () -> cm.createFileManifest(tempDir));
        assertEquals(ErrorCategory.INVALID_INPUT, dir.category());
    }

    @Test
    void folderManifestIsSortedWithSlashSeparators(@TempDir Path tempDir) throws Exception {
        Path root = tempDir.resolve("album");
        Files.createDirectories(root.resolve("b/nested"));
        Files.write(root.resolve("z.txt"), randomBytes(10, 1));
        Files.write(root.resolve("a.txt"), randomBytes(CHUNK * 2, 2));
        Files.write(root.resolve("b/nested/c.bin"), randomBytes(CHUNK + 1, 3));
        Files.write(root.resolve("b/empty.dat"), new byte[0]);

        ChunkManager cm = new ChunkManager(CHUNK);
        Manifest manifest = cm.createManifest(root);
        FolderManifest folder = assertInstanceOf(FolderManifest.class, manifest);

        assertEquals("album", folder.folderName());
        assertEquals(4, folder.totalFiles());
        assertEquals(List.of("a.txt", "b/empty.dat", "b/nested/c.bin", "z.txt"),
                folder.files().stream().map(FileManifest::relativePath).collect(Collectors.toList()));
        assertEquals(10 + CHUNK * 2 + CHUNK + 1, folder.totalSize());
        assertEquals(2 + 0 + 2 + 1, folder.totalChunks());
    }

    @Test
    void folderManifestRequiresDirectory(@TempDir Path tempDir) throws Exception {
        Path f = tempDir.resolve("file.txt");
        Files.writeString(f, "x");
        TransferException e = assertThrows(TransferException.class,
                () -> new ChunkManager(CHUNK).createFolderManifest(f));
        assertEquals(ErrorCategory.INVALID_INPUT, e.category());
    }

    @Test
    void writingChunksInAnyOrderReproducesFile(@TempDir Path tempDir) throws Exception {
        byte[] data = randomBytes(4 * CHUNK + 33, 11);
        Path src = tempDir.resolve("src.bin");
        Files.write(src, data);
        ChunkManager cm = new ChunkManager(CHUNK);
        FileManifest m = cm.createFileManifest(src);

        List<Integer> order = new ArrayList<>(IntStream.range(0, m.totalChunks()).boxed().collect(Collectors.toList()));
        Collections.shuffle(order, new Random(5));

        Path dst = tempDir.resolve("out/sub/dst.bin");
        for (int id : order) {
            cm.writeChunk(dst, id, cm.readChunk(src, id));
        }
        assertArrayEquals(data, Files.readAllBytes(dst));
        assertTrue(cm.verifyFile(dst, m.hash()));
    }

    @Test
    void writeChunkLeavesOtherBytesAlone(@TempDir Path tempDir) throws Exception {
        Path f = tempDir.resolve("f.bin");
        byte[] original = randomBytes(3 * CHUNK, 9);
        Files.write(f, original);

        byte[] patch = randomBytes(CHUNK, 10);
        new ChunkManager(CHUNK).writeChunk(f, 1, patch);

        byte[] after = Files.readAllBytes(f);
        assertEquals(original.length, after.length);
        for (int i = 0; i < CHUNK; i++) {
            assertEquals(original[i], after[i]);
            assertEquals(patch[i], after[CHUNK + i]);
            assertEquals(original[2 * CHUNK + i], after[2 * CHUNK + i]);
        }
    }

    @Test
    void readChunkBeyondEndIsIoFailure(@TempDir Path tempDir) throws Exception {
        Path f = tempDir.resolve("f.bin");
        Files.write(f, randomBytes(CHUNK, 1));
        ChunkManager cm = new ChunkManager(CHUNK);

        TransferException e = assertThrows(TransferException.class, () -> cm.readChunk(f, 1));
        assertEquals(ErrorCategory.IO_FAILURE, e.category());
        assertThrows(TransferException.class, () -> cm.readChunk(f, -1));
    }

    @Test
    void verifyChunkAndFileReportMismatchWithoutThrowing(@TempDir Path tempDir) throws Exception {
        Path f = tempDir.resolve("f.bin");
        Files.write(f, randomBytes(2 * CHUNK, 4));
        ChunkManager cm = new ChunkManager(CHUNK);
        FileManifest m = cm.createFileManifest(f);

        assertTrue(cm.verifyChunk(f, 0, m.chunks().get(0).hash()));
        assertFalse(cm.verifyChunk(f, 0, m.chunks().get(1).hash()));
        assertFalse(cm.verifyChunk(f, 5, m.chunks().get(0).hash()));
        assertFalse(cm.verifyFile(tempDir.resolve("missing"), m.hash()));
        assertFalse(cm.verifyFile(f, Digests.sha256Hex(new byte[0])));
    }

    @Test
    void missingChunksFollowsFileSize(@TempDir Path tempDir) throws Exception {
        ChunkManager cm = new ChunkManager(CHUNK);
        Path f = tempDir.resolve("partial.bin");

        assertEquals(List.of(0, 1, 2, 3), cm.getMissingChunks(f, 4));

        Files.write(f, new byte[CHUNK * 2 + 10]);
        assertEquals(List.of(2, 3), cm.getMissingChunks(f, 4));

        Files.write(f, new byte[CHUNK * 4]);
        assertTrue(cm.getMissingChunks(f, 4).isEmpty());

        Files.write(f, new byte[0]);
        assertEquals(List.of(0, 1, 2, 3), cm.getMissingChunks(f, 4));
    }

    @Test
    void modeSelectsDefaultChunkSize() {
        assertEquals(2 * 1024 * 1024, new ChunkManager(TransferMode.LAN).chunkSize());
        assertEquals(512 * 1024, new ChunkManager(TransferMode.WEBRTC).chunkSize());
        assertEquals(1024 * 1024, new ChunkManager(TransferMode.RELAY).chunkSize());
        assertThrows(IllegalArgumentException.class, () -> new ChunkManager(0));
    }
}
