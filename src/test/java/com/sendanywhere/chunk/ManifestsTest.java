package com.sendanywhere.chunk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sendanywhere.error.ErrorCategory;
import com.sendanywhere.error.TransferException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestsTest {

    @Test
    void jsonCarriesExplicitKind(@TempDir Path tempDir) throws Exception {
        Path root = tempDir.resolve("docs");
        Files.createDirectories(root);
        Files.writeString(root.resolve("a.txt"), "hello");
        ChunkManager cm = new ChunkManager(4);

        JsonNode file = Manifests.toTree(cm.createManifest(root.resolve("a.txt")));
        assertEquals("file", file.get("kind").asText());
        assertEquals("a.txt", file.get("fileName").asText());
        assertEquals(2, file.get("totalChunks").asInt());
        assertFalse(file.has("relativePath"));

        JsonNode folder = Manifests.toTree(cm.createManifest(root));
        assertEquals("folder", folder.get("kind").asText());
        assertEquals("docs", folder.get("folderName").asText());
        assertEquals("a.txt", folder.get("files").get(0).get("relativePath").asText());
    }

    @Test
    void parseRestoresTheVariant(@TempDir Path tempDir) throws Exception {
        Path root = tempDir.resolve("docs");
        Files.createDirectories(root.resolve("sub"));
        Files.writeString(root.resolve("sub/b.txt"), "0123456789");
        FolderManifest original = new ChunkManager(4).createFolderManifest(root);

        Manifest parsed = Manifests.parse(Manifests.toJson(original));
        assertEquals(original, parsed);
    }

    @Test
    void malformedJsonIsInvalidInput() {
        TransferException e = assertThrows(TransferException.class, () -> Manifests.parse("{not json"));
        assertEquals(ErrorCategory.INVALID_INPUT, e.category());

        TransferException noKind = assertThrows(TransferException.class,
                () -> Manifests.parse("{\"fileName\":\"a\",\"size\":1,\"chunkSize\":1,\"totalChunks\":1}"));
        assertEquals(ErrorCategory.INVALID_INPUT, noKind.category());
    }

    @Test
    void inconsistentChunkCountIsRejected(@TempDir Path tempDir) throws Exception {
        Path f = tempDir.resolve("f.txt");
        Files.writeString(f, "0123456789");
        ObjectNode tree = (ObjectNode) Manifests.toTree(new ChunkManager(4).createFileManifest(f));
        tree.put("totalChunks", 2);

        TransferException e = assertThrows(TransferException.class, () -> Manifests.fromTree(tree));
        assertEquals(ErrorCategory.INVALID_INPUT, e.category());
    }

    @Test
    void folderEntriesMayNotEscapeTheRoot() {
        FileManifest evil = new FileManifest("x", "/tmp/x", 0, 4, 0, "00".repeat(32), List.of(), "../x");
        FolderManifest folder = new FolderManifest("f", "/tmp", 0, 1, 4, List.of(evil));
        assertThrows(TransferException.class, () -> Manifests.validate(folder));

        FileManifest absolute = evil.withRelativePath("/etc/passwd");
        assertThrows(TransferException.class,
                () -> Manifests.validate(new FolderManifest("f", "/tmp", 0, 1, 4, List.of(absolute))));
    }

    private static ObjectNode fileTree(Path tempDir) throws Exception {
        Path f = tempDir.resolve("f.txt");
        Files.writeString(f, "0123456789");
        return (ObjectNode) Manifests.toTree(new ChunkManager(4).createFileManifest(f));
    }

    private static void assertInvalid(JsonNode tree) {
        TransferException e = assertThrows(TransferException.class, () -> Manifests.fromTree(tree));
        assertEquals(ErrorCategory.INVALID_INPUT, e.category());
        TransferException parsed = assertThrows(TransferException.class, () -> Manifests.parse(tree.toString()));
        assertEquals(ErrorCategory.INVALID_INPUT, parsed.category());
    }

    @Test
    void fileHashMustBeSha256Hex(@TempDir Path tempDir) throws Exception {
        ObjectNode tree = fileTree(tempDir);

        assertInvalid(tree.deepCopy().putNull("hash"));
        assertInvalid(tree.deepCopy().put("hash", "not-hex"));
        assertInvalid(tree.deepCopy().put("hash", "0123456789abcdef0123456789abcdef"));
        assertInvalid(tree.deepCopy().put("hash", "zz".repeat(32)));

        ObjectNode upper = tree.deepCopy();
        upper.put("hash", tree.get("hash").asText().toUpperCase());
        assertNotNull(Manifests.fromTree(upper));
    }

    @Test
    void chunkHashMustBeSha256Hex(@TempDir Path tempDir) throws Exception {
        ObjectNode tree = fileTree(tempDir);

        ObjectNode nullChunkHash = tree.deepCopy();
        ((ObjectNode) nullChunkHash.get("chunks").get(1)).putNull("hash");
        assertInvalid(nullChunkHash);

        ObjectNode shortChunkHash = tree.deepCopy();
        ((ObjectNode) shortChunkHash.get("chunks").get(2)).put("hash", "abcd");
        assertInvalid(shortChunkHash);
    }

    @Test
    void missingChunkListIsRejected(@TempDir Path tempDir) throws Exception {
        ObjectNode tree = fileTree(tempDir);
        tree.remove("chunks");
        assertInvalid(tree);
    }

    @Test
    void folderEntriesNeedNameChunksAndDigest(@TempDir Path tempDir) throws Exception {
        Path root = tempDir.resolve("docs");
        Files.createDirectories(root);
        Files.writeString(root.resolve("a.txt"), "0123456789");
        ObjectNode tree = (ObjectNode) Manifests.toTree(new ChunkManager(4).createFolderManifest(root));
        assertNotNull(Manifests.fromTree(tree));

        ObjectNode noName = tree.deepCopy();
        ((ObjectNode) noName.get("files").get(0)).remove("fileName");
        assertInvalid(noName);

        ObjectNode noChunks = tree.deepCopy();
        ((ObjectNode) noChunks.get("files").get(0)).remove("chunks");
        assertInvalid(noChunks);

        ObjectNode badHash = tree.deepCopy();
        ((ObjectNode) badHash.get("files").get(0)).put("hash", "not-hex");
        assertInvalid(badHash);

        ObjectNode noFolderName = tree.deepCopy();
        noFolderName.remove("folderName");
        assertInvalid(noFolderName);
    }
}
