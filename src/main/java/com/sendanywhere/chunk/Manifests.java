package com.sendanywhere.chunk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sendanywhere.config.Json;
import com.sendanywhere.error.TransferException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * JSON encoding and structural validation of manifests.
 */
public final class Manifests {

    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-fA-F]{64}");

    private Manifests() {}

    public static String toJson(Manifest manifest) {
        try {
            return Json.mapper().writeValueAsString(manifest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Manifest not serializable", e);
        }
    }

    public static JsonNode toTree(Manifest manifest) {
        return Json.mapper().valueToTree(manifest);
    }

    /**
     * Parse and validate. Anything malformed is {@code INVALID_INPUT}.
     */
    public static Manifest parse(String json) throws TransferException {
        Manifest manifest;
        try {
            manifest = Json.mapper().readValue(json, Manifest.class);
        } catch (JsonProcessingException e) {
            throw TransferException.invalidInput("Malformed manifest: " + e.getOriginalMessage());
        }
        validate(manifest);
        return manifest;
    }

    public static Manifest fromTree(JsonNode tree) throws TransferException {
        Manifest manifest;
        try {
            manifest = Json.mapper().treeToValue(tree, Manifest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw TransferException.invalidInput("Malformed manifest: " + e.getMessage());
        }
        validate(manifest);
        return manifest;
    }

    public static void validate(Manifest manifest) throws TransferException {
        if (manifest == null) {
            throw TransferException.invalidInput("Missing manifest");
        }
        if (manifest instanceof FileManifest file) {
            validateFile(file, file.chunkSize());
        } else {
            FolderManifest folder = (FolderManifest) manifest;
            if (folder.folderName() == null) {
                throw TransferException.invalidInput("Folder manifest without folderName");
            }
            if (folder.chunkSize() <= 0) {
                throw TransferException.invalidInput("Invalid chunkSize: " + folder.chunkSize());
            }
            for (FileManifest file : folder.files()) {
                validateFile(file, folder.chunkSize());
                if (file.relativePath() == null || file.relativePath().isBlank()) {
                    throw TransferException.invalidInput("Folder entry " + file.fileName() + " has no relativePath");
                }
                if (escapesRoot(file.relativePath())) {
                    throw TransferException.invalidInput("Folder entry escapes its root: " + file.relativePath());
                }
            }
        }
    }

    private static void validateFile(FileManifest file, int expectedChunkSize) throws TransferException {
        if (file.fileName() == null || file.fileName().isBlank()) {
            throw TransferException.invalidInput("File manifest without fileName");
        }
        if (file.chunkSize() <= 0 || file.chunkSize() != expectedChunkSize) {
            throw TransferException.invalidInput("Invalid chunkSize " + file.chunkSize() + " for " + file.fileName());
        }
        if (file.size() < 0 || file.totalChunks() != FileManifest.chunkCount(file.size(), file.chunkSize())) {
            throw TransferException.invalidInput("totalChunks " + file.totalChunks()
                    + " does not match size " + file.size() + " for " + file.fileName());
        }
        if (!isSha256(file.hash())) {
            throw TransferException.invalidInput("File hash of " + file.fileName() + " is not a SHA-256 hex digest");
        }
        List<ChunkInfo> chunks = file.chunks();
        if (chunks.size() != file.totalChunks()) {
            throw TransferException.invalidInput("Expected " + file.totalChunks() + " chunk entries for "
                    + file.fileName() + ", got " + chunks.size());
        }
        for (int i = 0; i < chunks.size(); i++) {
            ChunkInfo chunk = chunks.get(i);
            if (chunk.id() != i) {
                throw TransferException.invalidInput("Chunk ids of " + file.fileName() + " are not contiguous at " + i);
            }
            if (!isSha256(chunk.hash())) {
                throw TransferException.invalidInput("Chunk " + i + " of " + file.fileName() + " has no SHA-256 hex digest");
            }
        }
    }

    private static boolean isSha256(String hash) {
        return hash != null && SHA256_HEX.matcher(hash).matches();
    }

    private static boolean escapesRoot(String relativePath) {
        if (relativePath.startsWith("/") || relativePath.startsWith("\\") || relativePath.contains(":")) {
            return true;
        }
        for (String part : relativePath.split("[/\\\\]")) {
            if (part.equals("..")) {
                return true;
            }
        }
        return false;
    }
}
