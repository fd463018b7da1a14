package com.sendanywhere.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sendanywhere.chunk.ChunkReceipt;
import com.sendanywhere.chunk.Digests;
import com.sendanywhere.chunk.Manifest;
import com.sendanywhere.chunk.Manifests;
import com.sendanywhere.config.Json;
import com.sendanywhere.error.ErrorCategory;
import com.sendanywhere.error.NotFoundException;
import com.sendanywhere.error.TransferException;
import com.sendanywhere.transfer.ChunkTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Filesystem-backed chunk storage for relay transfers.
 *
 * <pre>
 * root/
 *   {transferId}/
 *     manifest.json          {"created_at": ..., "manifest": {...}}
 *     chunks/chunk_000000
 *     chunks/chunk_000001
 * </pre>
 *
 * There is no in-memory index: which chunks exist is read from the chunk
 * directory on every call, so the store survives restarts and tolerates
 * concurrent writers of distinct chunk ids. Every file is written to a temp
 * name and moved into place, so readers never see a partial chunk.
 */
public class RelayStore {

    private static final Logger log = LoggerFactory.getLogger(RelayStore.class);

    static final String MANIFEST_FILE = "manifest.json";
    static final String CHUNK_DIR = "chunks";
    private static final Pattern TRANSFER_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    private static final Pattern CHUNK_NAME = Pattern.compile("chunk_(\\d+)");

    private final Path root;
    private final Duration retention;
    private final Clock clock;

    public RelayStore(Path root, Duration retention) {
        this(root, retention, Clock.systemUTC());
    }

    public RelayStore(Path root, Duration retention, Clock clock) {
        this.root = root;
        this.retention = retention;
        this.clock = clock;
    }

    public Path root() {
        return root;
    }

    public Duration retention() {
        return retention;
    }

    /**
     * Allocate storage for a transfer and persist its manifest with a creation
     * timestamp. Creating an existing transfer again replaces its manifest and
     * timestamp but keeps chunks already uploaded.
     */
    public void create(String transferId, Manifest manifest) throws TransferException {
        checkTransferId(transferId);
        Manifests.validate(manifest);
        Path dir = transferDir(transferId);
        try {
            Files.createDirectories(dir.resolve(CHUNK_DIR));
            ObjectNode record = Json.mapper().createObjectNode();
            record.put("created_at", clock.instant().toString());
            record.set("manifest", Manifests.toTree(manifest));
            writeAtomically(dir.resolve(MANIFEST_FILE), Json.mapper().writeValueAsBytes(record));
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to create transfer " + transferId + ": " + e.getMessage(), e);
        }
        log.info("Created transfer {} ({}, {} chunks)", transferId, manifest.name(), manifest.totalChunks());
    }

    /**
     * Store one chunk, replacing any previous copy, and report its digest.
     */
    public ChunkReceipt putChunk(String transferId, int chunkId, byte[] data) throws TransferException {
        checkChunkId(chunkId);
        Path chunkDir = existingTransferDir(transferId).resolve(CHUNK_DIR);
        try {
            Files.createDirectories(chunkDir);
            writeAtomically(chunkDir.resolve(chunkFileName(chunkId)), data);
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to store chunk " + chunkId + " of " + transferId + ": " + e.getMessage(), e);
        }
        log.debug("Stored chunk {} of {} ({} bytes)", chunkId, transferId, data.length);
        return new ChunkReceipt(chunkId, Digests.sha256Hex(data), data.length);
    }

    /**
     * Read one chunk. Not-found failures say whether the transfer is unknown
     * or the chunk simply has not been uploaded yet.
     */
    public byte[] getChunk(String transferId, int chunkId) throws TransferException {
        checkChunkId(chunkId);
        Path dir = existingTransferDir(transferId);
        Path chunk = dir.resolve(CHUNK_DIR).resolve(chunkFileName(chunkId));
        if (!Files.exists(chunk)) {
            throw NotFoundException.chunkPending(chunkId);
        }
        if (!Files.isRegularFile(chunk)) {
            throw new TransferException(ErrorCategory.IO_FAILURE, "Chunk " + chunkId + " exists but is not a file");
        }
        try {
            return Files.readAllBytes(chunk);
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to read chunk " + chunkId + " of " + transferId + ": " + e.getMessage(), e);
        }
    }

    public Manifest getManifest(String transferId) throws TransferException {
        return readRecord(existingTransferDir(transferId), transferId).manifest();
    }

    public Instant createdAt(String transferId) throws TransferException {
        return readRecord(existingTransferDir(transferId), transferId).createdAt();
    }

    /**
     * Scan the chunk directory and compare the count against the manifest.
     */
    public RelayStatus status(String transferId) throws TransferException {
        Path dir = existingTransferDir(transferId);
        Manifest manifest = readRecord(dir, transferId).manifest();
        List<Integer> available = storedChunkIds(dir.resolve(CHUNK_DIR));
        return RelayStatus.of(transferId, manifest.totalChunks(), available);
    }

    public void delete(String transferId) throws TransferException {
        Path dir = existingTransferDir(transferId);
        try {
            deleteRecursively(dir);
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to delete transfer " + transferId + ": " + e.getMessage(), e);
        }
        log.info("Deleted transfer {}", transferId);
    }

    /**
     * Remove every transfer created before {@code now - retention}.
     * A transfer whose manifest cannot be read is aged by its directory's
     * modification time instead. So is a directory with no manifest at all;
     * it is removed once stale rather than skipped.
     *
     * @return ids of the removed transfers
     */
    public List<String> sweep() throws TransferException {
        List<String> removed = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return removed;
        }
        Instant cutoff = clock.instant().minus(retention);
        for (String transferId : transferIds()) {
            Path dir = transferDir(transferId);
            Instant created = creationTimeForSweep(dir, transferId);
            if (created != null && created.isBefore(cutoff)) {
                try {
                    deleteRecursively(dir);
                    removed.add(transferId);
                } catch (IOException e) {
                    throw TransferException.ioFailure("Failed to remove expired transfer " + transferId + ": " + e.getMessage(), e);
                }
            }
        }
        if (!removed.isEmpty()) {
            log.info("Sweep removed {} transfer(s) older than {}: {}", removed.size(), retention, removed);
        }
        return removed;
    }

    /**
     * Ids of every transfer currently in storage, sorted.
     */
    public List<String> transferIds() throws TransferException {
        List<String> ids = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return ids;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                if (TRANSFER_ID.matcher(name).matches()) {
                    ids.add(name);
                }
            }
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to list " + root + ": " + e.getMessage(), e);
        }
        Collections.sort(ids);
        return ids;
    }

    /**
     * In-process transport over this store, scoped to one transfer.
     */
    public ChunkTransport transport(String transferId) {
        return new LocalRelayTransport(this, transferId);
    }

    // --- internals ---

    private record StoredManifest(Instant createdAt, Manifest manifest) {}

    private StoredManifest readRecord(Path dir, String transferId) throws TransferException {
        Path file = dir.resolve(MANIFEST_FILE);
        if (!Files.exists(file)) {
            throw NotFoundException.transferUnknown(transferId);
        }
        JsonNode record;
        try {
            record = Json.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new TransferException(ErrorCategory.MANIFEST_CORRUPT,
                    "Manifest of " + transferId + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to read manifest of " + transferId + ": " + e.getMessage(), e);
        }
        if (record == null || !record.hasNonNull("created_at") || !record.has("manifest")) {
            throw new TransferException(ErrorCategory.MANIFEST_CORRUPT, "Manifest record of " + transferId + " is incomplete");
        }
        try {
            Instant createdAt = Instant.parse(record.get("created_at").asText());
            return new StoredManifest(createdAt, Manifests.fromTree(record.get("manifest")));
        } catch (DateTimeParseException e) {
            throw new TransferException(ErrorCategory.MANIFEST_CORRUPT, "Bad creation time for " + transferId, e);
        } catch (TransferException e) {
            throw new TransferException(ErrorCategory.MANIFEST_CORRUPT,
                    "Stored manifest of " + transferId + " is invalid: " + e.getMessage(), e);
        }
    }

    private Instant creationTimeForSweep(Path dir, String transferId) throws TransferException {
        try {
            return readRecord(dir, transferId).createdAt();
        } catch (NotFoundException e) {
            log.warn("Transfer directory {} has no manifest, aging it by modification time", dir);
        } catch (TransferException e) {
            if (e.category() != ErrorCategory.MANIFEST_CORRUPT) {
                throw e;
            }
            log.warn("Unreadable manifest for {}, aging it by modification time: {}", transferId, e.getMessage());
        }
        try {
            return Files.getLastModifiedTime(dir).toInstant();
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to stat " + dir + ": " + e.getMessage(), e);
        }
    }

    private static List<Integer> storedChunkIds(Path chunkDir) throws TransferException {
        List<Integer> ids = new ArrayList<>();
        if (!Files.isDirectory(chunkDir)) {
            return ids;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(chunkDir)) {
            for (Path p : stream) {
                Matcher m = CHUNK_NAME.matcher(p.getFileName().toString());
                if (m.matches()) {
                    ids.add(Integer.parseInt(m.group(1)));
                }
            }
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to list " + chunkDir + ": " + e.getMessage(), e);
        }
        Collections.sort(ids);
        return ids;
    }

    private Path existingTransferDir(String transferId) throws TransferException {
        checkTransferId(transferId);
        Path dir = transferDir(transferId);
        if (!Files.isDirectory(dir)) {
            throw NotFoundException.transferUnknown(transferId);
        }
        return dir;
    }

    private Path transferDir(String transferId) {
        return root.resolve(transferId);
    }

    static String chunkFileName(int chunkId) {
        return String.format("chunk_%06d", chunkId);
    }

    private static void checkTransferId(String transferId) throws TransferException {
        if (transferId == null || !TRANSFER_ID.matcher(transferId).matches()) {
            throw TransferException.invalidInput("Invalid transfer id: " + transferId);
        }
    }

    private static void checkChunkId(int chunkId) throws TransferException {
        if (chunkId < 0) {
            throw TransferException.invalidInput("Invalid chunk id: " + chunkId);
        }
    }

    private static void writeAtomically(Path target, byte[] data) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp-" + UUID.randomUUID());
        try {
            Files.write(tmp, data);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(d);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
