package com.sendanywhere.chunk;

import com.sendanywhere.error.ErrorCategory;
import com.sendanywhere.error.NotFoundException;
import com.sendanywhere.error.NotFoundReason;
import com.sendanywhere.error.TransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Slices files into fixed-size chunks, builds manifests and performs all local
 * chunk I/O. Chunk {@code i} of a file always covers bytes
 * {@code [i * chunkSize, min((i + 1) * chunkSize, size))}.
 */
public class ChunkManager {

    private static final Logger log = LoggerFactory.getLogger(ChunkManager.class);

    private final int chunkSize;

    public ChunkManager(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    public ChunkManager(TransferMode mode) {
        this(mode.defaultChunkSize());
    }

    public int chunkSize() {
        return chunkSize;
    }

    /**
     * Build a manifest for a file or a folder, whichever {@code path} is.
     */
    public Manifest createManifest(Path path) throws TransferException {
        if (Files.isDirectory(path)) {
            return createFolderManifest(path);
        }
        return createFileManifest(path);
    }

    /**
     * Build a manifest for one file in a single streaming pass that computes
     * every chunk digest and the whole-file digest together.
     */
    public FileManifest createFileManifest(Path file) throws TransferException {
        if (!Files.exists(file)) {
            throw new NotFoundException(NotFoundReason.FILE_UNKNOWN, "File not found: " + file);
        }
        if (!Files.isRegularFile(file)) {
            throw TransferException.invalidInput("Not a regular file: " + file);
        }

        MessageDigest fileDigest = Digests.newSha256();
        List<ChunkInfo> chunks = new ArrayList<>();
        long size = 0;
        byte[] buf = new byte[chunkSize];

        try (InputStream in = Files.newInputStream(file)) {
            int id = 0;
            int n;
            while ((n = in.readNBytes(buf, 0, chunkSize)) > 0) {
                fileDigest.update(buf, 0, n);
                chunks.add(new ChunkInfo(id++, Digests.sha256Hex(buf, 0, n), n));
                size += n;
            }
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to read " + file + ": " + e.getMessage(), e);
        }

        FileManifest manifest = new FileManifest(
                file.getFileName().toString(),
                file.toAbsolutePath().toString(),
                size,
                chunkSize,
                FileManifest.chunkCount(size, chunkSize),
                Digests.hex(fileDigest.digest()),
                chunks,
                null);
        log.debug("Manifest for {}: {} bytes, {} chunks", file, size, manifest.totalChunks());
        return manifest;
    }

    /**
     * Build a manifest for every regular file under {@code folder}, recursively.
     * Files are ordered by relative path so the same tree always yields the same
     * chunk id space.
     */
    public FolderManifest createFolderManifest(Path folder) throws TransferException {
        if (!Files.isDirectory(folder)) {
            throw TransferException.invalidInput("Invalid path, not a directory: " + folder);
        }

        List<Path> regularFiles;
        try (Stream<Path> walk = Files.walk(folder)) {
            regularFiles = walk.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> relativePath(folder, p)))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to scan " + folder + ": " + e.getMessage(), e);
        }

        List<FileManifest> files = new ArrayList<>(regularFiles.size());
        long totalSize = 0;
        for (Path p : regularFiles) {
            FileManifest fm = createFileManifest(p).withRelativePath(relativePath(folder, p));
            files.add(fm);
            totalSize += fm.size();
        }

        Path name = folder.toAbsolutePath().normalize().getFileName();
        return new FolderManifest(
                name != null ? name.toString() : folder.toString(),
                folder.toAbsolutePath().toString(),
                totalSize,
                files.size(),
                chunkSize,
                files);
    }

    private static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    /**
     * Read chunk {@code chunkId}: exactly {@code chunkSize} bytes, or the
     * remainder for the final chunk.
     */
    public byte[] readChunk(Path file, int chunkId) throws TransferException {
        if (chunkId < 0) {
            throw TransferException.invalidInput("Negative chunk id: " + chunkId);
        }
        long offset = (long) chunkId * chunkSize;
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            long length = raf.length();
            if (offset >= length && !(offset == 0 && length == 0)) {
                throw new TransferException(ErrorCategory.IO_FAILURE,
                        "Chunk " + chunkId + " starts at " + offset + " beyond end of " + file + " (" + length + " bytes)");
            }
            int toRead = (int) Math.min(chunkSize, length - offset);
            byte[] data = new byte[toRead];
            raf.seek(offset);
            raf.readFully(data);
            return data;
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to read chunk " + chunkId + " of " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Write {@code data} at {@code chunkId * chunkSize}, creating the file and
     * its parent directories if needed. Bytes outside the written range are
     * left as they are.
     */
    public void writeChunk(Path file, int chunkId, byte[] data) throws TransferException {
        if (chunkId < 0) {
            throw TransferException.invalidInput("Negative chunk id: " + chunkId);
        }
        long offset = (long) chunkId * chunkSize;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
                raf.seek(offset);
                raf.write(data);
            }
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to write chunk " + chunkId + " of " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * True if the chunk currently on disk hashes to {@code expectedHash}.
     * An unreadable chunk counts as a mismatch.
     */
    public boolean verifyChunk(Path file, int chunkId, String expectedHash) {
        try {
            return Digests.sha256Hex(readChunk(file, chunkId)).equalsIgnoreCase(expectedHash);
        } catch (TransferException e) {
            log.debug("Chunk {} of {} unreadable during verification: {}", chunkId, file, e.getMessage());
            return false;
        }
    }

    /**
     * True if the whole file hashes to {@code expectedHash}.
     */
    public boolean verifyFile(Path file, String expectedHash) {
        try {
            return Digests.sha256Hex(file).equalsIgnoreCase(expectedHash);
        } catch (IOException e) {
            log.debug("{} unreadable during verification: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Chunks still to fetch, judged from the destination's current size alone:
     * all of them if the file is absent, otherwise
     * {@code [floor(size / chunkSize), totalChunks)}.
     * <p>
     * This assumes chunks were written in increasing order without gaps. A file
     * written out of order (or with a torn final write) can look more complete
     * than it is; callers that can afford it should keep an explicit record of
     * finished chunks instead.
     */
    public List<Integer> getMissingChunks(Path file, int totalChunks) {
        if (!Files.exists(file)) {
            return IntStream.range(0, totalChunks).boxed().collect(Collectors.toList());
        }
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            log.warn("Cannot stat {}, treating every chunk as missing: {}", file, e.getMessage());
            return IntStream.range(0, totalChunks).boxed().collect(Collectors.toList());
        }
        int downloaded = (int) Math.min(size / chunkSize, totalChunks);
        return IntStream.range(downloaded, totalChunks).boxed().collect(Collectors.toList());
    }
}
