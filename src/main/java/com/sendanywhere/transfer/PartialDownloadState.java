package com.sendanywhere.transfer;

import com.sendanywhere.chunk.FileManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HexFormat;
import java.util.List;

/**
 * Records which chunks of a destination file are already written, in a
 * {@code .sa-partial} sidecar next to it. Lets a resumed download skip exactly
 * the finished chunks even when they were written out of order.
 *
 * <pre>
 * Format:
 * Bytes 0-3:   Magic (0x53415254 = "SART")
 * Bytes 4-7:   Version (1)
 * Bytes 8-15:  File Size (long)
 * Bytes 16-19: Chunk Size (int)
 * Bytes 20-23: Total Chunks (int)
 * Bytes 24-55: SHA-256 of the whole file (32 bytes)
 * Bytes 56-57: Filename Length (short)
 * Bytes 58+:   Filename (UTF-8)
 * then:        Bitmap Length (int) + bitmap bytes (BitSet.toByteArray)
 * </pre>
 */
public class PartialDownloadState {

    private static final Logger log = LoggerFactory.getLogger(PartialDownloadState.class);

    private static final int MAGIC = 0x53415254; // "SART"
    private static final int VERSION = 1;
    private static final int FIXED_SIZE = 4 + 4 + 8 + 4 + 4 + 32 + 2; // 58 bytes
    private static final HexFormat HEX = HexFormat.of();
    static final String SUFFIX = ".sa-partial";

    private final long fileSize;
    private final int chunkSize;
    private final int totalChunks;
    private final byte[] sha256;
    private final String filename;
    private final BitSet done;

    public PartialDownloadState(long fileSize, int chunkSize, int totalChunks, byte[] sha256,
                                String filename, BitSet done) {
        this.fileSize = fileSize;
        this.chunkSize = chunkSize;
        this.totalChunks = totalChunks;
        this.sha256 = sha256;
        this.filename = filename;
        this.done = (BitSet) done.clone();
    }

    /**
     * Fresh state for {@code file} with every chunk outside {@code missing} marked done.
     */
    public static PartialDownloadState forFile(FileManifest file, List<Integer> missing) {
        BitSet done = new BitSet(file.totalChunks());
        done.set(0, file.totalChunks());
        for (int id : missing) {
            done.clear(id);
        }
        return new PartialDownloadState(file.size(), file.chunkSize(), file.totalChunks(),
                HEX.parseHex(file.hash()), file.fileName(), done);
    }

    public static Path partialPath(Path outputFile) {
        return outputFile.resolveSibling(outputFile.getFileName() + SUFFIX);
    }

    public synchronized void markDone(int chunkId) {
        done.set(chunkId);
    }

    public synchronized boolean isDone(int chunkId) {
        return done.get(chunkId);
    }

    public synchronized List<Integer> missingChunks() {
        List<Integer> missing = new ArrayList<>();
        for (int i = done.nextClearBit(0); i < totalChunks; i = done.nextClearBit(i + 1)) {
            missing.add(i);
        }
        return missing;
    }

    public synchronized int doneCount() {
        return done.cardinality();
    }

    /**
     * Same file as the one described by {@code file}: name, size, chunking and digest.
     */
    public boolean matches(FileManifest file) {
        return filename.equals(file.fileName())
                && fileSize == file.size()
                && chunkSize == file.chunkSize()
                && totalChunks == file.totalChunks()
                && HEX.formatHex(sha256).equalsIgnoreCase(file.hash());
    }

    public void save(Path outputFile) throws IOException {
        byte[] nameBytes = filename.getBytes(StandardCharsets.UTF_8);
        byte[] bitmap;
        synchronized (this) {
            bitmap = done.toByteArray();
        }
        ByteBuffer buf = ByteBuffer.allocate(FIXED_SIZE + nameBytes.length + 4 + bitmap.length)
                .order(ByteOrder.BIG_ENDIAN);

        buf.putInt(MAGIC);
        buf.putInt(VERSION);
        buf.putLong(fileSize);
        buf.putInt(chunkSize);
        buf.putInt(totalChunks);
        buf.put(sha256);
        buf.putShort((short) nameBytes.length);
        buf.put(nameBytes);
        buf.putInt(bitmap.length);
        buf.put(bitmap);

        Files.write(partialPath(outputFile), buf.array());
    }

    /**
     * Load the sidecar for {@code outputFile}, or null if there is none or it
     * cannot be parsed.
     */
    public static PartialDownloadState load(Path outputFile) {
        Path partial = partialPath(outputFile);
        if (!Files.exists(partial)) return null;

        try {
            byte[] data = Files.readAllBytes(partial);
            if (data.length < FIXED_SIZE) return null;

            ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);
            int magic = buf.getInt();
            int version = buf.getInt();
            if (magic != MAGIC || version != VERSION) return null;

            long fileSize = buf.getLong();
            int chunkSize = buf.getInt();
            int totalChunks = buf.getInt();
            byte[] sha256 = new byte[32];
            buf.get(sha256);
            int nameLen = Short.toUnsignedInt(buf.getShort());
            byte[] nameBytes = new byte[nameLen];
            buf.get(nameBytes);
            int bitmapLen = buf.getInt();
            if (bitmapLen < 0 || bitmapLen > buf.remaining()) return null;
            byte[] bitmap = new byte[bitmapLen];
            buf.get(bitmap);

            return new PartialDownloadState(fileSize, chunkSize, totalChunks, sha256,
                    new String(nameBytes, StandardCharsets.UTF_8), BitSet.valueOf(bitmap));
        } catch (IOException | BufferUnderflowException e) {
            log.warn("Ignoring unreadable resume state {}: {}", partial, e.toString());
            return null;
        }
    }

    public static void delete(Path outputFile) throws IOException {
        Files.deleteIfExists(partialPath(outputFile));
    }

    public long fileSize() { return fileSize; }
    public int chunkSize() { return chunkSize; }
    public int totalChunks() { return totalChunks; }
    public String filename() { return filename; }
}
