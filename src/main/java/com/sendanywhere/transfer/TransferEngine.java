package com.sendanywhere.transfer;

import com.sendanywhere.chunk.ChunkInfo;
import com.sendanywhere.chunk.ChunkLayout;
import com.sendanywhere.chunk.ChunkManager;
import com.sendanywhere.chunk.ChunkReceipt;
import com.sendanywhere.chunk.Digests;
import com.sendanywhere.chunk.FileManifest;
import com.sendanywhere.chunk.FolderManifest;
import com.sendanywhere.chunk.Manifest;
import com.sendanywhere.chunk.Manifests;
import com.sendanywhere.config.SendAnywhereConfig;
import com.sendanywhere.error.ErrorCategory;
import com.sendanywhere.error.TransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives bulk chunk movement between local files and a {@link ChunkTransport}.
 *
 * Each chunk runs on a fixed pool of {@code concurrency} workers and is retried
 * under a {@link RetryPolicy}. The first chunk that fails for good cancels the
 * remaining work. Chunks already accepted by the far side stay where they are.
 * Downloads keep a {@code .sa-partial} sidecar per destination file so an
 * interrupted run can pick up exactly the chunks it has not written yet.
 */
public class TransferEngine {

    private static final Logger log = LoggerFactory.getLogger(TransferEngine.class);
    private static final long PARTIAL_SAVE_INTERVAL_MS = 2000;

    @FunctionalInterface
    private interface ChunkTask {
        void run(int chunkId) throws TransferException, InterruptedException;
    }

    private final int concurrency;
    private final RetryPolicy retryPolicy;

    public TransferEngine(int concurrency, RetryPolicy retryPolicy) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1: " + concurrency);
        }
        this.concurrency = concurrency;
        this.retryPolicy = retryPolicy;
    }

    public static TransferEngine fromConfig(SendAnywhereConfig config) {
        int parallel = Math.max(config.minParallelChunks(), config.maxParallelChunks());
        return new TransferEngine(parallel, new RetryPolicy(config.maxRetryAttempts(), config.retryDelay()));
    }

    public int concurrency() {
        return concurrency;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /**
     * Register {@code manifest} with the transport and push every chunk. Source
     * files are the ones the manifest was built from.
     *
     * @throws TransferException {@code EXHAUSTED} when a chunk ran out of
     *         attempts, or the first terminal error otherwise
     */
    public void upload(ChunkTransport transport, Manifest manifest, ProgressListener listener)
            throws TransferException, InterruptedException {
        Manifests.validate(manifest);
        ChunkLayout layout = ChunkLayout.of(manifest);
        ChunkManager chunks = new ChunkManager(manifest.chunkSize());
        List<Path> sources = sourcePaths(manifest);

        transport.create(manifest);
        log.info("Uploading {} ({} chunks, {} bytes) to {}",
                manifest.name(), layout.totalChunks(), manifest.totalBytes(), transport.describe());

        List<Integer> ids = new ArrayList<>(layout.totalChunks());
        for (int i = 0; i < layout.totalChunks(); i++) {
            ids.add(i);
        }

        runAll("Upload", ids, layout.totalChunks(), 0, listener, chunkId -> {
            ChunkLayout.ChunkRef ref = layout.locate(chunkId);
            byte[] data = chunks.readChunk(sources.get(ref.fileIndex()), ref.localChunkId());
            ChunkReceipt receipt = transport.put(chunkId, data);
            if (!receipt.matches(data)) {
                throw new TransferException(ErrorCategory.HASH_MISMATCH, "Chunk " + chunkId
                        + " stored as " + receipt.size() + " bytes / " + receipt.hash()
                        + ", sent " + data.length + " bytes");
            }
            log.debug("Uploaded chunk {} ({} bytes)", chunkId, data.length);
        }, () -> { });

        log.info("Upload of {} complete", manifest.name());
    }

    /**
     * Fetch the manifest and every chunk not already on disk, then verify each
     * file against its whole-file digest.
     *
     * @param outputPath destination file for a single-file manifest, destination
     *                   directory for a folder manifest
     * @return per-file verification results; a digest mismatch is reported here,
     *         not thrown
     */
    public DownloadReport download(ChunkTransport transport, Path outputPath, ProgressListener listener)
            throws TransferException, InterruptedException {
        Manifest manifest = transport.manifest();
        Manifests.validate(manifest);
        ChunkLayout layout = ChunkLayout.of(manifest);
        ChunkManager chunks = new ChunkManager(manifest.chunkSize());

        List<Path> destinations = new ArrayList<>(layout.slots().size());
        List<PartialDownloadState> states = new ArrayList<>(layout.slots().size());
        List<Integer> ids = new ArrayList<>();

        for (ChunkLayout.FileSlot slot : layout.slots()) {
            Path dest = destination(outputPath, layout, slot.file());
            destinations.add(dest);
            List<Integer> missing = plan(chunks, dest, slot.file());
            PartialDownloadState state = PartialDownloadState.forFile(slot.file(), missing);
            states.add(state);
            if (slot.chunkCount() == 0) {
                createEmpty(dest);
                continue;
            }
            if (!missing.isEmpty()) {
                saveState(state, dest);
            }
            for (int local : missing) {
                ids.add(slot.globalId(local));
            }
        }

        int alreadyDone = layout.totalChunks() - ids.size();
        log.info("Downloading {} from {}: {} of {} chunks to fetch",
                manifest.name(), transport.describe(), ids.size(), layout.totalChunks());

        long[] lastSave = {System.currentTimeMillis()};
        Runnable checkpoint = () -> {
            long now = System.currentTimeMillis();
            if (now - lastSave[0] >= PARTIAL_SAVE_INTERVAL_MS) {
                lastSave[0] = now;
                saveAll(states, destinations);
            }
        };

        try {
            runAll("Download", ids, layout.totalChunks(), alreadyDone, listener, chunkId -> {
                ChunkLayout.ChunkRef ref = layout.locate(chunkId);
                FileManifest file = layout.slot(ref.fileIndex()).file();
                ChunkInfo expected = file.chunks().get(ref.localChunkId());
                byte[] data = transport.get(chunkId);
                if (data.length != expected.size() || !Digests.sha256Hex(data).equalsIgnoreCase(expected.hash())) {
                    throw new TransferException(ErrorCategory.HASH_MISMATCH,
                            "Chunk " + chunkId + " of " + file.fileName() + " failed its digest check");
                }
                chunks.writeChunk(destinations.get(ref.fileIndex()), ref.localChunkId(), data);
                states.get(ref.fileIndex()).markDone(ref.localChunkId());
                log.debug("Downloaded chunk {} ({} bytes)", chunkId, data.length);
            }, checkpoint);
        } catch (TransferException | InterruptedException | RuntimeException e) {
            saveAll(states, destinations);
            throw e;
        }

        List<DownloadReport.FileResult> results = new ArrayList<>(layout.slots().size());
        for (ChunkLayout.FileSlot slot : layout.slots()) {
            Path dest = destinations.get(slot.fileIndex());
            FileManifest file = slot.file();
            truncateTo(dest, file.size());
            try {
                PartialDownloadState.delete(dest);
            } catch (IOException e) {
                log.warn("Could not remove resume state for {}: {}", dest, e.getMessage());
            }
            boolean verified = chunks.verifyFile(dest, file.hash());
            if (verified) {
                log.info("Verified {}", dest);
            } else {
                log.error("Integrity check failed for {}", dest);
            }
            results.add(new DownloadReport.FileResult(displayName(file), dest, verified));
        }
        return new DownloadReport(outputPath, results, ids.size());
    }

    /**
     * Chunks of {@code file} still to fetch into {@code dest}. A matching
     * sidecar is exact; without one, fall back to the size heuristic.
     */
    List<Integer> plan(ChunkManager chunks, Path dest, FileManifest file) {
        if (Files.exists(dest)) {
            PartialDownloadState saved = PartialDownloadState.load(dest);
            if (saved != null && saved.matches(file)) {
                List<Integer> missing = saved.missingChunks();
                log.info("Resuming {}: {} of {} chunks already written", dest,
                        file.totalChunks() - missing.size(), file.totalChunks());
                return missing;
            }
            if (saved != null) {
                log.info("Resume state for {} describes a different file, ignoring it", dest);
            }
        }
        return chunks.getMissingChunks(dest, file.totalChunks());
    }

    private void runAll(String what, List<Integer> ids, int total, int alreadyDone,
                        ProgressListener listener, ChunkTask task, Runnable afterEach)
            throws TransferException, InterruptedException {
        if (ids.isEmpty()) {
            return;
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, ids.size()),
                workerFactory(what.toLowerCase()));
        ExecutorCompletionService<Integer> completion = new ExecutorCompletionService<>(pool);
        try {
            for (int id : ids) {
                completion.submit(() -> {
                    withRetry(what, id, task);
                    return id;
                });
            }
            int completed = alreadyDone;
            for (int i = 0; i < ids.size(); i++) {
                Future<Integer> done = completion.take();
                try {
                    done.get();
                } catch (ExecutionException e) {
                    throw unwrap(e);
                }
                completed++;
                notifyProgress(listener, completed, total);
                afterEach.run();
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void withRetry(String what, int chunkId, ChunkTask task)
            throws TransferException, InterruptedException {
        TransferException last = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                task.run(chunkId);
                return;
            } catch (TransferException e) {
                if (Thread.interrupted() || e.getCause() instanceof InterruptedException) {
                    InterruptedException stop = new InterruptedException(what + " of chunk " + chunkId + " interrupted");
                    stop.initCause(e);
                    throw stop;
                }
                if (!e.isRetryable()) {
                    throw e;
                }
                last = e;
                if (attempt < retryPolicy.maxAttempts()) {
                    Duration delay = retryPolicy.delayAfter(attempt);
                    log.warn("{} of chunk {} failed (attempt {}/{}), retrying in {} ms: {}", what, chunkId,
                            attempt, retryPolicy.maxAttempts(), delay.toMillis(), e.getMessage());
                    Thread.sleep(delay.toMillis());
                }
            }
        }
        log.error("{} of chunk {} failed after {} attempts", what, chunkId, retryPolicy.maxAttempts());
        throw new TransferException(ErrorCategory.EXHAUSTED, what + " of chunk " + chunkId + " failed after "
                + retryPolicy.maxAttempts() + " attempts: " + last.getMessage(), last);
    }

    private static TransferException unwrap(ExecutionException e) throws InterruptedException {
        Throwable cause = e.getCause();
        if (cause instanceof TransferException te) {
            return te;
        }
        if (cause instanceof InterruptedException ie) {
            throw ie;
        }
        if (cause instanceof RuntimeException re) {
            throw re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return TransferException.ioFailure("Chunk worker failed: " + cause, cause);
    }

    private static void notifyProgress(ProgressListener listener, int completed, int total) {
        try {
            listener.onChunk(completed, total);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at {}/{}", completed, total, e);
        }
    }

    private static ThreadFactory workerFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static List<Path> sourcePaths(Manifest manifest) {
        if (manifest instanceof FileManifest file) {
            return List.of(Paths.get(file.filePath()));
        }
        FolderManifest folder = (FolderManifest) manifest;
        Path root = Paths.get(folder.folderPath());
        List<Path> paths = new ArrayList<>(folder.files().size());
        for (FileManifest file : folder.files()) {
            paths.add(root.resolve(file.relativePath()));
        }
        return paths;
    }

    private static Path destination(Path outputPath, ChunkLayout layout, FileManifest file)
            throws TransferException {
        if (!layout.isFolder()) {
            return outputPath;
        }
        Path root = outputPath.toAbsolutePath().normalize();
        Path dest = root.resolve(file.relativePath()).normalize();
        if (!dest.startsWith(root) || dest.equals(root)) {
            throw TransferException.invalidInput("Relative path escapes the output directory: " + file.relativePath());
        }
        return dest;
    }

    private static String displayName(FileManifest file) {
        return file.relativePath() != null ? file.relativePath() : file.fileName();
    }

    private static void createEmpty(Path dest) throws TransferException {
        try {
            Path parent = dest.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(dest)) {
                Files.createFile(dest);
            }
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to create " + dest + ": " + e.getMessage(), e);
        }
    }

    private static void truncateTo(Path dest, long size) throws TransferException {
        try {
            if (Files.size(dest) > size) {
                try (RandomAccessFile raf = new RandomAccessFile(dest.toFile(), "rw")) {
                    raf.setLength(size);
                }
                log.info("Truncated {} to {} bytes", dest, size);
            }
        } catch (IOException e) {
            throw TransferException.ioFailure("Failed to finalize " + dest + ": " + e.getMessage(), e);
        }
    }

    private static void saveAll(List<PartialDownloadState> states, List<Path> destinations) {
        for (int i = 0; i < states.size(); i++) {
            PartialDownloadState state = states.get(i);
            if (state.totalChunks() > 0 && state.doneCount() < state.totalChunks()) {
                saveState(state, destinations.get(i));
            }
        }
    }

    private static void saveState(PartialDownloadState state, Path dest) {
        try {
            Path parent = dest.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            state.save(dest);
        } catch (IOException e) {
            log.warn("Failed to save resume state for {}: {}", dest, e.getMessage());
        }
    }
}
