package com.sendanywhere.transfer;

import com.sendanywhere.error.ErrorCategory;
import com.sendanywhere.error.TransferException;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a download: where each file went and whether its whole-file
 * digest matched the manifest. Mismatches are reported here, never retried.
 */
public record DownloadReport(Path output, List<FileResult> files, int chunksFetched) {

    public record FileResult(String name, Path path, boolean verified) {}

    public DownloadReport {
        files = List.copyOf(files);
    }

    public boolean verified() {
        return files.stream().allMatch(FileResult::verified);
    }

    public long verifiedCount() {
        return files.stream().filter(FileResult::verified).count();
    }

    public List<FileResult> mismatches() {
        return files.stream().filter(f -> !f.verified()).collect(Collectors.toList());
    }

    /**
     * @throws TransferException {@code HASH_MISMATCH} naming every file that failed
     */
    public void requireVerified() throws TransferException {
        List<FileResult> bad = mismatches();
        if (!bad.isEmpty()) {
            throw new TransferException(ErrorCategory.HASH_MISMATCH, "Integrity check failed for "
                    + bad.stream().map(FileResult::name).collect(Collectors.joining(", ")));
        }
    }
}
