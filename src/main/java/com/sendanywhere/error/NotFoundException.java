package com.sendanywhere.error;

/**
 * A transfer, chunk, file or pairing code that does not exist (or has expired).
 */
public class NotFoundException extends TransferException {

    private final NotFoundReason reason;

    public NotFoundException(NotFoundReason reason, String message) {
        super(ErrorCategory.NOT_FOUND, message);
        this.reason = reason;
    }

    public NotFoundReason reason() {
        return reason;
    }

    @Override
    public boolean isRetryable() {
        return reason == NotFoundReason.CHUNK_PENDING;
    }

    public static NotFoundException transferUnknown(String transferId) {
        return new NotFoundException(NotFoundReason.TRANSFER_UNKNOWN, "Transfer " + transferId + " not found");
    }

    public static NotFoundException chunkPending(int chunkId) {
        return new NotFoundException(NotFoundReason.CHUNK_PENDING,
                "Chunk " + chunkId + " not yet uploaded. Please wait for sender to complete upload.");
    }
}
