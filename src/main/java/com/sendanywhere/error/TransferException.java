package com.sendanywhere.error;

/**
 * Thrown when a chunk, manifest, transfer or pairing operation fails.
 * Every failure carries one {@link ErrorCategory}.
 */
public class TransferException extends Exception {

    private final ErrorCategory category;

    public TransferException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public TransferException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }

    /**
     * Transient failures worth another attempt. {@link NotFoundException}
     * widens this to chunks the sender has not uploaded yet.
     */
    public boolean isRetryable() {
        return category == ErrorCategory.NETWORK_FAILURE
                || category == ErrorCategory.HASH_MISMATCH;
    }

    public static TransferException invalidInput(String message) {
        return new TransferException(ErrorCategory.INVALID_INPUT, message);
    }

    public static TransferException ioFailure(String message, Throwable cause) {
        return new TransferException(ErrorCategory.IO_FAILURE, message, cause);
    }

    public static TransferException network(String message, Throwable cause) {
        return new TransferException(ErrorCategory.NETWORK_FAILURE, message, cause);
    }
}
