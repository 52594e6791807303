package io.mural.storage;

/**
 * Raised when the durable log cannot record or replay messages.
 * <p>
 * A write that fails with this exception did not happen: the in-memory set is
 * left unchanged and the caller must surface the failure.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
