package io.github.hotbrkm.mailgoat.dispatcher.send.result;

/**
 * Batch results could not be persisted or read back.
 * <p>
 * Fatal for the invocation. When raised after a batch ran, the result exists only in the command's output.
 */
public class BatchStorageException extends RuntimeException {
    public BatchStorageException(String message) {
        super(message);
    }

    public BatchStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
