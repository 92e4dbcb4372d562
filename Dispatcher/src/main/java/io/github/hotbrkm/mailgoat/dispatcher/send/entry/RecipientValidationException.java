package io.github.hotbrkm.mailgoat.dispatcher.send.entry;

/**
 * Malformed recipient input (for example a CSV without a {@code to} column).
 * <p>
 * Fatal for the invocation and raised before any row is sent.
 */
public class RecipientValidationException extends RuntimeException {
    public RecipientValidationException(String message) {
        super(message);
    }

    public RecipientValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
