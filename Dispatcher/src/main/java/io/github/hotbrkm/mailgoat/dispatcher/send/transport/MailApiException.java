package io.github.hotbrkm.mailgoat.dispatcher.send.transport;

/**
 * Base type for failures talking to the mail API.
 */
public abstract class MailApiException extends RuntimeException {
    protected MailApiException(String message) {
        super(message);
    }

    protected MailApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
