package io.github.hotbrkm.mailgoat.dispatcher.send.transport;

/**
 * Connectivity problem or timeout; the request may not have reached the server.
 */
public class MailApiNetworkException extends MailApiException {
    public MailApiNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
