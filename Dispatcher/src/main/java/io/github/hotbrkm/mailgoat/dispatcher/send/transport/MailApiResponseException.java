package io.github.hotbrkm.mailgoat.dispatcher.send.transport;

import lombok.Getter;

/**
 * The server answered, but not with a usable success response.
 */
@Getter
public class MailApiResponseException extends MailApiException {
    private final int statusCode;
    private final String originalMessage;

    public MailApiResponseException(int statusCode, String originalMessage) {
        super("mail API error (" + statusCode + "): " + originalMessage);
        this.statusCode = statusCode;
        this.originalMessage = originalMessage;
    }
}
