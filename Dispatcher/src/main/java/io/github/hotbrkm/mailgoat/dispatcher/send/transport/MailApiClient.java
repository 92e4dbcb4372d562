package io.github.hotbrkm.mailgoat.dispatcher.send.transport;

import java.nio.file.Path;
import java.util.List;

/**
 * Single-message operations of the mail API.
 * <p>
 * Timeouts and HTTP-level concerns belong to the implementation; callers only see
 * {@link MailApiNetworkException} or {@link MailApiResponseException}.
 */
public interface MailApiClient {

    /**
     * Submits one message.
     *
     * @param to          one or more recipients
     * @param subject     subject line
     * @param body        plain text body
     * @param fromAddress sender, or null to let the server decide
     * @param attachments files to attach, may be empty
     * @return server-assigned message id
     */
    String send(List<String> to, String subject, String body, String fromAddress, List<Path> attachments);

    /**
     * Fetches a previously sent message.
     */
    MailMessage read(String messageId);
}
