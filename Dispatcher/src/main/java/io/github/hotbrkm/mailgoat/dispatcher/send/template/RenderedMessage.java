package io.github.hotbrkm.mailgoat.dispatcher.send.template;

import java.util.List;
import java.util.Objects;

/**
 * Concrete message for one recipient row. Derived on demand and never stored.
 */
public record RenderedMessage(List<String> to, String subject, String body, String fromAddress) {

    public RenderedMessage {
        to = List.copyOf(Objects.requireNonNull(to, "to must not be null"));
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }

    /**
     * Returns a copy using {@code defaultSender} when this message names no sender.
     */
    public RenderedMessage withDefaultSender(String defaultSender) {
        if (fromAddress != null || defaultSender == null) {
            return this;
        }
        return new RenderedMessage(to, subject, body, defaultSender);
    }

    @Override
    public String toString() {
        return "RenderedMessage["
                + "to=" + to + ", "
                + "subject=" + subject + ", "
                + "body=<" + body.length() + " chars>, "
                + "fromAddress=" + fromAddress + ']';
    }
}
