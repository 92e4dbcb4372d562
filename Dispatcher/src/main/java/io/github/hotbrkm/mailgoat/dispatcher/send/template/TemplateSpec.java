package io.github.hotbrkm.mailgoat.dispatcher.send.template;

import java.util.Objects;

/**
 * Message template loaded once per batch. Subject and body may contain {@code {{name}}} placeholders.
 */
public record TemplateSpec(String subject, String body, String from) {

    public TemplateSpec {
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(body, "body must not be null");
        if (from != null && from.isBlank()) {
            from = null;
        }
    }

    public static TemplateSpec of(String subject, String body) {
        return new TemplateSpec(subject, body, null);
    }
}
