package io.github.hotbrkm.mailgoat.dispatcher.send.template;

/**
 * The template file is unreadable or malformed. Fatal for the invocation.
 */
public class TemplateValidationException extends RuntimeException {
    public TemplateValidationException(String message) {
        super(message);
    }

    public TemplateValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
