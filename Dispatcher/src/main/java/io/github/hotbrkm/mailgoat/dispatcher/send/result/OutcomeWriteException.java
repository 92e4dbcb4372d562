package io.github.hotbrkm.mailgoat.dispatcher.send.result;

/**
 * Fatal exception raised when an outcome writer cannot write its output.
 */
public class OutcomeWriteException extends RuntimeException {
    public OutcomeWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
