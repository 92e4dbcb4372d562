package io.github.hotbrkm.mailgoat.dispatcher.send.entry;

/**
 * Invalid combination of batch options, detected before any input is read.
 */
public class BatchConfigurationException extends RuntimeException {
    public BatchConfigurationException(String message) {
        super(message);
    }
}
