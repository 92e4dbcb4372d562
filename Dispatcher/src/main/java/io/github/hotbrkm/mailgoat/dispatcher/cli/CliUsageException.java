package io.github.hotbrkm.mailgoat.dispatcher.cli;

/**
 * Command line could not be understood: unknown command or option, missing argument or option value.
 */
public class CliUsageException extends RuntimeException {
    public CliUsageException(String message) {
        super(message);
    }
}
