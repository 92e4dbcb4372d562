package io.github.hotbrkm.mailgoat.dispatcher.cli;

/**
 * Process exit codes.
 */
public final class ExitCodes {

    private ExitCodes() {
    }

    /** Command succeeded; batch completed or partially failed */
    public static final int OK = 0;
    /** Batch aborted, or unknown batch id / profile */
    public static final int FAILURE = 1;
    /** Usage, configuration or validation error; no profile configured */
    public static final int INVALID_INPUT = 2;
    /** Batch result or error log could not be written */
    public static final int STORAGE_ERROR = 3;
}
