package io.github.hotbrkm.mailgoat.dispatcher.send.result;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Final status of a sealed batch.
 */
public enum BatchStatus {
    /** Every attempted row was sent. */
    COMPLETED,
    /** Continue-on-error was on, at least one row failed, and every row was attempted. */
    PARTIALLY_FAILED,
    /** A row failed with continue-on-error off; later rows were not attempted. */
    ABORTED;

    public static BatchStatus of(boolean aborted, int failedCount) {
        if (aborted) {
            return ABORTED;
        }
        return failedCount == 0 ? COMPLETED : PARTIALLY_FAILED;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the command exits successfully for this status.
     */
    public boolean isSuccessful() {
        return this != ABORTED;
    }
}
