package io.github.hotbrkm.mailgoat.dispatcher.profile;

import lombok.Getter;

/**
 * Raised when profile state is invalid or a profile cannot be resolved.
 */
@Getter
public class ProfileException extends RuntimeException {

    /**
     * True when nothing could be resolved at all (no flag, no environment value, no stored default).
     */
    private final boolean unconfigured;

    public ProfileException(String message) {
        this(message, false);
    }

    public ProfileException(String message, boolean unconfigured) {
        super(message);
        this.unconfigured = unconfigured;
    }

    public ProfileException(String message, Throwable cause) {
        super(message, cause);
        this.unconfigured = false;
    }

    public static ProfileException notConfigured() {
        return new ProfileException("no profile configured; run 'profile add' or pass --profile", true);
    }
}
