package io.github.hotbrkm.mailgoat.dispatcher.profile;

import lombok.experimental.UtilityClass;

/**
 * Profile selection rules, kept free of any global lookup so they can be tested in isolation.
 */
@UtilityClass
public class ProfileResolver {

    public static final String ENVIRONMENT_VARIABLE = "MAILGOAT_PROFILE";

    /**
     * Picks the profile name by precedence: explicit flag, environment value, stored default.
     * Blank values count as absent.
     *
     * @return the chosen profile name
     * @throws ProfileException if none of the three is set
     */
    public static String resolveName(String explicitName, String environmentValue, String storedDefault) {
        if (hasText(explicitName)) {
            return explicitName.trim();
        }
        if (hasText(environmentValue)) {
            return environmentValue.trim();
        }
        if (hasText(storedDefault)) {
            return storedDefault.trim();
        }
        throw ProfileException.notConfigured();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
