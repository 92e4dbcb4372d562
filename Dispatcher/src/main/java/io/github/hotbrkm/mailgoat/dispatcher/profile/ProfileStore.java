package io.github.hotbrkm.mailgoat.dispatcher.profile;

import java.util.List;
import java.util.Optional;

/**
 * Key-value record store of {@link MailProfile}s keyed by profile name.
 */
public interface ProfileStore {

    /**
     * Adds or replaces a profile.
     *
     * @param profile     profile to store
     * @param makeDefault whether the profile becomes the stored default; the first profile always does
     */
    void add(MailProfile profile, boolean makeDefault);

    /**
     * @return all profiles sorted by name
     */
    List<MailProfile> list();

    /**
     * @throws ProfileException if no profile has that name
     */
    MailProfile get(String name);

    /**
     * @throws ProfileException if no profile has that name
     */
    void setDefault(String name);

    Optional<String> defaultProfileName();

    /**
     * Resolves the profile for a run: explicit name, then environment override, then the stored default.
     *
     * @param explicitName     value of {@code --profile}, may be null
     * @param environmentValue value of {@code MAILGOAT_PROFILE}, may be null
     */
    default MailProfile resolve(String explicitName, String environmentValue) {
        String name = ProfileResolver.resolveName(explicitName, environmentValue, defaultProfileName().orElse(null));
        return get(name);
    }
}
