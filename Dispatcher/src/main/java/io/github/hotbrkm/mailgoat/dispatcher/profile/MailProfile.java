package io.github.hotbrkm.mailgoat.dispatcher.profile;

import io.github.hotbrkm.mailgoat.dispatcher.domain.EmailAddressUtil;
import lombok.Builder;

import java.util.Objects;

/**
 * Named credential set for one sender account.
 * <p>
 * Loaded once per command and never modified afterwards; editing a profile means adding it again.
 */
@Builder
public record MailProfile(String name, String server, String apiKey, String fromAddress, String fromName) {

    public MailProfile {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new ProfileException("profile name must not be blank");
        }
        if (server == null || server.isBlank()) {
            throw new ProfileException("server is required for profile: " + name);
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProfileException("api_key is required for profile: " + name);
        }
    }

    /**
     * Default sender used when neither the row nor the template names one.
     *
     * @return formatted sender, or null if the profile has no from address
     */
    public String defaultSender() {
        return EmailAddressUtil.formatSender(fromAddress, fromName);
    }

    public String maskedApiKey() {
        if (apiKey.length() <= 4) {
            return "****";
        }
        return "****" + apiKey.substring(apiKey.length() - 4);
    }

    @Override
    public String toString() {
        return "MailProfile["
                + "name=" + name + ", "
                + "server=" + server + ", "
                + "apiKey=" + maskedApiKey() + ", "
                + "fromAddress=" + fromAddress + ", "
                + "fromName=" + fromName + ']';
    }
}
