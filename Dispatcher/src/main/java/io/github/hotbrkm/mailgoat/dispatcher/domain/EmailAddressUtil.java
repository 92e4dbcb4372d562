package io.github.hotbrkm.mailgoat.dispatcher.domain;

import jakarta.mail.internet.InternetAddress;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

public final class EmailAddressUtil {
    /**
     * Label used when email/domain is determined to be invalid
     */
    public static final String INVALID = "INVALID";

    private EmailAddressUtil() {}

    /**
     * Splits a recipient cell such as {@code "a@example.com; b@example.com"} into addresses.
     * Commas and semicolons both separate addresses; blank entries are dropped.
     */
    public static List<String> splitAddresses(String value) {
        if (value == null || value.isBlank()) {
            return Collections.emptyList();
        }
        List<String> addresses = new ArrayList<>();
        for (String part : value.split("[,;]")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                addresses.add(trimmed);
            }
        }
        return addresses;
    }

    /**
     * Formats a sender as {@code "Name" <address>} when a display name is present.
     * Falls back to the bare address when the name cannot be encoded.
     */
    public static String formatSender(String address, String displayName) {
        if (address == null || address.isBlank()) {
            return null;
        }
        if (displayName == null || displayName.isBlank()) {
            return address.trim();
        }
        try {
            return new InternetAddress(address.trim(), displayName.trim(), StandardCharsets.UTF_8.name()).toString();
        } catch (UnsupportedEncodingException e) {
            return address.trim();
        }
    }

    /**
     * Extracts the lower-cased ASCII domain of an address, or {@link #INVALID}.
     */
    public static String extractDomain(String email) {
        if (email == null || email.isBlank()) {
            return INVALID;
        }
        String addr = email.trim();

        int lt = addr.indexOf('<');
        int gt = addr.indexOf('>');
        if (lt >= 0 && gt > lt) {
            addr = addr.substring(lt + 1, gt).trim();
        }

        int at = addr.lastIndexOf('@');
        if (at <= 0 || at >= addr.length() - 1) {
            return INVALID;
        }
        String dom = addr.substring(at + 1).trim();
        if (dom.endsWith(".")) {
            dom = dom.substring(0, dom.length() - 1);
        }
        if (dom.isEmpty() || dom.charAt(0) == '[') {
            return INVALID;
        }

        String asciiDom;
        try {
            asciiDom = java.net.IDN.toASCII(dom);
        } catch (IllegalArgumentException e) {
            return INVALID;
        }
        for (char c : asciiDom.toCharArray()) {
            if (c == ',' || c == '"' || c == '\'' || c == '<' || c == '>' || c == '\\' || c == '/' || c == ' ' || c == ':') {
                return INVALID;
            }
        }
        if (asciiDom.length() <= 2) {
            return INVALID;
        }
        return asciiDom.toLowerCase(Locale.ROOT);
    }
}
