package io.github.hotbrkm.mailgoat.dispatcher.send.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Message as returned by the mail API read call.
 */
public record MailMessage(String id, List<String> to, String fromAddress, String subject, String body, String status,
                          Map<String, Object> raw) {

    public MailMessage {
        to = to == null ? List.of() : List.copyOf(to);
        raw = raw == null ? Collections.emptyMap() : Collections.unmodifiableMap(raw);
    }

    /**
     * Maps an API payload, accepting the alternative field names the server uses.
     */
    public static MailMessage fromApi(Map<String, Object> payload) {
        List<String> recipients = new ArrayList<>();
        Object toValue = payload.get("to");
        if (toValue instanceof String s) {
            recipients.add(s);
        } else if (toValue instanceof List<?> list) {
            for (Object item : list) {
                recipients.add(String.valueOf(item));
            }
        }

        return new MailMessage(
                String.valueOf(firstNonNull(payload.get("id"), payload.get("message_id"), "")),
                recipients,
                asString(firstNonNull(payload.get("from"), payload.get("from_address"))),
                asString(payload.get("subject")),
                asString(firstNonNull(payload.get("body"), payload.get("plain_body"), payload.get("text_body"))),
                asString(payload.get("status")),
                payload);
    }

    private static Object firstNonNull(Object... values) {
        for (Object value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
