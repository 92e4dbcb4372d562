package io.github.hotbrkm.mailgoat.dispatcher.send.entry;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.hotbrkm.mailgoat.dispatcher.domain.EmailAddressUtil;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts raw CSV records and JSON elements into {@link RecipientRow}s with identical field semantics.
 */
@UtilityClass
class RecipientRowMapper {

    static final String MISSING_TO = "recipient row is missing 'to'";
    static final String NOT_AN_OBJECT = "each JSON array item must be an object";
    static final String BAD_TO_TYPE = "'to' must be a string or an array of strings";

    private static final Set<String> CORE_FIELDS = Set.of(RecipientRow.FIELD_TO, RecipientRow.FIELD_SUBJECT, RecipientRow.FIELD_BODY);

    /**
     * Maps one CSV record keyed by header name. Columns other than to/subject/body become fields, in header order.
     */
    static RecipientRow fromCsv(int rowIndex, Map<String, String> record) {
        List<String> to = EmailAddressUtil.splitAddresses(record.get(RecipientRow.FIELD_TO));
        if (to.isEmpty()) {
            return RecipientRow.invalid(rowIndex, to, MISSING_TO);
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : record.entrySet()) {
            if (!CORE_FIELDS.contains(e.getKey()) && e.getValue() != null) {
                fields.put(e.getKey(), e.getValue());
            }
        }
        return RecipientRow.builder()
                .rowIndex(rowIndex)
                .to(to)
                .subject(record.get(RecipientRow.FIELD_SUBJECT))
                .body(record.get(RecipientRow.FIELD_BODY))
                .from(senderOf(fields))
                .fields(fields)
                .build();
    }

    /**
     * Maps one JSON array element. Type problems produce an invalid row instead of an exception.
     */
    static RecipientRow fromJson(int rowIndex, JsonNode node) {
        if (node == null || !node.isObject()) {
            return RecipientRow.invalid(rowIndex, List.of(), NOT_AN_OBJECT);
        }

        JsonNode toNode = node.get(RecipientRow.FIELD_TO);
        List<String> to;
        if (toNode == null || toNode.isNull()) {
            return RecipientRow.invalid(rowIndex, List.of(), MISSING_TO);
        } else if (toNode.isTextual()) {
            to = EmailAddressUtil.splitAddresses(toNode.asText());
        } else if (toNode.isArray()) {
            to = new ArrayList<>();
            for (JsonNode item : toNode) {
                if (!item.isTextual()) {
                    return RecipientRow.invalid(rowIndex, List.of(), BAD_TO_TYPE);
                }
                if (!item.asText().isBlank()) {
                    to.add(item.asText().trim());
                }
            }
        } else {
            return RecipientRow.invalid(rowIndex, List.of(), BAD_TO_TYPE);
        }
        if (to.isEmpty()) {
            return RecipientRow.invalid(rowIndex, to, MISSING_TO);
        }

        Map<String, String> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (CORE_FIELDS.contains(e.getKey())) {
                continue;
            }
            String value = stringValue(e.getValue());
            if (value != null) {
                fields.put(e.getKey(), value);
            }
        }

        return RecipientRow.builder()
                .rowIndex(rowIndex)
                .to(to)
                .subject(stringValue(node.get(RecipientRow.FIELD_SUBJECT)))
                .body(stringValue(node.get(RecipientRow.FIELD_BODY)))
                .from(senderOf(fields))
                .fields(fields)
                .build();
    }

    /**
     * Scalars use their string form, containers their compact JSON text, and null means absent.
     */
    static String stringValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }

    private static String senderOf(Map<String, String> fields) {
        String from = fields.get(RecipientRow.FIELD_FROM);
        if (from == null || from.isBlank()) {
            from = fields.get(RecipientRow.FIELD_FROM_ADDRESS);
        }
        return from == null || from.isBlank() ? null : from.trim();
    }
}
