package io.github.hotbrkm.mailgoat.dispatcher.send.entry;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One recipient read from the input source.
 * <p>
 * Field values are kept as an ordered name-to-string mapping so that template rendering only deals with strings.
 * A row that failed validation while being read keeps its position and carries {@link #getInvalidReason()},
 * which the renderer reports as that row's failure.
 */
@Getter
public final class RecipientRow {
    public static final String FIELD_TO = "to";
    public static final String FIELD_SUBJECT = "subject";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_FROM = "from";
    public static final String FIELD_FROM_ADDRESS = "from_address";

    private final int rowIndex;
    private final List<String> to;
    private final String subject;
    private final String body;
    private final String from;
    private final Map<String, String> fields;
    private final String invalidReason;

    @Builder
    public RecipientRow(int rowIndex, List<String> to, String subject, String body, String from,
                        Map<String, String> fields, String invalidReason) {
        if (rowIndex < 0) {
            throw new IllegalArgumentException("rowIndex must not be negative: " + rowIndex);
        }
        this.rowIndex = rowIndex;
        this.to = to == null ? List.of() : List.copyOf(to);
        this.subject = subject;
        this.body = body;
        this.from = from;
        this.fields = fields == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.invalidReason = invalidReason;
    }

    /**
     * Creates a row that could not be read into a valid recipient.
     */
    public static RecipientRow invalid(int rowIndex, List<String> to, String reason) {
        return RecipientRow.builder()
                .rowIndex(rowIndex)
                .to(to)
                .invalidReason(Objects.requireNonNull(reason, "reason must not be null"))
                .build();
    }

    public boolean isValid() {
        return invalidReason == null;
    }

    public String getField(String name) {
        return name == null ? null : fields.get(name);
    }

    public boolean hasField(String name) {
        return name != null && fields.containsKey(name);
    }

    /**
     * Recipients joined for display and logging.
     */
    public String toDisplay() {
        return String.join(", ", to);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof RecipientRow that)) {
            return false;
        }
        return rowIndex == that.rowIndex
                && Objects.equals(to, that.to)
                && Objects.equals(subject, that.subject)
                && Objects.equals(body, that.body)
                && Objects.equals(from, that.from)
                && Objects.equals(fields, that.fields)
                && Objects.equals(invalidReason, that.invalidReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowIndex, to, subject, body, from, fields, invalidReason);
    }

    @Override
    public String toString() {
        return "RecipientRow["
                + "rowIndex=" + rowIndex + ", "
                + "to=" + to + ", "
                + "subject=" + subject + ", "
                + "body=" + (body != null ? "<" + body.length() + " chars>" : null) + ", "
                + "fields=" + fields.keySet() + ", "
                + "invalidReason=" + invalidReason + ']';
    }
}
