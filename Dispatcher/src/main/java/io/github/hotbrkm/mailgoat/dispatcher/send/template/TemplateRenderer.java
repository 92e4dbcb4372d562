package io.github.hotbrkm.mailgoat.dispatcher.send.template;

import io.github.hotbrkm.mailgoat.dispatcher.send.entry.RecipientRow;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Merges a template with one recipient row.
 * <p>
 * Placeholders have the form {@code {{name}}} and are matched by exact, case-sensitive name against the row's
 * fields ({@code to} resolves to the recipient list). Substitution is a single pass: inserted values are never
 * scanned again. The renderer holds no state and is safe to share.
 */
public class TemplateRenderer {

    static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}\\s]+)\\s*}}");

    /**
     * Renders the message for a row.
     *
     * @param template template, or null to take subject and body from the row itself
     * @param row      recipient row
     * @return message whose sender is the row's, else the template's; null when neither names one
     * @throws RenderException if the row is invalid or a value is missing
     */
    public RenderedMessage render(TemplateSpec template, RecipientRow row) {
        if (!row.isValid()) {
            throw new RenderException(row.getRowIndex(), row.getInvalidReason());
        }
        if (row.getTo().isEmpty()) {
            throw new RenderException(row.getRowIndex(), "recipient row is missing 'to'");
        }

        if (template == null) {
            if (row.getSubject() == null) {
                throw new RenderException(row.getRowIndex(), "recipient row is missing 'subject'");
            }
            if (row.getBody() == null) {
                throw new RenderException(row.getRowIndex(), "recipient row is missing 'body'");
            }
            return new RenderedMessage(row.getTo(), row.getSubject(), row.getBody(), row.getFrom());
        }

        Set<String> missing = new TreeSet<>();
        collectMissing(template.subject(), row, missing);
        collectMissing(template.body(), row, missing);
        if (!missing.isEmpty()) {
            throw new RenderException(row.getRowIndex(),
                    "missing value for placeholder(s): " + String.join(", ", missing), new ArrayList<>(missing));
        }

        String from = row.getFrom() != null ? row.getFrom() : template.from();
        return new RenderedMessage(row.getTo(), substitute(template.subject(), row), substitute(template.body(), row), from);
    }

    /**
     * Placeholder names referenced by the template, in order of first appearance.
     */
    public static List<String> placeholdersOf(TemplateSpec template) {
        Set<String> names = new LinkedHashSet<>();
        for (String text : List.of(template.subject(), template.body())) {
            Matcher m = PLACEHOLDER.matcher(text);
            while (m.find()) {
                names.add(m.group(1));
            }
        }
        return new ArrayList<>(names);
    }

    private static void collectMissing(String text, RecipientRow row, Set<String> missing) {
        Matcher m = PLACEHOLDER.matcher(text);
        while (m.find()) {
            if (lookup(row, m.group(1)) == null) {
                missing.add(m.group(1));
            }
        }
    }

    private static String substitute(String text, RecipientRow row) {
        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(lookup(row, m.group(1))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String lookup(RecipientRow row, String name) {
        String value = row.getField(name);
        if (value == null && RecipientRow.FIELD_TO.equals(name)) {
            return row.toDisplay();
        }
        return value;
    }
}
