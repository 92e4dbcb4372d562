package io.github.hotbrkm.mailgoat.dispatcher.send.template;

import io.github.hotbrkm.mailgoat.dispatcher.send.entry.RecipientRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TemplateRenderer rendering")
class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    @Test
    @DisplayName("Without a template the row's own to/subject/body are used unchanged")
    void rendersRowWithoutTemplate() {
        RecipientRow row = row(0, Map.of("name", "Ada"), "Welcome", "Hello user1");

        RenderedMessage message = renderer.render(null, row);

        assertThat(message.to()).containsExactly("user0@example.com");
        assertThat(message.subject()).isEqualTo("Welcome");
        assertThat(message.body()).isEqualTo("Hello user1");
        assertThat(message.fromAddress()).isNull();
    }

    @Test
    @DisplayName("Without a template a missing body is a render failure")
    void missingBodyWithoutTemplate() {
        RecipientRow row = row(3, Map.of(), "Welcome", null);

        assertThatThrownBy(() -> renderer.render(null, row))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("'body'")
                .matches(e -> ((RenderException) e).getRowIndex() == 3);
    }

    @Test
    @DisplayName("Placeholders are substituted from row fields, spaces inside braces tolerated")
    void substitutesPlaceholders() {
        TemplateSpec template = TemplateSpec.of("Hello {{name}}", "Your code is {{ code }} for {{to}}");
        RecipientRow row = row(0, Map.of("name", "Ada", "code", "X1"), null, null);

        RenderedMessage message = renderer.render(template, row);

        assertThat(message.subject()).isEqualTo("Hello Ada");
        assertThat(message.body()).isEqualTo("Your code is X1 for user0@example.com");
    }

    @Test
    @DisplayName("Missing placeholder value fails the row and names the placeholder")
    void missingPlaceholder() {
        TemplateSpec template = TemplateSpec.of("Hello {{name}}", "Your code is {{code}}");
        RecipientRow row = row(0, Map.of("name", "Ada"), null, null);

        assertThatThrownBy(() -> renderer.render(template, row))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("code")
                .matches(e -> ((RenderException) e).getMissingPlaceholders().equals(List.of("code")));
    }

    @Test
    @DisplayName("Every missing placeholder is reported, sorted")
    void reportsAllMissingSorted() {
        TemplateSpec template = TemplateSpec.of("{{zeta}} {{alpha}}", "{{mid}} {{alpha}}");

        assertThatThrownBy(() -> renderer.render(template, row(0, Map.of(), null, null)))
                .isInstanceOf(RenderException.class)
                .hasMessage("missing value for placeholder(s): alpha, mid, zeta");
    }

    @Test
    @DisplayName("Text without placeholders is returned unchanged")
    void literalTemplateIsIdempotent() {
        TemplateSpec template = TemplateSpec.of("Plain subject $1 \\ {not} {{", "Body with } braces {");

        RenderedMessage message = renderer.render(template, row(0, Map.of("name", "Ada"), null, null));

        assertThat(message.subject()).isEqualTo(template.subject());
        assertThat(message.body()).isEqualTo(template.body());
    }

    @Test
    @DisplayName("Substituted values are not scanned again")
    void singlePassSubstitution() {
        TemplateSpec template = TemplateSpec.of("{{a}}", "{{b}}");
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("a", "{{b}}");
        fields.put("b", "$1 literal");

        RenderedMessage message = renderer.render(template, row(0, fields, null, null));

        assertThat(message.subject()).isEqualTo("{{b}}");
        assertThat(message.body()).isEqualTo("$1 literal");
    }

    @Test
    @DisplayName("A failing row does not affect rendering of other rows")
    void failureIsRowScoped() {
        TemplateSpec template = TemplateSpec.of("Hello {{name}}", "Body");
        RecipientRow good = row(0, Map.of("name", "Ada"), null, null);
        RecipientRow bad = row(1, Map.of(), null, null);
        RecipientRow alsoGood = row(2, Map.of("name", "Lin"), null, null);

        assertThat(renderer.render(template, good).subject()).isEqualTo("Hello Ada");
        assertThatThrownBy(() -> renderer.render(template, bad)).isInstanceOf(RenderException.class);
        assertThat(renderer.render(template, alsoGood).subject()).isEqualTo("Hello Lin");
    }

    @Test
    @DisplayName("Row sender overrides template sender")
    void senderPrecedence() {
        TemplateSpec template = new TemplateSpec("s", "b", "template@example.com");
        RecipientRow withFrom = RecipientRow.builder()
                .rowIndex(0).to(List.of("a@example.com")).from("row@example.com").build();
        RecipientRow withoutFrom = RecipientRow.builder()
                .rowIndex(1).to(List.of("b@example.com")).build();

        assertThat(renderer.render(template, withFrom).fromAddress()).isEqualTo("row@example.com");
        assertThat(renderer.render(template, withoutFrom).fromAddress()).isEqualTo("template@example.com");
        assertThat(renderer.render(template, withoutFrom).withDefaultSender("profile@example.com").fromAddress())
                .isEqualTo("template@example.com");
    }

    @Test
    @DisplayName("An invalid row fails with the reason recorded while reading")
    void invalidRow() {
        RecipientRow invalid = RecipientRow.invalid(4, List.of(), "'to' must be a string or an array of strings");

        assertThatThrownBy(() -> renderer.render(TemplateSpec.of("s", "b"), invalid))
                .isInstanceOf(RenderException.class)
                .hasMessage("'to' must be a string or an array of strings");
    }

    @Test
    @DisplayName("Lists placeholders in order of first appearance")
    void placeholdersOf() {
        TemplateSpec template = TemplateSpec.of("Hello {{name}}", "{{code}} {{name}}");

        assertThat(TemplateRenderer.placeholdersOf(template)).containsExactly("name", "code");
    }

    private RecipientRow row(int index, Map<String, String> fields, String subject, String body) {
        return RecipientRow.builder()
                .rowIndex(index)
                .to(List.of("user" + index + "@example.com"))
                .subject(subject)
                .body(body)
                .fields(fields)
                .build();
    }
}
