package io.github.hotbrkm.mailgoat.dispatcher.send.template;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TemplateLoader template file validation")
class TemplateLoaderTest {

    @TempDir
    Path tempDir;

    private final TemplateLoader loader = new TemplateLoader(new ObjectMapper());

    @Test
    @DisplayName("No path means no template")
    void nullPath() {
        assertThat(loader.load(null)).isNull();
    }

    @Test
    @DisplayName("Loads subject, body and optional from")
    void loadsTemplate() throws Exception {
        Path file = write("{\"subject\":\"Hello {{name}}\",\"body\":\"Your code is {{code}}\",\"from\":\"ops@example.com\"}");

        TemplateSpec template = loader.load(file);

        assertThat(template.subject()).isEqualTo("Hello {{name}}");
        assertThat(template.body()).isEqualTo("Your code is {{code}}");
        assertThat(template.from()).isEqualTo("ops@example.com");
    }

    @Test
    @DisplayName("Missing body is a validation error")
    void missingBody() throws Exception {
        Path file = write("{\"subject\":\"s\"}");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(TemplateValidationException.class)
                .hasMessageContaining("'body'");
    }

    @Test
    @DisplayName("Non-string fields, non-object documents and bad JSON are validation errors")
    void invalidDocuments() throws Exception {
        assertThatThrownBy(() -> loader.load(write("{\"subject\":1,\"body\":\"b\"}")))
                .isInstanceOf(TemplateValidationException.class);
        assertThatThrownBy(() -> loader.load(write("{\"subject\":\"s\",\"body\":\"b\",\"from\":[1]}")))
                .isInstanceOf(TemplateValidationException.class);
        assertThatThrownBy(() -> loader.load(write("[\"s\",\"b\"]")))
                .isInstanceOf(TemplateValidationException.class);
        assertThatThrownBy(() -> loader.load(write("{not json")))
                .isInstanceOf(TemplateValidationException.class);
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.json")))
                .isInstanceOf(TemplateValidationException.class)
                .hasMessageContaining("not found");
    }

    private Path write(String content) throws Exception {
        Path file = Files.createTempFile(tempDir, "template", ".json");
        Files.writeString(file, content);
        return file;
    }
}
