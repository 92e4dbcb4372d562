package io.github.hotbrkm.mailgoat.dispatcher.send.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link TemplateSpec} from a JSON file of the form
 * {@code {"subject": "...", "body": "...", "from": "..."}}; {@code from} is optional.
 */
@Slf4j
@RequiredArgsConstructor
public class TemplateLoader {

    private final ObjectMapper objectMapper;

    /**
     * @param path template file, or null for no template
     * @return the template, or null when {@code path} is null
     * @throws TemplateValidationException if the file is unreadable or not a valid template object
     */
    public TemplateSpec load(Path path) {
        if (path == null) {
            return null;
        }
        if (!Files.isRegularFile(path)) {
            throw new TemplateValidationException("template file not found: " + path);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new TemplateValidationException("template file is not valid JSON: " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new TemplateValidationException("template file must be a JSON object: " + path);
        }

        String subject = requiredString(root, "subject", path);
        String body = requiredString(root, "body", path);
        String from = optionalString(root, "from", path);
        if (from == null) {
            from = optionalString(root, "from_address", path);
        }

        TemplateSpec template = new TemplateSpec(subject, body, from);
        log.debug("event=template_loaded, path={}, placeholders={}", path, TemplateRenderer.placeholdersOf(template));
        return template;
    }

    private static String requiredString(JsonNode root, String name, Path path) {
        JsonNode value = root.get(name);
        if (value == null || !value.isTextual()) {
            throw new TemplateValidationException("template field '" + name + "' must be a string: " + path);
        }
        return value.asText();
    }

    private static String optionalString(JsonNode root, String name, Path path) {
        JsonNode value = root.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new TemplateValidationException("template field '" + name + "' must be a string: " + path);
        }
        return value.asText();
    }
}
