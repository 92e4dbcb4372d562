package io.github.hotbrkm.mailgoat.dispatcher.send.entry;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Opens the selected recipient source as a {@link RecipientRows} sequence.
 * <p>
 * The source selection is checked before any I/O. Structural problems (missing CSV columns, a JSON document
 * that is not an array) are reported here, so nothing is sent from a malformed source.
 */
@Slf4j
public class RecipientSourceReader {

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    public RecipientSourceReader(ObjectMapper objectMapper) {
        this(objectMapper, new CsvMapper());
    }

    public RecipientSourceReader(ObjectMapper objectMapper, CsvMapper csvMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.csvMapper = Objects.requireNonNull(csvMapper, "csvMapper must not be null");
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.csvMapper.enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE);
    }

    /**
     * Opens the source.
     *
     * @param selection        chosen input, validated before anything is read
     * @param templateSupplied whether a template will render subject/body (relaxes CSV column requirements)
     * @param stdin            stream used when the selection is standard input
     * @return restartable row sequence
     * @throws BatchConfigurationException   if not exactly one source is selected
     * @throws RecipientValidationException if the source is unreadable or structurally invalid
     */
    public RecipientRows open(RecipientSourceSelection selection, boolean templateSupplied, InputStream stdin) {
        Objects.requireNonNull(selection, "selection must not be null");
        RecipientSourceSelection.Kind kind = selection.validate();

        RecipientRows rows = switch (kind) {
            case CSV -> openCsv(selection.csvPath(), templateSupplied);
            case JSON -> openJson(selection.jsonPath());
            case STDIN -> openStdin(stdin);
        };
        log.debug("event=recipient_source_opened, source={}, templateSupplied={}", rows.describe(), templateSupplied);
        return rows;
    }

    private RecipientRows openCsv(Path path, boolean templateSupplied) {
        requireReadable(path);
        InputSupplier supplier = () -> Files.newInputStream(path);
        validateCsvHeader(readCsvHeader(supplier, path), templateSupplied, path);
        return new CsvRecipientRows(csvMapper, supplier, "csv:" + path);
    }

    private RecipientRows openJson(Path path) {
        requireReadable(path);
        InputSupplier supplier = () -> Files.newInputStream(path);
        requireJsonArray(supplier, "json:" + path);
        return new JsonRecipientRows(objectMapper, supplier, "json:" + path);
    }

    private RecipientRows openStdin(InputStream stdin) {
        Objects.requireNonNull(stdin, "stdin must not be null");
        byte[] content;
        try {
            content = stdin.readAllBytes();
        } catch (IOException e) {
            throw new RecipientValidationException("failed to read recipients from standard input", e);
        }
        InputSupplier supplier = () -> new ByteArrayInputStream(content);
        requireJsonArray(supplier, "stdin");
        return new JsonRecipientRows(objectMapper, supplier, "stdin");
    }

    private List<String> readCsvHeader(InputSupplier supplier, Path path) {
        try (InputStream in = supplier.open();
             var it = csvMapper.readerFor(String[].class)
                     .with(CsvParser.Feature.WRAP_AS_ARRAY)
                     .<String[]>readValues(in)) {
            if (!it.hasNextValue()) {
                throw new RecipientValidationException("CSV input has no header row: " + path);
            }
            String[] header = it.nextValue();
            return Arrays.stream(header).map(String::trim).toList();
        } catch (IOException e) {
            throw new RecipientValidationException("failed to read CSV header: " + path, e);
        }
    }

    private void validateCsvHeader(List<String> header, boolean templateSupplied, Path path) {
        Set<String> columns = new HashSet<>(header);
        if (!columns.contains(RecipientRow.FIELD_TO)) {
            throw new RecipientValidationException("CSV input is missing required column 'to': " + path);
        }
        if (!templateSupplied) {
            for (String required : List.of(RecipientRow.FIELD_SUBJECT, RecipientRow.FIELD_BODY)) {
                if (!columns.contains(required)) {
                    throw new RecipientValidationException(
                            "CSV input is missing required column '" + required + "' (required without --template): " + path);
                }
            }
        }
    }

    private void requireJsonArray(InputSupplier supplier, String description) {
        try (InputStream in = supplier.open(); JsonParser parser = objectMapper.createParser(in)) {
            JsonToken first = parser.nextToken();
            if (first != JsonToken.START_ARRAY) {
                throw new RecipientValidationException("JSON input must be an array of recipient objects: " + description);
            }
        } catch (IOException e) {
            throw new RecipientValidationException("invalid JSON input: " + description, e);
        }
    }

    private static void requireReadable(Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new RecipientValidationException("input file not found or not readable: " + path);
        }
    }

    /**
     * Reopens the underlying bytes for each pass over the source.
     */
    @FunctionalInterface
    interface InputSupplier {
        InputStream open() throws IOException;
    }
}
