package io.github.hotbrkm.mailgoat.dispatcher.send.result;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stores each sealed batch as {@code <batchId>.json} under one directory.
 * <p>
 * Records are written to a temporary file and moved into place without replacing, so a batch id can be saved
 * once. Saves of distinct ids touch distinct files and need no locking.
 */
@Slf4j
public class JsonFileBatchStore implements BatchStore {

    private static final Pattern BATCH_ID = Pattern.compile("[A-Za-z0-9-]+");
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileBatchStore(Path directory, ObjectMapper objectMapper) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(BatchRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Path target = pathOf(record.batchId());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            if (Files.exists(target)) {
                throw new FileAlreadyExistsException(target.toString());
            }
            temp = Files.createTempFile(directory, record.batchId() + ".", ".tmp");
            objectMapper.writeValue(temp.toFile(), record);
            Files.move(temp, target);
            temp = null;
            log.debug("batchId={}, event=batch_saved, path={}", record.batchId(), target);
        } catch (FileAlreadyExistsException e) {
            throw new BatchStorageException("batch already stored: " + record.batchId(), e);
        } catch (IOException e) {
            throw new BatchStorageException("failed to save batch " + record.batchId() + " to " + directory, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public BatchRecord load(String batchId) {
        Path path = pathOf(batchId);
        try (InputStream in = Files.newInputStream(path)) {
            return objectMapper.readValue(in, BatchRecord.class);
        } catch (NoSuchFileException e) {
            throw new BatchNotFoundException(batchId);
        } catch (IOException e) {
            throw new BatchStorageException("failed to read batch " + batchId + " from " + path, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private Path pathOf(String batchId) {
        if (batchId == null || !BATCH_ID.matcher(batchId).matches()) {
            throw new BatchNotFoundException(String.valueOf(batchId));
        }
        return directory.resolve(batchId + SUFFIX);
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("event=temp_file_cleanup_failed, path={}, message={}", temp, e.getMessage());
        }
    }
}
