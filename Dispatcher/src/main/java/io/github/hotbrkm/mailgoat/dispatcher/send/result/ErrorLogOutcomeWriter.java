package io.github.hotbrkm.mailgoat.dispatcher.send.result;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Appends one line per failed outcome to a plain-text error log.
 * <p>
 * Line format: {@code recipient=<to> error=<message>}. Sent outcomes are not written.
 */
@Slf4j
public class ErrorLogOutcomeWriter implements BatchOutcomeWriter {

    private final Path path;
    private final BufferedWriter writer;
    private int written;

    public ErrorLogOutcomeWriter(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new OutcomeWriteException("cannot open error log " + path, e);
        }
    }

    @Override
    public void writeOutcome(String batchId, MessageOutcome outcome) {
        if (!outcome.isFailed()) {
            return;
        }
        try {
            writer.write("recipient=" + String.join(", ", outcome.to()) + " error=" + outcome.error());
            writer.newLine();
            writer.flush();
            written++;
        } catch (IOException e) {
            throw new OutcomeWriteException("failed to write error log " + path, e);
        }
    }

    @Override
    public void close() {
        try {
            writer.close();
        } catch (IOException e) {
            throw new OutcomeWriteException("failed to close error log " + path, e);
        }
        log.debug("event=error_log_closed, path={}, lines={}", path, written);
    }

    public Path getPath() {
        return path;
    }
}
