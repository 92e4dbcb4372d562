package io.github.hotbrkm.mailgoat.dispatcher.send.engine;

import io.github.hotbrkm.mailgoat.dispatcher.send.entry.RecipientSourceSelection;
import lombok.Builder;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Options of one {@code send-batch} invocation.
 *
 * @param templatePath  template file, or null
 * @param rateLimit     sends per second, or null for unlimited
 * @param errorLogPath  file receiving one line per failed row, or null
 * @param stdin         stream read when the source is standard input
 * @param progressOut   stream for the progress line, or null to disable it
 */
@Builder
public record BatchSendRequest(RecipientSourceSelection source, Path templatePath, boolean continueOnError,
                               Double rateLimit, Path errorLogPath, InputStream stdin, PrintStream progressOut) {

    public BatchSendRequest {
        Objects.requireNonNull(source, "source must not be null");
    }
}
