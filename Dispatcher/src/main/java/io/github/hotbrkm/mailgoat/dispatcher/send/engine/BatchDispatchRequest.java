package io.github.hotbrkm.mailgoat.dispatcher.send.engine;

import io.github.hotbrkm.mailgoat.dispatcher.profile.MailProfile;
import io.github.hotbrkm.mailgoat.dispatcher.send.entry.RecipientRows;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchOutcomeWriter;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.OutcomeWriteException;
import io.github.hotbrkm.mailgoat.dispatcher.send.template.TemplateSpec;
import io.github.hotbrkm.mailgoat.dispatcher.send.transport.MailApiClient;
import lombok.Builder;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Everything one dispatch run needs.
 *
 * @param template          template, or null to take subject and body from each row
 * @param rateLimiter       pacing for send attempts; unlimited when null
 * @param writers           outcome listeners, called in order; not closed by the dispatcher
 * @param totalCount        row count from an earlier full pass, or null to count before dispatching
 * @param onWriterFailure   receives the failure of a writer that was dropped mid-batch
 */
@Builder
public record BatchDispatchRequest(RecipientRows rows, TemplateSpec template, MailProfile profile, MailApiClient client,
                                   SendRateLimiter rateLimiter, boolean continueOnError,
                                   List<BatchOutcomeWriter> writers, Integer totalCount,
                                   Consumer<OutcomeWriteException> onWriterFailure) {

    public BatchDispatchRequest {
        Objects.requireNonNull(rows, "rows must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(client, "client must not be null");
        rateLimiter = rateLimiter == null ? SendRateLimiter.unlimited() : rateLimiter;
        writers = writers == null ? List.of() : List.copyOf(writers);
        onWriterFailure = onWriterFailure == null ? e -> { } : onWriterFailure;
    }
}
