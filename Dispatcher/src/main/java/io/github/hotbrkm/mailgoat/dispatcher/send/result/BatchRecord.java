package io.github.hotbrkm.mailgoat.dispatcher.send.result;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sealed result of one send-batch invocation. Immutable; produced by {@link BatchRecorder#seal}.
 * <p>
 * {@code outcomes} holds exactly one entry per attempted row in input order. For an aborted batch the last entry is
 * the row that stopped it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchRecord(String batchId, String profileName, Instant createdAt, Instant finishedAt, int totalCount,
                          boolean continueOnError, Double rateLimit, BatchStatus status, List<MessageOutcome> outcomes) {

    public BatchRecord {
        Objects.requireNonNull(batchId, "batchId must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(status, "status must not be null");
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public int sentCount() {
        return (int) outcomes.stream().filter(MessageOutcome::isSent).count();
    }

    public int failedCount() {
        return (int) outcomes.stream().filter(MessageOutcome::isFailed).count();
    }

    public int attemptedCount() {
        return outcomes.size();
    }

    /**
     * The row that stopped an aborted batch.
     */
    public Optional<MessageOutcome> abortPoint() {
        if (status != BatchStatus.ABORTED || outcomes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(outcomes.get(outcomes.size() - 1));
    }
}
