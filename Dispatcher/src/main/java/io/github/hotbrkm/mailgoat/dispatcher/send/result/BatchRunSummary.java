package io.github.hotbrkm.mailgoat.dispatcher.send.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Summary of one batch as printed by the command line: counts, abort point, per-domain statistics and failed rows.
 * <p>
 * {@code persisted} is false when the batch ran but its record could not be stored; {@code storageError} then
 * carries the reason. {@code outputError} is set when an outcome writer such as the error log failed during the run.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchRunSummary(String batchId, BatchStatus status, String profile, int total, int attempted, int sent,
                              int failed, Instant createdAt, Instant finishedAt, Double rateLimit,
                              Integer abortedAtRow, String abortReason, Map<String, DomainStats> domainStats,
                              List<MessageOutcome> failures, boolean persisted, String storageError,
                              String outputError) {

    public Map<String, DomainStats> domainStatsView() {
        return domainStats == null ? Collections.emptyMap() : Collections.unmodifiableMap(domainStats);
    }

    public BatchRunSummary withStorageError(String message) {
        return toBuilder().persisted(false).storageError(message).build();
    }

    public BatchRunSummary withOutputError(String message) {
        return toBuilder().outputError(message).build();
    }

    /**
     * Whether the run hit a local storage or output failure.
     */
    public boolean hasLocalFailure() {
        return !persisted || outputError != null;
    }

    public record DomainStats(int total, int sent) {
        public double successRate() {
            return total > 0 ? (sent * 100.0) / total : 0.0;
        }
    }
}
