package io.github.hotbrkm.mailgoat.dispatcher.send.result;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates outcomes for a running batch until it is sealed.
 * <p>
 * Not thread-safe: one recorder belongs to one dispatch loop.
 */
public final class BatchRecorder {

    private final String batchId;
    private final String profileName;
    private final int totalCount;
    private final boolean continueOnError;
    private final Double rateLimit;
    private final Clock clock;
    private final Instant createdAt;
    private final List<MessageOutcome> outcomes = new ArrayList<>();
    private int failedCount;
    private BatchRecord sealed;

    public BatchRecorder(String batchId, String profileName, int totalCount, boolean continueOnError, Double rateLimit,
                         Clock clock) {
        this.batchId = Objects.requireNonNull(batchId, "batchId must not be null");
        this.profileName = profileName;
        this.totalCount = totalCount;
        this.continueOnError = continueOnError;
        this.rateLimit = rateLimit;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.createdAt = clock.instant();
    }

    public String getBatchId() {
        return batchId;
    }

    /**
     * Appends the outcome of the next attempted row. Rows must arrive in strictly increasing input order.
     */
    public void record(MessageOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (sealed != null) {
            throw new IllegalStateException("batch " + batchId + " is already sealed");
        }
        if (!outcomes.isEmpty() && outcome.rowIndex() <= outcomes.get(outcomes.size() - 1).rowIndex()) {
            throw new IllegalStateException("outcome for row " + outcome.rowIndex() + " is out of input order");
        }
        outcomes.add(outcome);
        if (outcome.isFailed()) {
            failedCount++;
        }
    }

    public int sentCount() {
        return outcomes.size() - failedCount;
    }

    public int failedCount() {
        return failedCount;
    }

    /**
     * Finalizes the status and returns the immutable record. Further calls return the same record.
     *
     * @param aborted whether the loop stopped early on a failed row
     */
    public BatchRecord seal(boolean aborted) {
        if (sealed == null) {
            sealed = new BatchRecord(batchId, profileName, createdAt, clock.instant(), totalCount, continueOnError,
                    rateLimit, BatchStatus.of(aborted, failedCount), outcomes);
        }
        return sealed;
    }

    public boolean isSealed() {
        return sealed != null;
    }
}
