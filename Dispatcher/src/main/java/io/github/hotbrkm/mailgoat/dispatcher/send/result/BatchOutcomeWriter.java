package io.github.hotbrkm.mailgoat.dispatcher.send.result;

/**
 * Listener for outcomes of a running batch.
 */
public interface BatchOutcomeWriter {

    /**
     * Called once before the first row is attempted.
     *
     * @param batchId    id of the batch being dispatched
     * @param totalCount number of rows in the input
     */
    default void onBatchStarted(String batchId, int totalCount) {
    }

    /**
     * Writes one outcome. Called in input order.
     *
     * @param batchId id of the batch the outcome belongs to
     * @param outcome outcome of the attempted row
     */
    void writeOutcome(String batchId, MessageOutcome outcome);

    /**
     * Called once after the batch record has been sealed.
     */
    default void onBatchSealed(BatchRecord record) {
    }

    /**
     * Closes resources.
     */
    void close();
}
