package io.github.hotbrkm.mailgoat.dispatcher.send.result;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Redraws a single terminal progress line after every outcome, for example
 * {@code [############------------] 5/10 sent=4 failed=1}.
 */
public class ProgressOutcomeWriter implements BatchOutcomeWriter {

    static final int BAR_WIDTH = 24;

    private final PrintStream out;
    private int total;
    private int current;
    private int sent;
    private int failed;

    public ProgressOutcomeWriter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public void onBatchStarted(String batchId, int totalCount) {
        total = totalCount;
        current = 0;
        sent = 0;
        failed = 0;
    }

    @Override
    public void writeOutcome(String batchId, MessageOutcome outcome) {
        current++;
        if (outcome.isSent()) {
            sent++;
        } else {
            failed++;
        }
        out.print("\r" + line(current, total, sent, failed));
        out.flush();
    }

    @Override
    public void onBatchSealed(BatchRecord record) {
        if (current > 0) {
            out.println();
            out.flush();
        }
    }

    @Override
    public void close() {
        // stream is owned by the caller
    }

    static String line(int current, int total, int sent, int failed) {
        int completed = total > 0 ? (int) ((long) current * BAR_WIDTH / total) : BAR_WIDTH;
        completed = Math.min(completed, BAR_WIDTH);
        return "[" + "#".repeat(completed) + "-".repeat(BAR_WIDTH - completed) + "] "
                + current + "/" + total + " sent=" + sent + " failed=" + failed;
    }
}
