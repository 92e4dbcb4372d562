package io.github.hotbrkm.mailgoat.dispatcher.send.engine;

import io.github.hotbrkm.mailgoat.dispatcher.send.engine.metrics.BatchSendMetrics;
import io.github.hotbrkm.mailgoat.dispatcher.send.entry.RecipientRow;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchOutcomeWriter;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchRecord;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchRecorder;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.MessageOutcome;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.OutcomeWriteException;
import io.github.hotbrkm.mailgoat.dispatcher.send.template.RenderException;
import io.github.hotbrkm.mailgoat.dispatcher.send.template.RenderedMessage;
import io.github.hotbrkm.mailgoat.dispatcher.send.template.TemplateRenderer;
import io.github.hotbrkm.mailgoat.dispatcher.send.transport.MailApiClient;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Drives one batch: render, pace, send and record each row in input order, then seal.
 * <p>
 * Render and send failures are both recorded as failed outcomes. With continue-on-error off the first failure
 * seals the batch as aborted and no later row is attempted. Rows are never retried. Row-scoped errors never leave
 * {@link #run}; reading errors do. A writer that fails is dropped for the rest of the batch and its failure is
 * handed to {@link BatchDispatchRequest#onWriterFailure()}, so the batch still seals.
 */
@Slf4j
public class BatchDispatcher {

    private final TemplateRenderer renderer;
    private final BatchSendMetrics metrics;
    private final Clock clock;
    private final Supplier<String> batchIdGenerator;

    public BatchDispatcher(TemplateRenderer renderer, BatchSendMetrics metrics) {
        this(renderer, metrics, Clock.systemUTC(), () -> UUID.randomUUID().toString().replace("-", ""));
    }

    public BatchDispatcher(TemplateRenderer renderer, BatchSendMetrics metrics, Clock clock,
                           Supplier<String> batchIdGenerator) {
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.batchIdGenerator = Objects.requireNonNull(batchIdGenerator, "batchIdGenerator must not be null");
    }

    /**
     * Runs the batch to completion or abort.
     *
     * @return sealed record with one outcome per attempted row
     */
    public BatchRecord run(BatchDispatchRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String batchId = batchIdGenerator.get();
        // full pass first: malformed input fails here, before anything is sent
        int total = request.totalCount() != null ? request.totalCount() : request.rows().count();
        SendRateLimiter limiter = request.rateLimiter();
        BatchRecorder recorder = new BatchRecorder(batchId, request.profile().name(), total,
                request.continueOnError(), limiter.getRatePerSecond(), clock);

        log.info("batchId={}, event=batch_started, profile={}, source={}, total={}, continueOnError={}, rateLimit={}",
                batchId, request.profile().name(), request.rows().describe(), total, request.continueOnError(),
                limiter.isUnlimited() ? "none" : limiter.getRatePerSecond());
        List<BatchOutcomeWriter> writers = new ArrayList<>(request.writers());
        notifyWriters(batchId, writers, writer -> writer.onBatchStarted(batchId, total), request);

        String defaultSender = request.profile().defaultSender();
        DispatchState state = DispatchState.IDLE;
        boolean aborted = false;
        Iterator<RecipientRow> rows = request.rows().iterator();
        try {
            while (rows.hasNext()) {
                RecipientRow row = rows.next();
                state = state.transitionTo(DispatchState.RENDERING);
                MessageOutcome outcome;
                RenderedMessage message = null;
                try {
                    message = renderer.render(request.template(), row).withDefaultSender(defaultSender);
                } catch (RenderException e) {
                    outcome = MessageOutcome.failed(row.getRowIndex(), row.getTo(), e);
                    state = state.transitionTo(DispatchState.RECORDED);
                    aborted = record(batchId, recorder, outcome, writers, request);
                    if (aborted) {
                        break;
                    }
                    continue;
                }

                state = state.transitionTo(DispatchState.SENDING);
                outcome = send(batchId, row.getRowIndex(), message, request.client(), limiter);
                state = state.transitionTo(DispatchState.RECORDED);
                aborted = record(batchId, recorder, outcome, writers, request);
                if (aborted) {
                    break;
                }
            }
        } finally {
            closeIterator(rows);
        }

        state.transitionTo(DispatchState.SEALED);
        BatchRecord record = recorder.seal(aborted);
        metrics.recordSealed(record.status());
        notifyWriters(batchId, writers, writer -> writer.onBatchSealed(record), request);
        log.info("batchId={}, event=batch_sealed, status={}, attempted={}, sent={}, failed={}, total={}, rateLimitWaitMs={}",
                batchId, record.status().code(), record.attemptedCount(), record.sentCount(), record.failedCount(),
                total, limiter.getTotalWaitNanos() / 1_000_000L);
        record.abortPoint().ifPresent(stop ->
                log.warn("batchId={}, event=batch_aborted, rowIndex={}, reason={}", batchId, stop.rowIndex(), stop.error()));
        return record;
    }

    /**
     * Paces and sends one rendered message. Any failure becomes a failed outcome.
     */
    private MessageOutcome send(String batchId, int rowIndex, RenderedMessage message, MailApiClient client,
                                SendRateLimiter limiter) {
        try {
            metrics.recordRateLimitWait(limiter.acquire());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("batchId={}, event=rate_limit_interrupted, rowIndex={}", batchId, rowIndex);
            return MessageOutcome.failed(rowIndex, message.to(),
                    new IllegalStateException("interrupted while waiting for the rate limit", e));
        }

        long start = System.nanoTime();
        boolean success = false;
        try {
            log.debug("batchId={}, event=sending, rowIndex={}, to={}", batchId, rowIndex, message.to());
            String messageId = client.send(message.to(), message.subject(), message.body(), message.fromAddress(), List.of());
            success = true;
            return MessageOutcome.sent(rowIndex, message.to(), messageId);
        } catch (RuntimeException e) {
            return MessageOutcome.failed(rowIndex, message.to(), e);
        } finally {
            metrics.recordSendDuration(System.nanoTime() - start, success);
        }
    }

    /**
     * Records and publishes one outcome.
     *
     * @return true if the batch must stop here
     */
    private boolean record(String batchId, BatchRecorder recorder, MessageOutcome outcome,
                           List<BatchOutcomeWriter> writers, BatchDispatchRequest request) {
        recorder.record(outcome);
        metrics.recordOutcome(outcome);
        notifyWriters(batchId, writers, writer -> writer.writeOutcome(batchId, outcome), request);
        if (outcome.isSent()) {
            log.debug("batchId={}, event=row_sent, rowIndex={}, messageId={}", batchId, outcome.rowIndex(), outcome.messageId());
            return false;
        }
        log.warn("batchId={}, event=row_failed, rowIndex={}, kind={}, to={}, error={}",
                batchId, outcome.rowIndex(), outcome.failureKind(), outcome.to(), outcome.error());
        return !request.continueOnError();
    }

    /**
     * Calls every active writer, dropping the ones that fail.
     */
    private void notifyWriters(String batchId, List<BatchOutcomeWriter> writers, Consumer<BatchOutcomeWriter> call,
                               BatchDispatchRequest request) {
        Iterator<BatchOutcomeWriter> it = writers.iterator();
        while (it.hasNext()) {
            BatchOutcomeWriter writer = it.next();
            try {
                call.accept(writer);
            } catch (OutcomeWriteException e) {
                it.remove();
                log.error("batchId={}, event=outcome_writer_dropped, writer={}, message={}",
                        batchId, writer.getClass().getSimpleName(), e.getMessage(), e);
                request.onWriterFailure().accept(e);
            }
        }
    }

    private void closeIterator(Iterator<RecipientRow> rows) {
        if (rows instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.warn("event=row_source_close_failed, message={}", e.getMessage());
            }
        }
    }
}
