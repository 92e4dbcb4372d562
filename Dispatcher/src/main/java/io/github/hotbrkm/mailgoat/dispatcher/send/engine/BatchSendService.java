package io.github.hotbrkm.mailgoat.dispatcher.send.engine;

import io.github.hotbrkm.mailgoat.dispatcher.profile.MailProfile;
import io.github.hotbrkm.mailgoat.dispatcher.send.entry.RecipientRows;
import io.github.hotbrkm.mailgoat.dispatcher.send.entry.RecipientSourceReader;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchOutcomeWriter;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchRecord;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchRunSummary;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchStorageException;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchStore;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.ErrorLogOutcomeWriter;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.OutcomeWriteException;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.ProgressOutcomeWriter;
import io.github.hotbrkm.mailgoat.dispatcher.send.template.TemplateLoader;
import io.github.hotbrkm.mailgoat.dispatcher.send.template.TemplateSpec;
import io.github.hotbrkm.mailgoat.dispatcher.send.transport.MailApiClientFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a {@code send-batch} invocation end to end: validate options, load template, open input, dispatch, store.
 * <p>
 * Configuration and validation errors are raised before any row is sent or any output file is opened. Store and
 * writer failures do not lose the result: the batch is still sealed and the returned summary carries the failure.
 */
@Slf4j
public class BatchSendService {

    private final RecipientSourceReader reader;
    private final TemplateLoader templateLoader;
    private final BatchDispatcher dispatcher;
    private final MailApiClientFactory clientFactory;
    private final BatchStore batchStore;
    private final BatchSummaryAggregator aggregator;

    public BatchSendService(RecipientSourceReader reader, TemplateLoader templateLoader, BatchDispatcher dispatcher,
                            MailApiClientFactory clientFactory, BatchStore batchStore, BatchSummaryAggregator aggregator) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.templateLoader = Objects.requireNonNull(templateLoader, "templateLoader must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory must not be null");
        this.batchStore = Objects.requireNonNull(batchStore, "batchStore must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
    }

    public BatchRunSummary send(MailProfile profile, BatchSendRequest request) {
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(request, "request must not be null");

        request.source().validate();
        SendRateLimiter limiter = SendRateLimiter.of(request.rateLimit());
        TemplateSpec template = templateLoader.load(request.templatePath());
        RecipientRows rows = reader.open(request.source(), template != null, request.stdin());
        int total = rows.count();

        List<BatchOutcomeWriter> writers = new ArrayList<>();
        List<OutcomeWriteException> writerFailures = new ArrayList<>();
        BatchRecord record;
        try {
            if (request.errorLogPath() != null) {
                writers.add(new ErrorLogOutcomeWriter(request.errorLogPath()));
            }
            if (request.progressOut() != null) {
                writers.add(new ProgressOutcomeWriter(request.progressOut()));
            }
            record = dispatcher.run(BatchDispatchRequest.builder()
                    .rows(rows)
                    .template(template)
                    .profile(profile)
                    .client(clientFactory.create(profile))
                    .rateLimiter(limiter)
                    .continueOnError(request.continueOnError())
                    .writers(writers)
                    .totalCount(total)
                    .onWriterFailure(writerFailures::add)
                    .build());
        } finally {
            closeWriters(writers, writerFailures);
        }

        BatchRunSummary summary = aggregator.summarize(record);
        if (!writerFailures.isEmpty()) {
            summary = summary.withOutputError(writerFailures.get(0).getMessage());
        }
        try {
            batchStore.save(record);
        } catch (BatchStorageException e) {
            log.error("batchId={}, event=batch_store_failed, message={}", record.batchId(), e.getMessage(), e);
            return summary.withStorageError(e.getMessage());
        }
        return summary;
    }

    private void closeWriters(List<BatchOutcomeWriter> writers, List<OutcomeWriteException> writerFailures) {
        for (BatchOutcomeWriter writer : writers) {
            try {
                writer.close();
            } catch (OutcomeWriteException e) {
                log.error("event=outcome_writer_close_failed, writer={}, message={}",
                        writer.getClass().getSimpleName(), e.getMessage(), e);
                writerFailures.add(e);
            }
        }
    }
}
