package io.github.hotbrkm.mailgoat.dispatcher.cli;

import io.github.hotbrkm.mailgoat.dispatcher.send.engine.BatchSummaryAggregator;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchNotFoundException;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchRecord;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * {@code batch status <batch_id>}: prints the stored summary of one batch.
 */
@Component
@RequiredArgsConstructor
public class BatchStatusCommand implements MailgoatCommand {

    static final String NAME = "batch";

    private final BatchStore batchStore;
    private final BatchSummaryAggregator aggregator;
    private final CliJsonWriter jsonWriter;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String usage() {
        return "batch status <batch_id>";
    }

    @Override
    public int execute(CommandLineArgs args, CommandIo io) {
        args.requireKnown(Set.of(), Set.of());
        String action = args.positional(0, "batch subcommand (status)");
        if (!"status".equals(action)) {
            throw new CliUsageException("unknown batch subcommand: " + action);
        }
        String batchId = args.positional(1, "batch id");
        args.requireMaxPositionals(2);

        BatchRecord record;
        try {
            record = batchStore.load(batchId);
        } catch (BatchNotFoundException e) {
            Map<String, Object> notFound = new LinkedHashMap<>();
            notFound.put("error", "batch not found");
            notFound.put("batch_id", batchId);
            jsonWriter.print(io.out(), notFound);
            io.err().println("error: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
        jsonWriter.print(io.out(), aggregator.summarize(record));
        return ExitCodes.OK;
    }
}
