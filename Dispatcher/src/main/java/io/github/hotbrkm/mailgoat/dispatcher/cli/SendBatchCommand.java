package io.github.hotbrkm.mailgoat.dispatcher.cli;

import io.github.hotbrkm.mailgoat.dispatcher.config.MailgoatConfig;
import io.github.hotbrkm.mailgoat.dispatcher.profile.MailProfile;
import io.github.hotbrkm.mailgoat.dispatcher.profile.ProfileResolver;
import io.github.hotbrkm.mailgoat.dispatcher.profile.ProfileStore;
import io.github.hotbrkm.mailgoat.dispatcher.send.engine.BatchSendRequest;
import io.github.hotbrkm.mailgoat.dispatcher.send.engine.BatchSendService;
import io.github.hotbrkm.mailgoat.dispatcher.send.engine.SendRateLimiter;
import io.github.hotbrkm.mailgoat.dispatcher.send.entry.RecipientSourceSelection;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchRunSummary;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Set;

/**
 * {@code send-batch}: sends one message per recipient row and prints the batch summary.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SendBatchCommand implements MailgoatCommand {

    static final String NAME = "send-batch";
    private static final Set<String> OPTIONS = Set.of("profile", "csv", "json", "template", "rate-limit", "error-log");
    private static final Set<String> FLAGS = Set.of("stdin", "continue-on-error");

    private final ProfileStore profileStore;
    private final BatchSendService batchSendService;
    private final CliJsonWriter jsonWriter;
    private final MailgoatConfig config;
    private final Environment environment;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String usage() {
        return "send-batch [--profile NAME] (--csv PATH | --json PATH | --stdin) [--template PATH]\n"
                + "             [--continue-on-error] [--rate-limit N] [--error-log PATH]";
    }

    @Override
    public Set<String> flags() {
        return FLAGS;
    }

    @Override
    public int execute(CommandLineArgs args, CommandIo io) {
        args.requireKnown(OPTIONS, FLAGS).requireMaxPositionals(0);

        RecipientSourceSelection source = new RecipientSourceSelection(args.pathOption("csv"), args.pathOption("json"),
                args.hasFlag("stdin"));
        source.validate();
        Double rateLimit = args.doubleOption("rate-limit");
        SendRateLimiter.of(rateLimit);

        MailProfile profile = profileStore.resolve(args.option("profile"),
                environment.getProperty(ProfileResolver.ENVIRONMENT_VARIABLE));
        log.debug("event=profile_resolved, profile={}", profile.name());

        BatchRunSummary summary = batchSendService.send(profile, BatchSendRequest.builder()
                .source(source)
                .templatePath(args.pathOption("template"))
                .continueOnError(args.hasFlag("continue-on-error"))
                .rateLimit(rateLimit)
                .errorLogPath(args.pathOption("error-log"))
                .stdin(io.in())
                .progressOut(config.isProgressEnabled() ? io.err() : null)
                .build());

        jsonWriter.print(io.out(), summary);
        printReport(io.err(), summary);
        if (summary.hasLocalFailure()) {
            return ExitCodes.STORAGE_ERROR;
        }
        return summary.status().isSuccessful() ? ExitCodes.OK : ExitCodes.FAILURE;
    }

    /**
     * Human readable report on stderr.
     */
    static void printReport(PrintStream err, BatchRunSummary summary) {
        err.println("batch " + summary.batchId() + " " + summary.status().code() + ": sent=" + summary.sent()
                + " failed=" + summary.failed() + " total=" + summary.total());
        if (summary.status() == BatchStatus.ABORTED && summary.abortedAtRow() != null) {
            err.println("aborted at row " + summary.abortedAtRow() + ": " + summary.abortReason());
        }
        if (summary.outputError() != null) {
            err.println("warning: outcome output failed (" + summary.outputError() + "); see the stored batch for all rows");
        }
        if (!summary.persisted()) {
            err.println("warning: batch result was not stored (" + summary.storageError()
                    + "); the output above is the only record of this batch");
        }
        err.flush();
    }
}
