package io.github.hotbrkm.mailgoat.dispatcher.cli;

import java.util.Set;

/**
 * One top-level command of the {@code mailgoat} tool.
 */
public interface MailgoatCommand {

    /**
     * Name typed on the command line, e.g. {@code send-batch}.
     */
    String name();

    /**
     * Usage lines printed by {@code help}.
     */
    String usage();

    /**
     * Option names that take no value.
     */
    default Set<String> flags() {
        return Set.of();
    }

    /**
     * Runs the command. Fatal errors are thrown and mapped to exit codes by the runner.
     *
     * @return process exit code, see {@link ExitCodes}
     */
    int execute(CommandLineArgs args, CommandIo io);
}
