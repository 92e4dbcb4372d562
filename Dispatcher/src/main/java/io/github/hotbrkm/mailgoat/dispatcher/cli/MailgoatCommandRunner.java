package io.github.hotbrkm.mailgoat.dispatcher.cli;

import io.github.hotbrkm.mailgoat.dispatcher.profile.ProfileException;
import io.github.hotbrkm.mailgoat.dispatcher.send.entry.BatchConfigurationException;
import io.github.hotbrkm.mailgoat.dispatcher.send.entry.RecipientValidationException;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchNotFoundException;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchStorageException;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.OutcomeWriteException;
import io.github.hotbrkm.mailgoat.dispatcher.send.template.TemplateValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point of the command line: picks the command, runs it and maps fatal errors to exit codes.
 */
@Slf4j
@Component
public class MailgoatCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Set<String> HELP = Set.of("help", "--help", "-h");

    private final Map<String, MailgoatCommand> commands = new LinkedHashMap<>();
    private int exitCode = ExitCodes.OK;

    public MailgoatCommandRunner(List<MailgoatCommand> commands) {
        for (MailgoatCommand command : commands) {
            this.commands.put(command.name(), command);
        }
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args, CommandIo.system());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Runs one command line.
     *
     * @return process exit code, see {@link ExitCodes}
     */
    public int execute(String[] args, CommandIo io) {
        String[] tokens = stripApplicationProperties(args);
        if (tokens.length == 0 || HELP.contains(tokens[0])) {
            printUsage(io.out());
            return ExitCodes.OK;
        }

        MailgoatCommand command = commands.get(tokens[0]);
        if (command == null) {
            io.err().println("error: unknown command: " + tokens[0]);
            printUsage(io.err());
            return ExitCodes.INVALID_INPUT;
        }

        try {
            String[] rest = Arrays.copyOfRange(tokens, 1, tokens.length);
            return command.execute(CommandLineArgs.parse(rest, command.flags()), io);
        } catch (CliUsageException e) {
            io.err().println("error: " + e.getMessage());
            io.err().println("usage: mailgoat " + command.usage());
            return ExitCodes.INVALID_INPUT;
        } catch (BatchConfigurationException | RecipientValidationException | TemplateValidationException e) {
            log.debug("command={}, event=invalid_input, message={}", command.name(), e.getMessage());
            io.err().println("error: " + e.getMessage());
            return ExitCodes.INVALID_INPUT;
        } catch (ProfileException e) {
            io.err().println("error: " + e.getMessage());
            return e.isUnconfigured() ? ExitCodes.INVALID_INPUT : ExitCodes.FAILURE;
        } catch (BatchNotFoundException e) {
            io.err().println("error: " + e.getMessage());
            return ExitCodes.FAILURE;
        } catch (BatchStorageException | OutcomeWriteException e) {
            log.error("command={}, event=storage_failed, message={}", command.name(), e.getMessage(), e);
            io.err().println("error: " + e.getMessage());
            return ExitCodes.STORAGE_ERROR;
        } catch (RuntimeException e) {
            log.error("command={}, event=unexpected_error", command.name(), e);
            io.err().println("error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            return ExitCodes.FAILURE;
        }
    }

    private void printUsage(PrintStream out) {
        out.println("usage: mailgoat <command> [options]");
        out.println();
        out.println("commands:");
        for (MailgoatCommand command : commands.values()) {
            out.println("  " + command.usage());
        }
        out.println("  help");
        out.println();
        out.println("environment:");
        out.println("  MAILGOAT_PROFILE  profile used when --profile is omitted");
        out.flush();
    }

    /**
     * Drops leading Spring property arguments so the command name is found first.
     */
    private static String[] stripApplicationProperties(String[] args) {
        if (args == null) {
            return new String[0];
        }
        int start = 0;
        while (start < args.length && args[start] != null && args[start].startsWith("--") && args[start].contains("=")
                && isApplicationProperty(args[start].substring(2))) {
            start++;
        }
        return Arrays.copyOfRange(args, start, args.length);
    }

    private static boolean isApplicationProperty(String token) {
        return token.startsWith("spring.") || token.startsWith("logging.") || token.startsWith("mailgoat.");
    }
}
