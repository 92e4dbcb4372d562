package io.github.hotbrkm.mailgoat.dispatcher.cli;

import io.github.hotbrkm.mailgoat.dispatcher.send.entry.BatchConfigurationException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed arguments of one command: positionals, {@code --name value} / {@code --name=value} options and boolean
 * flags.
 * <p>
 * Tokens such as {@code --spring.x=y}, {@code --logging.x=y} and {@code --mailgoat.x=y} are application properties
 * consumed by Spring Boot and skipped here.
 */
public final class CommandLineArgs {

    private static final List<String> PROPERTY_PREFIXES = List.of("spring.", "logging.", "mailgoat.");

    private final List<String> positionals;
    private final Map<String, String> options;
    private final Set<String> flags;

    private CommandLineArgs(List<String> positionals, Map<String, String> options, Set<String> flags) {
        this.positionals = Collections.unmodifiableList(positionals);
        this.options = Collections.unmodifiableMap(options);
        this.flags = Collections.unmodifiableSet(flags);
    }

    /**
     * @param args       raw tokens after the command name; {@code null} parses as empty
     * @param knownFlags option names that take no value
     * @throws CliUsageException if an option is malformed, repeated or lacks its value
     */
    public static CommandLineArgs parse(String[] args, Set<String> knownFlags) {
        List<String> positionals = new ArrayList<>();
        Map<String, String> options = new LinkedHashMap<>();
        Set<String> flags = new LinkedHashSet<>();
        if (args == null) {
            return new CommandLineArgs(positionals, options, flags);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg == null) {
                continue;
            }
            if (!arg.startsWith("--") || arg.length() == 2) {
                positionals.add(arg);
                continue;
            }
            String body = arg.substring(2);
            int idx = body.indexOf('=');
            String name = idx >= 0 ? body.substring(0, idx) : body;
            if (name.isEmpty()) {
                throw new CliUsageException("invalid option: " + arg);
            }
            if (idx >= 0 && isApplicationProperty(name)) {
                continue;
            }
            if (knownFlags.contains(name)) {
                if (idx >= 0) {
                    throw new CliUsageException("option --" + name + " does not take a value");
                }
                flags.add(name);
                continue;
            }
            String value;
            if (idx >= 0) {
                value = body.substring(idx + 1);
            } else {
                if (i + 1 >= args.length || args[i + 1] == null || args[i + 1].startsWith("--")) {
                    throw new CliUsageException("option --" + name + " requires a value");
                }
                value = args[++i];
            }
            if (options.putIfAbsent(name, value) != null) {
                throw new CliUsageException("option --" + name + " given more than once");
            }
        }
        return new CommandLineArgs(positionals, options, flags);
    }

    private static boolean isApplicationProperty(String name) {
        return PROPERTY_PREFIXES.stream().anyMatch(name::startsWith);
    }

    /**
     * Rejects options and flags a command does not declare.
     */
    public CommandLineArgs requireKnown(Set<String> knownOptions, Set<String> knownFlags) {
        for (String name : options.keySet()) {
            if (!knownOptions.contains(name)) {
                throw new CliUsageException("unknown option --" + name);
            }
        }
        for (String name : flags) {
            if (!knownFlags.contains(name)) {
                throw new CliUsageException("unknown option --" + name);
            }
        }
        return this;
    }

    public List<String> positionals() {
        return positionals;
    }

    public String positional(int index, String description) {
        if (index >= positionals.size()) {
            throw new CliUsageException("missing " + description);
        }
        return positionals.get(index);
    }

    public void requireMaxPositionals(int max) {
        if (positionals.size() > max) {
            throw new CliUsageException("unexpected argument: " + positionals.get(max));
        }
    }

    public String option(String name) {
        return options.get(name);
    }

    public String requireOption(String name) {
        String value = options.get(name);
        if (value == null || value.isBlank()) {
            throw new CliUsageException("option --" + name + " is required");
        }
        return value;
    }

    public Path pathOption(String name) {
        String value = options.get(name);
        if (value == null) {
            return null;
        }
        if (value.isBlank()) {
            throw new BatchConfigurationException("option --" + name + " must not be blank");
        }
        return Path.of(value);
    }

    /**
     * @throws BatchConfigurationException if the value is not a number
     */
    public Double doubleOption(String name) {
        String value = options.get(name);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new BatchConfigurationException("option --" + name + " must be a number, got '" + value + "'");
        }
    }

    public boolean hasFlag(String name) {
        return flags.contains(name);
    }
}
