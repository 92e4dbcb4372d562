package io.github.hotbrkm.mailgoat.dispatcher.send.entry;

import java.nio.file.Path;

/**
 * Input source chosen on the command line: exactly one of a CSV path, a JSON path or standard input.
 */
public record RecipientSourceSelection(Path csvPath, Path jsonPath, boolean stdin) {

    public enum Kind {
        CSV, JSON, STDIN
    }

    public static RecipientSourceSelection csv(Path path) {
        return new RecipientSourceSelection(path, null, false);
    }

    public static RecipientSourceSelection json(Path path) {
        return new RecipientSourceSelection(null, path, false);
    }

    public static RecipientSourceSelection standardInput() {
        return new RecipientSourceSelection(null, null, true);
    }

    /**
     * Checks that exactly one source was given. Performs no I/O.
     *
     * @return the selected kind
     * @throws BatchConfigurationException if zero or more than one source is set
     */
    public Kind validate() {
        int selected = (csvPath != null ? 1 : 0) + (jsonPath != null ? 1 : 0) + (stdin ? 1 : 0);
        if (selected != 1) {
            throw new BatchConfigurationException(
                    "exactly one input source must be provided (--csv, --json or --stdin), got " + selected);
        }
        if (csvPath != null) {
            return Kind.CSV;
        }
        return jsonPath != null ? Kind.JSON : Kind.STDIN;
    }
}
