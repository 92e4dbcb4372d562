package io.github.hotbrkm.mailgoat.dispatcher.cli;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.Objects;

/**
 * Standard streams of one command invocation. stdout carries command output only.
 */
public record CommandIo(InputStream in, PrintStream out, PrintStream err) {

    public CommandIo {
        Objects.requireNonNull(in, "in must not be null");
        Objects.requireNonNull(out, "out must not be null");
        Objects.requireNonNull(err, "err must not be null");
    }

    public static CommandIo system() {
        return new CommandIo(System.in, System.out, System.err);
    }
}
