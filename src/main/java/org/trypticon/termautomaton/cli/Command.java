package org.trypticon.termautomaton.cli;

import org.trypticon.termautomaton.InfoStream;

import javax.annotation.Nonnull;
import java.io.PrintStream;
import java.util.List;

/**
 * One sub-command of the command-line tool, e.g. {@code termautomaton fuzzy}.
 */
abstract class Command {
    private final String name;
    private final String summary;
    private final String syntax;

    /**
     * @param name the word typed on the command line to select the command.
     * @param summary one-line summary printed by {@code help}.
     * @param syntax the argument syntax following the command name.
     */
    protected Command(@Nonnull String name, @Nonnull String summary, @Nonnull String syntax) {
        this.name = name;
        this.summary = summary;
        this.syntax = syntax;
    }

    @Nonnull
    String getName() {
        return name;
    }

    @Nonnull
    String getSummary() {
        return summary;
    }

    void printUsage(@Nonnull PrintStream err) {
        err.printf("usage: %s %s %s%n", Constants.APP_NAME, name, syntax);
    }

    /**
     * Executes the command.
     *
     * @param args the arguments after the command name.
     * @param out where results go.
     * @param err where usage and error text goes.
     * @param infoStream where diagnostics go.
     * @return the process exit status.
     */
    abstract int run(@Nonnull List<String> args, @Nonnull PrintStream out, @Nonnull PrintStream err,
                     @Nonnull InfoStream infoStream);

    /**
     * Reads an edit distance, complaining on {@code err} when it is unusable.
     *
     * @return the distance, or {@code -1} after a complaint.
     */
    static int readMaxEdits(@Nonnull PrintStream err, @Nonnull String text) {
        final int value;
        try {
            value = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            err.println("Not a number: " + text);
            return -1;
        }
        if (value >= 0) {
            return value;
        }
        err.println("Not a valid edit distance: " + text);
        return -1;
    }

    /**
     * Prints a failure followed by each of its causes, one per line.
     */
    static void reportFailure(@Nonnull PrintStream err, @Nonnull String headline, @Nonnull Throwable failure) {
        err.println(headline);
        for (Throwable t = failure; t != null; t = t.getCause()) {
            err.println(t);
        }
    }
}
