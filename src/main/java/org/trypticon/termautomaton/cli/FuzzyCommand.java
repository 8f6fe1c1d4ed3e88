package org.trypticon.termautomaton.cli;

import org.trypticon.termautomaton.InfoStream;
import org.trypticon.termautomaton.automaton.Automaton;
import org.trypticon.termautomaton.automaton.LevenshteinAutomata;
import org.trypticon.termautomaton.automaton.UTF32ToUTF8;

import javax.annotation.Nonnull;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command to print the Levenshtein automaton of a term in Graphviz format.
 */
class FuzzyCommand extends Command {
    private static final String COMPONENT = "CLI";

    FuzzyCommand() {
        super("fuzzy", "Prints the Levenshtein automaton of a term as Graphviz dot",
              "[--transpositions] [--utf8] <term> <maxEdits>");
    }

    @Override
    int run(@Nonnull List<String> args, @Nonnull PrintStream out, @Nonnull PrintStream err,
            @Nonnull InfoStream infoStream) {
        List<String> remaining = new ArrayList<>(args);
        boolean transpositions = remaining.remove("--transpositions");
        boolean utf8 = remaining.remove("--utf8");
        if (remaining.size() != 2) {
            printUsage(err);
            return 1;
        }

        String term = remaining.get(0);
        int maxEdits = readMaxEdits(err, remaining.get(1));
        if (maxEdits < 0) {
            return 1;
        }

        Automaton automaton;
        try {
            automaton = new LevenshteinAutomata(term, transpositions).toAutomaton(maxEdits);
        } catch (IllegalArgumentException e) {
            reportFailure(err, "Error building Levenshtein automaton for: " + term, e);
            return 1;
        }
        if (utf8) {
            automaton = new UTF32ToUTF8().convert(automaton);
        }
        if (infoStream.isEnabled(COMPONENT)) {
            infoStream.message(COMPONENT, "automaton has " + automaton.getNumStates() + " states");
        }

        out.println(automaton.toDot());
        return 0;
    }
}
