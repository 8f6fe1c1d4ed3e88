package org.trypticon.termautomaton.cli;

import org.trypticon.termautomaton.AutomatonCompiler;
import org.trypticon.termautomaton.InfoStream;
import org.trypticon.termautomaton.automaton.CompiledAutomaton;
import org.trypticon.termautomaton.automaton.Operations;
import org.trypticon.termautomaton.automaton.TooComplexToDeterminizeException;

import javax.annotation.Nonnull;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command to show how a fuzzy term compiles.
 */
class InfoCommand extends Command {
    InfoCommand() {
        super("info", "Gives info about the compiled automaton of a fuzzy term",
              "[--transpositions] <term> <maxEdits>");
    }

    @Override
    int run(@Nonnull List<String> args, @Nonnull PrintStream out, @Nonnull PrintStream err,
            @Nonnull InfoStream infoStream) {
        List<String> remaining = new ArrayList<>(args);
        boolean transpositions = remaining.remove("--transpositions");
        if (remaining.size() != 2) {
            printUsage(err);
            return 1;
        }

        String term = remaining.get(0);
        int maxEdits = readMaxEdits(err, remaining.get(1));
        if (maxEdits < 0) {
            return 1;
        }

        CompiledAutomaton compiled;
        try {
            compiled = new AutomatonCompiler(Operations.DEFAULT_MAX_DETERMINIZED_STATES, infoStream)
                    .compileFuzzy(term, maxEdits, transpositions, 0);
        } catch (IllegalArgumentException | TooComplexToDeterminizeException e) {
            reportFailure(err, "Error compiling fuzzy term: " + term, e);
            return 1;
        }

        out.println("Type: " + compiled.type);
        switch (compiled.type) {
            case SINGLE:
                out.println("Term: " + compiled.term.utf8ToString());
                break;
            case NORMAL:
                out.println("States: " + compiled.automaton.getNumStates());
                out.println("Transitions: " + compiled.automaton.getNumTransitions());
                out.println("Finite: " + compiled.finite);
                break;
            default:
                break;
        }
        return 0;
    }
}
