package org.trypticon.termautomaton.cli;

import org.trypticon.termautomaton.AutomatonCompiler;
import org.trypticon.termautomaton.InfoStream;
import org.trypticon.termautomaton.automaton.CompiledAutomaton;
import org.trypticon.termautomaton.automaton.Operations;
import org.trypticon.termautomaton.util.BytesRef;
import org.trypticon.termautomaton.util.BytesRefBuilder;

import javax.annotation.Nonnull;
import java.io.PrintStream;
import java.util.List;
import java.util.TreeSet;

/**
 * Command to find the largest dictionary term less than or equal to a term.
 */
class FloorCommand extends Command {
    FloorCommand() {
        super("floor", "Finds the largest dictionary term less than or equal to a term",
              "<term> <dictionary terms...>");
    }

    @Override
    int run(@Nonnull List<String> args, @Nonnull PrintStream out, @Nonnull PrintStream err,
            @Nonnull InfoStream infoStream) {
        if (args.size() < 2) {
            printUsage(err);
            return 1;
        }

        // UTF-8 byte order, duplicates dropped
        TreeSet<BytesRef> dictionary = new TreeSet<>();
        for (String term : args.subList(1, args.size())) {
            dictionary.add(new BytesRef(term));
        }

        CompiledAutomaton compiled = new AutomatonCompiler(Operations.DEFAULT_MAX_DETERMINIZED_STATES, infoStream)
                .compileTerms(dictionary);
        BytesRef floor = compiled.floor(new BytesRef(args.get(0)), new BytesRefBuilder());
        out.println(floor == null ? "(none)" : floor.utf8ToString());
        return 0;
    }
}
