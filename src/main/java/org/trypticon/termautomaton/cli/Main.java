package org.trypticon.termautomaton.cli;

import org.trypticon.termautomaton.InfoStream;
import org.trypticon.termautomaton.PrintStreamInfoStream;

import javax.annotation.Nonnull;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line front end: {@code termautomaton [--verbose] <command> <args...>}.
 */
public class Main {
    private static final String VERBOSE_FLAG = "--verbose";

    private final CommandCatalog catalog = new CommandCatalog();

    public Main() {
        catalog.register(new HelpCommand(catalog))
                .register(new InfoCommand())
                .register(new FuzzyCommand())
                .register(new FloorCommand());
    }

    public static void main(String[] args) {
        System.exit(new Main().run(Arrays.asList(args), System.out, System.err));
    }

    /**
     * Dispatches to the named command.
     *
     * @param args the command-line arguments.
     * @param out where command results go.
     * @param err where usage, errors and, with {@code --verbose}, diagnostics go.
     * @return the exit status.
     */
    int run(@Nonnull List<String> args, @Nonnull PrintStream out, @Nonnull PrintStream err) {
        InfoStream infoStream = InfoStream.NO_OUTPUT;
        int first = 0;
        while (first < args.size() && VERBOSE_FLAG.equals(args.get(first))) {
            infoStream = new PrintStreamInfoStream(err);
            first++;
        }
        if (first == args.size()) {
            err.printf("usage: %s [%s] <command> <args...>%n", Constants.APP_NAME, VERBOSE_FLAG);
            catalog.list(err);
            err.printf("Use %s help <command> for help on a specific command.%n", Constants.APP_NAME);
            return 1;
        }

        Command command = catalog.lookupOrComplain(args.get(first), err);
        if (command == null) {
            return 1;
        }
        return command.run(args.subList(first + 1, args.size()), out, err, infoStream);
    }
}
