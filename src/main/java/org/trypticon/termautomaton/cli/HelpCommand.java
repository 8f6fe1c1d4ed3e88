package org.trypticon.termautomaton.cli;

import org.trypticon.termautomaton.InfoStream;

import javax.annotation.Nonnull;
import java.io.PrintStream;
import java.util.List;

/**
 * {@code termautomaton help <command>}: prints the summary and argument syntax of another command.
 */
class HelpCommand extends Command {
    private final CommandCatalog catalog;

    HelpCommand(@Nonnull CommandCatalog catalog) {
        super("help", "Prints help for a command", "<command>");
        this.catalog = catalog;
    }

    @Override
    int run(@Nonnull List<String> args, @Nonnull PrintStream out, @Nonnull PrintStream err,
            @Nonnull InfoStream infoStream) {
        if (args.size() != 1) {
            printUsage(err);
            return 1;
        }
        Command target = catalog.lookupOrComplain(args.get(0), err);
        if (target == null) {
            return 1;
        }
        err.printf("%s %s - %s%n", Constants.APP_NAME, target.getName(), target.getSummary());
        target.printUsage(err);
        return 0;
    }
}
