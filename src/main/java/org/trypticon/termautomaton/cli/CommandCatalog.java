package org.trypticon.termautomaton.cli;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The commands the tool knows about, in the order they are listed to the user.
 */
class CommandCatalog {
    private final Map<String, Command> byName = new LinkedHashMap<>();

    CommandCatalog register(@Nonnull Command command) {
        if (byName.putIfAbsent(command.getName(), command) != null) {
            throw new IllegalStateException("Duplicate command: " + command.getName());
        }
        return this;
    }

    @CheckForNull
    Command lookup(@Nonnull String name) {
        return byName.get(name);
    }

    /**
     * Looks up a command, listing the alternatives on {@code err} when there is no such command.
     */
    @CheckForNull
    Command lookupOrComplain(@Nonnull String name, @Nonnull PrintStream err) {
        Command command = lookup(name);
        if (command == null) {
            err.println("Unknown command: " + name);
            list(err);
        }
        return command;
    }

    void list(@Nonnull PrintStream err) {
        err.println("Available commands:");
        byName.keySet().forEach(name -> err.println("  " + name));
    }
}
