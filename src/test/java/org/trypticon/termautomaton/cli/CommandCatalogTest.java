package org.trypticon.termautomaton.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;

public class CommandCatalogTest {
    @Test
    public void testLookupKeepsRegistrationOrder() {
        CommandCatalog catalog = new CommandCatalog();
        Command floor = new FloorCommand();
        catalog.register(floor).register(new InfoCommand());

        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        catalog.list(new PrintStream(raw, true, StandardCharsets.UTF_8));

        assertThat(catalog.lookup("floor"), is(sameInstance(floor)));
        assertThat(catalog.lookup("fuzzy"), is(nullValue()));
        assertThat(raw.toString(StandardCharsets.UTF_8).trim(), is(String.join(System.lineSeparator(),
                "Available commands:", "  floor", "  info")));
    }

    @Test
    public void testDuplicateNameRejected() {
        CommandCatalog catalog = new CommandCatalog().register(new InfoCommand());
        assertThrows(IllegalStateException.class, () -> catalog.register(new InfoCommand()));
    }
}
