package org.trypticon.termautomaton;

import javax.annotation.Nonnull;
import java.io.PrintStream;
import java.time.Instant;

/**
 * Info stream writing every component's messages to a {@link PrintStream}.
 */
public class PrintStreamInfoStream implements InfoStream {

    @Nonnull
    private final PrintStream stream;

    /**
     * Constructs the info stream.
     *
     * @param stream the stream to write messages to.
     */
    public PrintStreamInfoStream(@Nonnull PrintStream stream) {
        this.stream = stream;
    }

    @Override
    public void message(String component, String line) {
        stream.println(component + " [" + getTimestamp() + "; " + Thread.currentThread().getName() + "]: " + line);
    }

    @Override
    public boolean isEnabled(String component) {
        return true;
    }

    /**
     * Gets the timestamp written with each message. Overridable for tests.
     *
     * @return the timestamp.
     */
    protected String getTimestamp() {
        return Instant.now().toString();
    }
}
