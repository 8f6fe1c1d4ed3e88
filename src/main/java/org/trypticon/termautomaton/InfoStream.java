package org.trypticon.termautomaton;

/**
 * Sink for diagnostic messages emitted while automata are built and compiled.
 * Callers check {@link #isEnabled(String)} before formatting anything expensive.
 */
public interface InfoStream {

    /**
     * Discards every message.
     */
    InfoStream NO_OUTPUT = Discarding.INSTANCE;

    /**
     * Writes one diagnostic line.
     *
     * @param component short tag for the part of the engine the line came from.
     * @param line the text.
     */
    void message(String component, String line);

    /**
     * @param component short tag for the part of the engine asking.
     * @return whether {@link #message} would record anything for that tag.
     */
    boolean isEnabled(String component);

    /**
     * Backing implementation for {@link #NO_OUTPUT}.
     */
    enum Discarding implements InfoStream {
        INSTANCE;

        @Override
        public void message(String component, String line) {
            // dropped
        }

        @Override
        public boolean isEnabled(String component) {
            return false;
        }
    }
}
