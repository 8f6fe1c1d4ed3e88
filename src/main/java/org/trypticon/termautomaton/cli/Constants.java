package org.trypticon.termautomaton.cli;

/**
 * Constants shared by the commands.
 */
class Constants {
    /**
     * The name of the application as typed on the command line.
     */
    static final String APP_NAME = "termautomaton";

    private Constants() {
    }
}
