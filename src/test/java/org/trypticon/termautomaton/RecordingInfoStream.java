package org.trypticon.termautomaton;

import java.util.ArrayList;
import java.util.List;

/**
 * Info stream collecting messages in memory for assertions.
 */
class RecordingInfoStream implements InfoStream {
    private final List<String> messages = new ArrayList<>();

    @Override
    public void message(String component, String line) {
        messages.add(component + ": " + line);
    }

    @Override
    public boolean isEnabled(String component) {
        return true;
    }

    List<String> getMessages() {
        return messages;
    }
}
