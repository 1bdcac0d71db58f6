package de.burger.slf4j.refactor.engine;

import java.util.List;

/** Template fragment and the dynamic argument expressions it refers to, in placeholder order. */
public record SynthesizedMessage(Template fragment, List<String> arguments) {
    public SynthesizedMessage {
        arguments = List.copyOf(arguments);
    }
}
