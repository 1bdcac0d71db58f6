package de.burger.slf4j.refactor.engine;

import java.util.List;
import java.util.Objects;

/**
 * Which receivers and severities start a chain, and how long a candidate chain may grow.
 *
 * @param receivers    identifiers accepted as logger receivers, e.g. {@code log}
 * @param severities   suffixes of the leveled call, e.g. {@code Info} for {@code atInfo()}
 * @param maxSpanChars candidates longer than this are dropped instead of scanned further
 */
public record LocatorSettings(List<String> receivers, List<String> severities, int maxSpanChars) {
    public static final List<String> DEFAULT_RECEIVERS = List.of("log", "LOGGER", "logger");
    public static final List<String> DEFAULT_SEVERITIES = List.of("Trace", "Debug", "Info", "Warn", "Error");
    public static final int DEFAULT_MAX_SPAN_CHARS = 16_384;

    public LocatorSettings {
        Objects.requireNonNull(receivers, "receivers");
        Objects.requireNonNull(severities, "severities");
        if (receivers.isEmpty()) {
            throw new IllegalArgumentException("At least one receiver is required");
        }
        if (severities.isEmpty()) {
            throw new IllegalArgumentException("At least one severity is required");
        }
        receivers = List.copyOf(receivers);
        severities = List.copyOf(severities);
        maxSpanChars = maxSpanChars <= 0 ? DEFAULT_MAX_SPAN_CHARS : maxSpanChars;
    }

    public static LocatorSettings defaults() {
        return new LocatorSettings(DEFAULT_RECEIVERS, DEFAULT_SEVERITIES, DEFAULT_MAX_SPAN_CHARS);
    }

    public LocatorSettings withReceivers(List<String> newReceivers) {
        return new LocatorSettings(newReceivers, severities, maxSpanChars);
    }

    public LocatorSettings withMaxSpanChars(int newMaxSpanChars) {
        return new LocatorSettings(receivers, severities, newMaxSpanChars);
    }
}
