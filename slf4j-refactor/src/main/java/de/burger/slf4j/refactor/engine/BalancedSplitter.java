package de.burger.slf4j.refactor.engine;

import de.burger.it.infrastructure.logging.SuppressLogging;
import java.util.ArrayList;
import java.util.List;

/** Splits expressions and argument lists at a separator that sits outside literals and parentheses. */
@SuppressLogging
public final class BalancedSplitter {
    private BalancedSplitter() {
    }

    /** Returns trimmed, non-empty parts of {@code text} split at top-level {@code separator}. */
    public static List<String> split(String text, char separator) {
        List<String> parts = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return parts;
        }
        BalancedCursor cursor = new BalancedCursor();
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            BalancedCursor.Kind kind = cursor.feed(ch);
            if (kind == BalancedCursor.Kind.CODE && ch == separator && cursor.depth() == 0) {
                addPart(parts, buf);
                buf.setLength(0);
            } else {
                buf.append(ch);
            }
        }
        addPart(parts, buf);
        return parts;
    }

    public static List<String> splitArguments(String argumentList) {
        return split(argumentList, ',');
    }

    public static List<String> splitConcatenation(String expression) {
        return split(expression, '+');
    }

    private static void addPart(List<String> parts, StringBuilder buf) {
        String part = buf.toString().trim();
        if (!part.isEmpty()) {
            parts.add(part);
        }
    }
}
