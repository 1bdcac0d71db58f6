package de.burger.slf4j.refactor.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered literal text and placeholders of an SLF4J message.
 * Adjacent literals are merged on append so that braces split across tokens are still escaped.
 */
public final class Template {
    static final String PLACEHOLDER = "{}";

    public sealed interface Segment permits Literal, Placeholder {}

    public record Literal(String text) implements Segment {}

    public record Placeholder() implements Segment {}

    private final List<Segment> segments = new ArrayList<>();

    public Template appendLiteral(String text) {
        if (text == null || text.isEmpty()) {
            return this;
        }
        int last = segments.size() - 1;
        if (last >= 0 && segments.get(last) instanceof Literal previous) {
            segments.set(last, new Literal(previous.text() + text));
        } else {
            segments.add(new Literal(text));
        }
        return this;
    }

    public Template appendPlaceholder() {
        segments.add(new Placeholder());
        return this;
    }

    public Template append(Template other) {
        for (Segment segment : other.segments) {
            if (segment instanceof Literal literal) {
                appendLiteral(literal.text());
            } else {
                appendPlaceholder();
            }
        }
        return this;
    }

    /** Appends a single space unless the template is empty or already ends in whitespace. */
    public Template separateIfNeeded() {
        if (!isEmpty() && !endsWithWhitespace()) {
            appendLiteral(" ");
        }
        return this;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public boolean endsWithWhitespace() {
        if (segments.isEmpty()) {
            return false;
        }
        Segment last = segments.get(segments.size() - 1);
        if (last instanceof Literal literal) {
            String text = literal.text();
            return Character.isWhitespace(text.charAt(text.length() - 1));
        }
        return false;
    }

    /**
     * False when a literal holds a backslash directly before {@code {}}. SLF4J reads {@code \\{}}
     * as an escaped backslash followed by a placeholder, so such text has no faithful pattern.
     */
    public boolean isRenderable() {
        for (Segment segment : segments) {
            if (segment instanceof Literal literal && literal.text().contains("\\" + PLACEHOLDER)) {
                return false;
            }
        }
        return true;
    }

    public int placeholderCount() {
        int count = 0;
        for (Segment segment : segments) {
            if (segment instanceof Placeholder) {
                count++;
            }
        }
        return count;
    }

    public List<Segment> segments() {
        return Collections.unmodifiableList(segments);
    }

    /**
     * Renders the SLF4J message pattern. Literal {@code {}} becomes {@code \{}} and a literal
     * backslash right before a placeholder is doubled, matching SLF4J's delimiter escaping.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            if (segment instanceof Literal literal) {
                String text = literal.text().replace(PLACEHOLDER, "\\" + PLACEHOLDER);
                sb.append(text);
                boolean placeholderNext = i + 1 < segments.size() && segments.get(i + 1) instanceof Placeholder;
                if (placeholderNext && text.endsWith("\\")) {
                    sb.append('\\');
                }
            } else {
                sb.append(PLACEHOLDER);
            }
        }
        return sb.toString();
    }

    /** The rendered message as a double-quoted Java literal. */
    public String toJavaLiteral() {
        return JavaLiterals.quote(render());
    }

    @Override
    public String toString() {
        return render();
    }
}
