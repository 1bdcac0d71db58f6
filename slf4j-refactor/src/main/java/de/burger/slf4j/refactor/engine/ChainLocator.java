package de.burger.slf4j.refactor.engine;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds fluent chains {@code log.atInfo() ... .setMessage("{}") ... .log()} in a source text.
 *
 * <p>Each chain is matched from its leveled call to the first {@code .log()} that follows the first
 * {@code .setMessage("{}")}. Only calls at the chain's own nesting level count, literals and comments
 * are never matched, and a candidate is dropped when its statement ends first, when it closes without
 * an empty message, or when it grows beyond {@link LocatorSettings#maxSpanChars()}.
 */
public final class ChainLocator {
    private static final Logger log = LoggerFactory.getLogger(ChainLocator.class);

    private static final Pattern MESSAGE_CALL =
            Pattern.compile("\\.\\s*setMessage\\s*\\(\\s*\"\\s*\\{}\\s*\"\\s*\\)");
    private static final Pattern TERMINAL_CALL = Pattern.compile("\\.\\s*log\\s*\\(\\s*\\)");

    enum State { BEFORE_INITIAL_CALL, AWAITING_MESSAGE_CALL, AWAITING_TERMINAL_CALL }

    private final LocatorSettings settings;
    private final Pattern initialCall;
    private final String receiverStarts;

    public ChainLocator() {
        this(LocatorSettings.defaults());
    }

    public ChainLocator(LocatorSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.initialCall = Pattern.compile(
                "(?:" + alternation(settings.receivers()) + ")\\s*\\.\\s*at(?:"
                        + alternation(settings.severities()) + ")\\s*\\(\\s*\\)");
        this.receiverStarts = settings.receivers().stream()
                .map(r -> r.substring(0, 1))
                .distinct()
                .collect(Collectors.joining());
    }

    /** Lazily yields the non-overlapping chains of {@code text} in source order. */
    public Stream<ChainSpan> locate(String text) {
        Objects.requireNonNull(text, "text");
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(new SpanIterator(text), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    public List<ChainSpan> locateAll(String text) {
        return locate(text).toList();
    }

    private static String alternation(List<String> names) {
        return names.stream().map(Pattern::quote).collect(Collectors.joining("|"));
    }

    private final class SpanIterator implements Iterator<ChainSpan> {
        private final String text;
        private final String masked;
        private final Matcher initial;
        private final Matcher message;
        private final Matcher terminal;
        private int pos;
        private ChainSpan next;

        private SpanIterator(String text) {
            this.text = text;
            this.masked = JavaPrefilter.blankComments(text);
            this.initial = initialCall.matcher(masked);
            this.message = MESSAGE_CALL.matcher(masked);
            this.terminal = TERMINAL_CALL.matcher(masked);
        }

        @Override
        public boolean hasNext() {
            if (next == null && pos < masked.length()) {
                next = findNext();
            }
            return next != null;
        }

        @Override
        public ChainSpan next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ChainSpan span = next;
            next = null;
            return span;
        }

        // State BEFORE_INITIAL_CALL: only literal state matters here, nesting does not.
        private ChainSpan findNext() {
            BalancedCursor cursor = new BalancedCursor();
            int i = pos;
            while (i < masked.length()) {
                if (!cursor.inLiteral() && startsInitialCall(i)) {
                    int afterInitial = initial.end();
                    ChainSpan span = scanChain(i, afterInitial);
                    if (span != null) {
                        pos = span.end();
                        return span;
                    }
                    i = afterInitial;
                    cursor = new BalancedCursor();
                    continue;
                }
                cursor.feed(masked.charAt(i));
                i++;
            }
            pos = masked.length();
            return null;
        }

        private boolean startsInitialCall(int i) {
            if (receiverStarts.indexOf(masked.charAt(i)) < 0) {
                return false;
            }
            if (i > 0 && Character.isJavaIdentifierPart(masked.charAt(i - 1))) {
                return false;
            }
            return initial.region(i, masked.length()).lookingAt();
        }

        private ChainSpan scanChain(int chainStart, int afterInitial) {
            State state = State.AWAITING_MESSAGE_CALL;
            BalancedCursor cursor = new BalancedCursor();
            int limit = Math.min(masked.length(), chainStart + settings.maxSpanChars());
            int messageStart = -1;
            int messageEnd = -1;
            int i = afterInitial;
            while (i < limit) {
                char ch = masked.charAt(i);
                boolean chainLevel = !cursor.inLiteral() && cursor.depth() == 0;
                if (chainLevel && ch == '.') {
                    if (state == State.AWAITING_MESSAGE_CALL && message.region(i, limit).lookingAt()) {
                        messageStart = i;
                        messageEnd = message.end();
                        state = State.AWAITING_TERMINAL_CALL;
                        i = messageEnd;
                        continue;
                    }
                    if (terminal.region(i, limit).lookingAt()) {
                        if (state == State.AWAITING_TERMINAL_CALL) {
                            int end = terminal.end();
                            return new ChainSpan(chainStart, end, text.substring(chainStart, end),
                                    messageStart - chainStart, messageEnd - chainStart);
                        }
                        log.trace("Chain at offset {} closes without an empty message, skipped", chainStart);
                        return null;
                    }
                }
                if (chainLevel && (ch == ';' || ch == ')' || ch == '}')) {
                    log.trace("Chain at offset {} ends at '{}' before completing ({})", chainStart, ch, state);
                    return null;
                }
                cursor.feed(ch);
                i++;
            }
            if (limit < masked.length()) {
                log.debug("Chain candidate at offset {} exceeds {} chars, skipped", chainStart, settings.maxSpanChars());
            }
            return null;
        }
    }
}
