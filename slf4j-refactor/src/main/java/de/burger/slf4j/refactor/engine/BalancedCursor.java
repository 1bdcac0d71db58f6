package de.burger.slf4j.refactor.engine;

import de.burger.it.infrastructure.logging.SuppressLogging;

/**
 * Character-at-a-time state machine that tracks parenthesis depth and string, text block and char
 * literal state.
 * Shared by the splitter, the call-boundary finder and the chain locator so that escapes and
 * nesting are treated the same way everywhere.
 */
@SuppressLogging
final class BalancedCursor {

    /** Classification of the character most recently fed into the cursor. */
    enum Kind {
        /** Inside a literal, or one of its delimiting quotes. */
        LITERAL,
        /** An opening parenthesis outside literals. */
        OPEN,
        /** A closing parenthesis outside literals. */
        CLOSE,
        /** Any other character outside literals. */
        CODE
    }

    private int depth;
    private boolean inLiteral;
    private char quote;
    private boolean escaped;
    private boolean textBlock;
    // quotes seen in a row: after an empty "" outside literals, or before a text block's closing """
    private int quoteRun;

    BalancedCursor() {
        this(0);
    }

    BalancedCursor(int initialDepth) {
        this.depth = Math.max(0, initialDepth);
    }

    Kind feed(char ch) {
        if (textBlock) {
            return feedTextBlock(ch);
        }
        if (inLiteral) {
            if (escaped) {
                escaped = false;
            } else if (ch == '\\') {
                escaped = true;
            } else if (ch == quote) {
                inLiteral = false;
                quoteRun = quote == '"' && quoteRun == 1 ? 2 : 0;
                return Kind.LITERAL;
            }
            quoteRun = 0;
            return Kind.LITERAL;
        }
        if (ch == '"' && quoteRun == 2) {
            // third quote of """
            inLiteral = true;
            textBlock = true;
            quoteRun = 0;
            return Kind.LITERAL;
        }
        quoteRun = 0;
        if (ch == '"' || ch == '\'') {
            inLiteral = true;
            quote = ch;
            quoteRun = ch == '"' ? 1 : 0;
            return Kind.LITERAL;
        }
        if (ch == '(') {
            depth++;
            return Kind.OPEN;
        }
        if (ch == ')') {
            depth = Math.max(0, depth - 1);
            return Kind.CLOSE;
        }
        return Kind.CODE;
    }

    private Kind feedTextBlock(char ch) {
        if (escaped) {
            escaped = false;
            quoteRun = 0;
        } else if (ch == '\\') {
            escaped = true;
            quoteRun = 0;
        } else if (ch == '"') {
            if (++quoteRun == 3) {
                textBlock = false;
                inLiteral = false;
                quoteRun = 0;
            }
        } else {
            quoteRun = 0;
        }
        return Kind.LITERAL;
    }

    int depth() {
        return depth;
    }

    boolean inLiteral() {
        return inLiteral;
    }

    /**
     * Returns the index just past the parenthesis that closes the one at {@code openIndex},
     * or -1 when the text ends first.
     */
    static int findClosingParen(CharSequence text, int openIndex) {
        BalancedCursor cursor = new BalancedCursor();
        for (int i = openIndex; i < text.length(); i++) {
            Kind kind = cursor.feed(text.charAt(i));
            if (kind == Kind.CLOSE && cursor.depth() == 0) {
                return i + 1;
            }
        }
        return -1;
    }
}
