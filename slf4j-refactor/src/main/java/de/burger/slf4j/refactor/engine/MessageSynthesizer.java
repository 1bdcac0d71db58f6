package de.burger.slf4j.refactor.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a supplier expression such as {@code "N=" + n + ", cause=" + e} into the message fragment
 * {@code N={}, cause={}} and the arguments {@code [n, e]}.
 */
public final class MessageSynthesizer {
    private MessageSynthesizer() {
    }

    public static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        for (String part : BalancedSplitter.splitConcatenation(expression)) {
            if (JavaLiterals.isLiteral(part)) {
                tokens.add(new Token.StringLiteral(JavaLiterals.unquote(part)));
            } else {
                tokens.add(new Token.Expression(collapseWhitespace(part)));
            }
        }
        return tokens;
    }

    public static SynthesizedMessage synthesize(String expression) {
        Template fragment = new Template();
        List<String> arguments = new ArrayList<>();
        for (Token token : tokenize(expression)) {
            if (token instanceof Token.StringLiteral literal) {
                fragment.appendLiteral(literal.content());
            } else if (token instanceof Token.Expression expr) {
                fragment.appendPlaceholder();
                arguments.add(expr.text());
            }
        }
        return new SynthesizedMessage(fragment, arguments);
    }

    /** Folds runs of whitespace outside literals into one space; literal content is kept as written. */
    static String collapseWhitespace(String text) {
        String trimmed = text.trim();
        StringBuilder sb = new StringBuilder(trimmed.length());
        BalancedCursor cursor = new BalancedCursor();
        boolean pendingSpace = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char ch = trimmed.charAt(i);
            boolean literal = cursor.inLiteral();
            cursor.feed(ch);
            if (!literal && Character.isWhitespace(ch)) {
                pendingSpace = true;
                continue;
            }
            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            sb.append(ch);
        }
        return sb.toString();
    }
}
