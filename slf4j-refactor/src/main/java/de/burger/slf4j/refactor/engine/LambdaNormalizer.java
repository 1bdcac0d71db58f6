package de.burger.slf4j.refactor.engine;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Unwraps block-bodied lambdas of the form {@code { return expr; }} to {@code expr}.
 * Anything else is returned trimmed but otherwise untouched.
 */
public final class LambdaNormalizer {
    private static final Pattern BLOCK_RETURN =
            Pattern.compile("^\\s*\\{\\s*return\\s+(.*?)\\s*;\\s*}\\s*$", Pattern.DOTALL);

    private LambdaNormalizer() {
    }

    public static String normalize(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.trim();
        Matcher m = BLOCK_RETURN.matcher(trimmed);
        return m.matches() ? m.group(1).trim() : trimmed;
    }
}
