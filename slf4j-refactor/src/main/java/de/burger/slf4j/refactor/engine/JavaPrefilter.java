package de.burger.slf4j.refactor.engine;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Blanks comments while keeping string and char literals, preserving every offset and line break,
 * so that chains can be located on the result and cut out of the original text.
 */
public final class JavaPrefilter {
    // Literals come first in the alternation so that "//" inside a string is not taken for a comment;
    // text blocks come before plain strings so that """ is not read as an empty string.
    private static final Pattern LITERAL_OR_COMMENT = Pattern.compile(
            "\"\"\"(?:[^\"\\\\]++|\\\\.|\"(?!\"\"))*+\"\"\"" +
                    "|\"(?:[^\"\\\\\\n]++|\\\\.)*+\"" +
                    "|'(?:[^'\\\\\\n]++|\\\\.)*+'" +
                    "|(/\\*.*?\\*/)" +
                    "|(//[^\\n]*+)",
            Pattern.DOTALL);

    private JavaPrefilter() {}

    public static String blankComments(String source) {
        return replaceAll(LITERAL_OR_COMMENT, source, m -> m.group(1) != null || m.group(2) != null
                ? blankWithNewlines(m.group())
                : m.group());
    }

    private static String replaceAll(Pattern pattern, String input, Function<Matcher, String> replacer) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder(input.length());
        while (m.find()) {
            String replacement = Matcher.quoteReplacement(replacer.apply(m));
            m.appendReplacement(sb, replacement);
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String blankWithNewlines(String segment) {
        StringBuilder sb = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            char ch = segment.charAt(i);
            sb.append(ch == '\n' || ch == '\r' ? ch : ' ');
        }
        return sb.toString();
    }
}
