package de.burger.slf4j.refactor.engine;

import java.util.regex.Pattern;

/**
 * Recognition, decoding and encoding of Java string and char literals.
 * Decoding followed by {@link #quote(String)} yields a literal with the same runtime value.
 */
public final class JavaLiterals {
    private static final Pattern LITERAL = Pattern.compile(
            "^\\s*(?:\"(?:[^\"\\\\]++|\\\\.)*+\"|'(?:[^'\\\\]++|\\\\.)*+')\\s*$", Pattern.DOTALL);

    private JavaLiterals() {
    }

    /** True when the whole token is a single quote-delimited literal. */
    public static boolean isLiteral(String token) {
        return token != null && LITERAL.matcher(token).matches();
    }

    /** Returns the runtime text of a literal token, or the token itself when it is not a literal. */
    public static String unquote(String token) {
        String t = token.trim();
        if (t.length() >= 2 && (t.charAt(0) == '"' || t.charAt(0) == '\'') && t.charAt(t.length() - 1) == t.charAt(0)) {
            return unescape(t.substring(1, t.length() - 1));
        }
        return token;
    }

    /** Resolves Java escape sequences; unknown escapes are kept as written. */
    public static String unescape(String body) {
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char ch = body.charAt(i);
            if (ch != '\\' || i + 1 >= body.length()) {
                sb.append(ch);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            switch (next) {
                case 'b' -> { sb.append('\b'); i += 2; }
                case 't' -> { sb.append('\t'); i += 2; }
                case 'n' -> { sb.append('\n'); i += 2; }
                case 'f' -> { sb.append('\f'); i += 2; }
                case 'r' -> { sb.append('\r'); i += 2; }
                case 's' -> { sb.append(' '); i += 2; }
                case '"', '\'', '\\' -> { sb.append(next); i += 2; }
                case 'u' -> i = appendUnicode(body, i, sb);
                default -> {
                    if (next >= '0' && next <= '7') {
                        i = appendOctal(body, i, sb);
                    } else {
                        sb.append(ch).append(next);
                        i += 2;
                    }
                }
            }
        }
        return sb.toString();
    }

    /** Encodes raw text as the body of a double-quoted Java literal (without the quotes). */
    public static String escape(String raw) {
        StringBuilder sb = new StringBuilder(raw.length() + 8);
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            switch (ch) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (ch < 0x20 || ch == 0x7f) {
                        // three octal digits so a following digit is never absorbed
                        sb.append(String.format("\\%03o", (int) ch));
                    } else {
                        sb.append(ch);
                    }
                }
            }
        }
        return sb.toString();
    }

    public static String quote(String raw) {
        return "\"" + escape(raw) + "\"";
    }

    private static int appendUnicode(String body, int start, StringBuilder sb) {
        int i = start + 1;
        while (i < body.length() && body.charAt(i) == 'u') {
            i++;
        }
        if (i + 4 <= body.length() && isHex(body, i, i + 4)) {
            sb.append((char) Integer.parseInt(body.substring(i, i + 4), 16));
            return i + 4;
        }
        sb.append(body, start, i);
        return i;
    }

    private static boolean isHex(String s, int from, int to) {
        for (int i = from; i < to; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static int appendOctal(String body, int start, StringBuilder sb) {
        int i = start + 1;
        int max = body.charAt(i) <= '3' ? 3 : 2;
        int end = i;
        while (end < body.length() && end - i < max && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
            end++;
        }
        sb.append((char) Integer.parseInt(body.substring(i, end), 8));
        return end;
    }
}
