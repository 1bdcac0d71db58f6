package de.burger.slf4j.refactor.engine;

/**
 * One located log chain: {@code [start, end)} in the source text and its raw text.
 * {@code messageCallStart}/{@code messageCallEnd} are relative to {@code rawText} and cover the
 * first {@code .setMessage("{}")} call of the chain.
 */
public record ChainSpan(int start, int end, String rawText, int messageCallStart, int messageCallEnd) {
    public ChainSpan {
        if (start < 0 || end < start || rawText.length() != end - start) {
            throw new IllegalArgumentException("Inconsistent span [" + start + ", " + end + ")");
        }
        if (messageCallStart < 0 || messageCallEnd < messageCallStart || messageCallEnd > rawText.length()) {
            throw new IllegalArgumentException("Message call outside span: " + messageCallStart + ".." + messageCallEnd);
        }
    }

    public String messageCallText() {
        return rawText.substring(messageCallStart, messageCallEnd);
    }
}
