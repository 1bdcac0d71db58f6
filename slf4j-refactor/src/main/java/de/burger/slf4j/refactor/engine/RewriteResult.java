package de.burger.slf4j.refactor.engine;

/** Outcome of rewriting one file's text. */
public sealed interface RewriteResult permits RewriteResult.Unchanged, RewriteResult.Rewritten {

    static RewriteResult unchanged() {
        return Unchanged.INSTANCE;
    }

    record Unchanged() implements RewriteResult {
        static final Unchanged INSTANCE = new Unchanged();
    }

    record Rewritten(String text, int chainsRewritten) implements RewriteResult {}
}
