package de.burger.slf4j.refactor.engine;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the rewrite engine: locates every supplier-style chain in a file's text and
 * splices the rewritten chains back, leaving all other text byte for byte unchanged.
 * Instances are immutable and safe to share between threads.
 */
public final class SupplierChainRefactorer {
    private static final Logger log = LoggerFactory.getLogger(SupplierChainRefactorer.class);

    private final ChainLocator locator;
    private final ChainRewriter rewriter;

    public SupplierChainRefactorer() {
        this(LocatorSettings.defaults());
    }

    public SupplierChainRefactorer(LocatorSettings settings) {
        this.locator = new ChainLocator(settings);
        this.rewriter = new ChainRewriter();
    }

    public RewriteResult rewrite(String text) {
        return rewrite(text, null);
    }

    /**
     * @param text full file content
     * @param path used in diagnostics only, may be null
     */
    public RewriteResult rewrite(String text, Path path) {
        Objects.requireNonNull(text, "text");
        StringBuilder out = new StringBuilder(text.length());
        int copiedUpTo = 0;
        int rewritten = 0;
        int located = 0;
        Iterator<ChainSpan> spans = locator.locate(text).iterator();
        while (spans.hasNext()) {
            ChainSpan span = spans.next();
            located++;
            String replacement = rewriter.rewrite(span);
            if (replacement.equals(span.rawText())) {
                continue;
            }
            out.append(text, copiedUpTo, span.start()).append(replacement);
            copiedUpTo = span.end();
            rewritten++;
        }
        String source = path == null ? "<text>" : path.toString();
        if (rewritten == 0) {
            log.debug("{}: {} candidate chain(s), nothing to rewrite", source, located);
            return RewriteResult.unchanged();
        }
        out.append(text, copiedUpTo, text.length());
        log.debug("{}: rewrote {} of {} candidate chain(s)", source, rewritten, located);
        return new RewriteResult.Rewritten(out.toString(), rewritten);
    }

    /** Convenience for callers that only need the resulting text. */
    public String transform(String text) {
        RewriteResult result = rewrite(text);
        return result instanceof RewriteResult.Rewritten r ? r.text() : text;
    }
}
