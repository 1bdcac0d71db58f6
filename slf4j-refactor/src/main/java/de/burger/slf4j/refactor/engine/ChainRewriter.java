package de.burger.slf4j.refactor.engine;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites one located chain: supplier {@code addArgument} calls are inlined into the message and
 * replaced by one {@code addArgument} per dynamic expression; everything else is copied verbatim.
 * A chain without supplier calls, or whose merged message is empty, comes back unchanged.
 */
public final class ChainRewriter {
    private static final Logger log = LoggerFactory.getLogger(ChainRewriter.class);

    private static final Pattern ADD_ARGUMENT_CALL = Pattern.compile("\\.\\s*addArgument\\s*\\(");

    public String rewrite(ChainSpan span) {
        String raw = span.rawText();
        // structure is read from the comment-free view, text is copied from the original
        String view = JavaPrefilter.blankComments(raw);
        Matcher call = ADD_ARGUMENT_CALL.matcher(view);
        RewritePlan plan = new RewritePlan();
        StringBuilder out = new StringBuilder(raw.length());
        BalancedCursor cursor = new BalancedCursor();
        int messageInsertAt = -1;
        int copiedUpTo = 0;
        int i = 0;
        while (i < view.length()) {
            boolean chainLevel = !cursor.inLiteral() && cursor.depth() == 0;
            if (chainLevel && i == span.messageCallStart()) {
                out.append(raw, copiedUpTo, i);
                messageInsertAt = out.length();
                i = span.messageCallEnd();
                copiedUpTo = i;
                continue;
            }
            if (chainLevel && view.charAt(i) == '.' && call.region(i, view.length()).lookingAt()) {
                int open = call.end() - 1;
                int close = BalancedCursor.findClosingParen(view, open);
                if (close < 0) {
                    log.debug("Unclosed addArgument call at offset {}, rest of chain kept", span.start() + i);
                    break;
                }
                ArgumentCall argumentCall = ArgumentCall.classify(view.substring(open + 1, close - 1));
                if (argumentCall instanceof ArgumentCall.Supplier supplier) {
                    String expression = LambdaNormalizer.normalize(supplier.lambdaBody());
                    SynthesizedMessage synthesized = MessageSynthesizer.synthesize(expression);
                    out.append(raw, copiedUpTo, i);
                    out.append(plan.addSupplier(synthesized, supplier.extras()));
                    copiedUpTo = close;
                }
                i = close;
                continue;
            }
            cursor.feed(view.charAt(i));
            i++;
        }
        out.append(raw, copiedUpTo, raw.length());

        Template merged = plan.mergedTemplate();
        if (merged.isEmpty()) {
            return raw;
        }
        if (!merged.isRenderable()) {
            log.debug("Message of chain at offset {} has a backslash before literal braces, chain left unchanged",
                    span.start());
            return raw;
        }
        if (messageInsertAt < 0) {
            log.debug("Message call of chain at offset {} is nested, chain left unchanged", span.start());
            return raw;
        }
        out.insert(messageInsertAt, rewrittenMessageCall(span.messageCallText(), merged));
        log.trace("Chain at offset {} -> message {} with arguments {}, supplier calls now {}",
                span.start(), merged.toJavaLiteral(), plan.flatArguments(), plan.rewrittenCallSites());
        return out.toString();
    }

    private static String rewrittenMessageCall(String original, Template merged) {
        String head = original.substring(0, original.indexOf('(') + 1);
        return head + merged.toJavaLiteral() + ")";
    }
}
