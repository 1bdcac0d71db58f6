package de.burger.slf4j.refactor.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Accumulates the merged message and the emitted argument calls while one chain is rewritten. */
final class RewritePlan {
    private static final String ADD_ARGUMENT = ".addArgument(";

    private final Template mergedTemplate = new Template();
    private final List<String> flatArguments = new ArrayList<>();
    private final List<String> rewrittenCallSites = new ArrayList<>();

    /**
     * Merges one supplier call and returns the text that replaces it: one
     * {@code .addArgument(expr)} per closure-derived argument, then one per trailing extra.
     */
    String addSupplier(SynthesizedMessage synthesized, List<String> extras) {
        Template fragment = new Template().append(synthesized.fragment());
        List<String> callArguments = new ArrayList<>(synthesized.arguments());
        if (!extras.isEmpty()) {
            fragment.separateIfNeeded();
            for (int i = 0; i < extras.size(); i++) {
                if (i > 0) {
                    fragment.appendLiteral(" ");
                }
                fragment.appendPlaceholder();
                callArguments.add(MessageSynthesizer.collapseWhitespace(extras.get(i)));
            }
        }
        mergedTemplate.separateIfNeeded().append(fragment);
        flatArguments.addAll(callArguments);

        StringBuilder replacement = new StringBuilder();
        for (String argument : callArguments) {
            replacement.append(ADD_ARGUMENT).append(argument).append(')');
        }
        String callSite = replacement.toString();
        rewrittenCallSites.add(callSite);
        return callSite;
    }

    Template mergedTemplate() {
        return mergedTemplate;
    }

    List<String> flatArguments() {
        return Collections.unmodifiableList(flatArguments);
    }

    List<String> rewrittenCallSites() {
        return Collections.unmodifiableList(rewrittenCallSites);
    }
}
