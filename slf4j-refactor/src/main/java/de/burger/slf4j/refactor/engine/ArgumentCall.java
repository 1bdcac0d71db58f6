package de.burger.slf4j.refactor.engine;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** The argument list of one {@code .addArgument(...)} call, classified by the shape of its first argument. */
public sealed interface ArgumentCall permits ArgumentCall.Supplier, ArgumentCall.Plain {

    /** {@code () -> body} optionally followed by further arguments. */
    record Supplier(String lambdaBody, List<String> extras) implements ArgumentCall {
        public Supplier {
            extras = List.copyOf(extras);
        }
    }

    /** Anything that does not start with a zero-parameter lambda; left as written. */
    record Plain(String argumentList) implements ArgumentCall {}

    Pattern ZERO_ARG_LAMBDA = Pattern.compile("^\\(\\s*\\)\\s*->");

    static ArgumentCall classify(String argumentList) {
        List<String> args = BalancedSplitter.splitArguments(argumentList);
        if (args.isEmpty()) {
            return new Plain(argumentList);
        }
        Matcher m = ZERO_ARG_LAMBDA.matcher(args.get(0));
        if (!m.find()) {
            return new Plain(argumentList);
        }
        String body = args.get(0).substring(m.end());
        return new Supplier(body, args.subList(1, args.size()));
    }
}
