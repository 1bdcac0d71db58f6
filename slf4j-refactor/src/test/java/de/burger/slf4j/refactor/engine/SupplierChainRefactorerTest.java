package de.burger.slf4j.refactor.engine;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class SupplierChainRefactorerTest {

    private static final Pattern MESSAGE = Pattern.compile("setMessage\\(\"(.*?)\"\\)");

    private final SupplierChainRefactorer refactorer = new SupplierChainRefactorer();

    @Test
    void concatenationBecomesParameterizedMessage() {
        String in = "log.atInfo().setMessage(\"{}\").addArgument(() -> \"My Error: \"+e+\", the parameter=\"+param).log();";
        assertThat(refactorer.transform(in)).isEqualTo(
            "log.atInfo().setMessage(\"My Error: {}, the parameter={}\").addArgument(e).addArgument(param).log();");
    }

    @Test
    void blockLambdaWithReturn() {
        String in = "log.atWarn()\n"
            + "   .setMessage(\"{}\")\n"
            + "   .addArgument(() -> { return \"N=\"+n+\", cause=\"+e; })\n"
            + "   .log();";
        assertThat(refactorer.transform(in)).isEqualTo("log.atWarn()\n"
            + "   .setMessage(\"N={}, cause={}\")\n"
            + "   .addArgument(n).addArgument(e)\n"
            + "   .log();");
    }

    @Test
    void multipleSuppliersAreJoinedWithSpace() {
        String in = "log.atInfo()\n"
            + "   .setMessage(\"{}\")\n"
            + "   .addArgument(() -> \"User=\" + userId)\n"
            + "   .addArgument(() -> \"File:\" + file + \" size=\" + size)\n"
            + "   .log();";
        assertThat(refactorer.transform(in)).isEqualTo("log.atInfo()\n"
            + "   .setMessage(\"User={} File:{} size={}\")\n"
            + "   .addArgument(userId)\n"
            + "   .addArgument(file).addArgument(size)\n"
            + "   .log();");
    }

    @Test
    void plainArgumentCallIsKeptInPlace() {
        String in = "log.atError()\n"
            + "   .setMessage(\"{}\")\n"
            + "   .addArgument(() -> \"ID=\" + id)\n"
            + "   .addArgument(cause)\n"
            + "   .log();";
        assertThat(refactorer.transform(in)).isEqualTo("log.atError()\n"
            + "   .setMessage(\"ID={}\")\n"
            + "   .addArgument(id)\n"
            + "   .addArgument(cause)\n"
            + "   .log();");
    }

    @Test
    void pureLiteralSupplierDisappears() {
        assertThat(refactorer.transform("log.atDebug().setMessage(\"{}\").addArgument(() -> \"Static text only\").log();"))
            .isEqualTo("log.atDebug().setMessage(\"Static text only\").log();");
    }

    @Test
    void extraArgumentGetsSeparatedPlaceholder() {
        assertThat(refactorer.transform("log.atDebug().setMessage(\"{}\").addArgument(() -> \"Static text only\", e).log();"))
            .isEqualTo("log.atDebug().setMessage(\"Static text only {}\").addArgument(e).log();");
    }

    @Test
    void severalExtrasKeepTheirOrder() {
        String out = refactorer.transform("log.atError().setMessage(\"{}\").addArgument(() -> \"Oops: \" + e, ctx, e).log();");
        assertThat(out).isEqualTo(
            "log.atError().setMessage(\"Oops: {} {} {}\").addArgument(e).addArgument(ctx).addArgument(e).log();");
    }

    @Test
    void ternaryArgumentStaysIntact() {
        String in = "log.atWarn()\n"
            + "   .setMessage(\"{}\")\n"
            + "   .addArgument(() -> \"ID=\" + id)\n"
            + "   .addArgument(() -> \"C=\" + (cause != null\n"
            + "          ? cause.getMessage()\n"
            + "          : \"none\"), cause)\n"
            + "   .log();";
        String out = refactorer.transform(in);
        assertThat(out).contains(".setMessage(\"ID={} C={} {}\")");
        assertThat(out).contains(".addArgument((cause != null ? cause.getMessage() : \"none\")).addArgument(cause)");
        assertThat(out).contains(".addArgument(id)");
    }

    @Test
    void placeholderCountMatchesArgumentCount() {
        String out = refactorer.transform("log.atError().setMessage(\"{}\").addArgument(() -> \"Oops: \" + e, ctx, e).log();");
        Matcher m = MESSAGE.matcher(out);
        assertThat(m.find()).isTrue();
        assertThat(countOf(m.group(1), "{}")).isEqualTo(countOf(out, ".addArgument("));
    }

    @Test
    void rewritingIsIdempotent() {
        List<String> samples = List.of(
            "log.atInfo().setMessage(\"{}\").addArgument(() -> \"a=\" + a).log();",
            "log.atInfo().setMessage(\"{}\").addArgument(() -> x).log();",
            "log.atDebug().setMessage(\"{}\").addArgument(() -> \"Static text only\", e).log();",
            "log.atInfo().setMessage(\"{}\").addArgument(() -> \"set {} to \" + v).log();");
        for (String sample : samples) {
            String once = refactorer.transform(sample);
            assertThat(refactorer.transform(once)).isEqualTo(once);
        }
    }

    @Test
    void chainsWithoutSuppliersAreNotTouched() {
        String in = "class A {\n"
            + "  void run() {\n"
            + "    log.atInfo().setMessage(\"{}\").addArgument(value).log();\n"
            + "    log.atInfo().setMessage(\"done {}\").addArgument(() -> \"x\").log();\n"
            + "  }\n"
            + "}\n";
        RewriteResult result = refactorer.rewrite(in);
        assertThat(result).isInstanceOf(RewriteResult.Unchanged.class);
        assertThat(result).isSameAs(RewriteResult.unchanged());
        assertThat(refactorer.transform(in)).isSameAs(in);
    }

    @Test
    void surroundingTextIsPreservedExactly() {
        String prefix = "package p;\n\n/* header {} */\nclass A {\n  void run() {\n    // before\n    ";
        String suffix = "\n    int x = 1; // after\n  }\n}\n";
        String in = prefix + "log.atInfo().setMessage(\"{}\").addArgument(() -> \"v=\" + v).log();" + suffix;
        RewriteResult result = refactorer.rewrite(in);
        assertThat(result).isInstanceOfSatisfying(RewriteResult.Rewritten.class, r -> {
            assertThat(r.chainsRewritten()).isEqualTo(1);
            assertThat(r.text()).isEqualTo(prefix
                + "log.atInfo().setMessage(\"v={}\").addArgument(v).log();" + suffix);
        });
    }

    @Test
    void countsEveryRewrittenChain() {
        String in = "log.atInfo().setMessage(\"{}\").addArgument(() -> \"a=\" + a).log();\n"
            + "log.atInfo().setMessage(\"{}\").addArgument(b).log();\n"
            + "LOGGER.atTrace().setMessage(\"{}\").addArgument(() -> \"c=\" + c).log();\n";
        RewriteResult result = refactorer.rewrite(in);
        assertThat(result).isInstanceOfSatisfying(RewriteResult.Rewritten.class,
            r -> assertThat(r.chainsRewritten()).isEqualTo(2));
    }

    @Test
    void quotesAndBackslashesStayEscaped() {
        String in = "log.atInfo().setMessage(\"{}\").addArgument(() -> \"He said \\\"\" + what + \"\\\" at C:\\\\tmp\").log();";
        assertThat(refactorer.transform(in))
            .isEqualTo("log.atInfo().setMessage(\"He said \\\"{}\\\" at C:\\\\tmp\").addArgument(what).log();");
    }

    @Test
    void literalBracesAreEscapedInMessage() {
        assertThat(refactorer.transform("log.atInfo().setMessage(\"{}\").addArgument(() -> \"set {} to \" + v).log();"))
            .isEqualTo("log.atInfo().setMessage(\"set \\\\{} to {}\").addArgument(v).log();");
    }

    @Test
    void newlineEscapeIsReEncoded() {
        assertThat(refactorer.transform("log.atInfo().setMessage(\"{}\").addArgument(() -> \"line1\\nline2 \" + x).log();"))
            .isEqualTo("log.atInfo().setMessage(\"line1\\nline2 {}\").addArgument(x).log();");
    }

    @Test
    void emptySupplierMessageLeavesChainAlone() {
        String in = "log.atInfo().setMessage(\"{}\").addArgument(() -> \"\").log();";
        assertThat(refactorer.transform(in)).isEqualTo(in);
    }

    @Test
    void backslashBeforeLiteralBracesLeavesChainAlone() {
        String in = "log.atInfo().setMessage(\"{}\").addArgument(() -> \"re \\\\{} x=\" + x).log();";
        assertThat(refactorer.transform(in)).isEqualTo(in);
    }

    @Test
    void trailingBackslashBeforeValueIsDoubled() {
        assertThat(refactorer.transform("log.atInfo().setMessage(\"{}\").addArgument(() -> \"C:\\\\\" + dir).log();"))
            .isEqualTo("log.atInfo().setMessage(\"C:\\\\\\\\{}\").addArgument(dir).log();");
    }

    @Test
    void chainAfterTextBlockIsRewritten() {
        String in = "String s = \"\"\"\n"
            + "    say \"hi\n"
            + "    \"\"\";\n"
            + "log.atInfo().setMessage(\"{}\").addArgument(() -> \"a=\" + a).log();\n";
        assertThat(refactorer.transform(in)).isEqualTo("String s = \"\"\"\n"
            + "    say \"hi\n"
            + "    \"\"\";\n"
            + "log.atInfo().setMessage(\"a={}\").addArgument(a).log();\n");
    }

    private static int countOf(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length())) {
            count++;
        }
        return count;
    }
}
