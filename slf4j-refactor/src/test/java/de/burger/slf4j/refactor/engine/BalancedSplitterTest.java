package de.burger.slf4j.refactor.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BalancedSplitterTest {

    @Test
    void splitsSimpleArgumentList() {
        assertThat(BalancedSplitter.splitArguments("a, b ,c")).containsExactly("a", "b", "c");
    }

    @Test
    void ignoresSeparatorsInsideParenthesesAndLiterals() {
        assertThat(BalancedSplitter.splitArguments("foo(a, b), \"x,y\", ','"))
            .containsExactly("foo(a, b)", "\"x,y\"", "','");
    }

    @Test
    void escapedQuoteDoesNotCloseLiteral() {
        assertThat(BalancedSplitter.splitArguments("\"a\\\",b\", c"))
            .containsExactly("\"a\\\",b\"", "c");
    }

    @Test
    void escapedBackslashBeforeClosingQuote() {
        assertThat(BalancedSplitter.splitArguments("\"C:\\\\\", d"))
            .containsExactly("\"C:\\\\\"", "d");
    }

    @Test
    void unbalancedClosingParenDoesNotGoNegative() {
        assertThat(BalancedSplitter.splitArguments("a), b")).containsExactly("a)", "b");
    }

    @Test
    void splitsConcatenationAtTopLevelPlus() {
        assertThat(BalancedSplitter.splitConcatenation("\"My Error: \"+e+\", the parameter=\"+param"))
            .containsExactly("\"My Error: \"", "e", "\", the parameter=\"", "param");
    }

    @Test
    void keepsTernaryWithNestedLiteralsTogether() {
        String expr = "\"C=\"+(cause != null ? cause.getMessage() : \"none, (x)+y\") + tail";
        assertThat(BalancedSplitter.splitConcatenation(expr))
            .containsExactly("\"C=\"", "(cause != null ? cause.getMessage() : \"none, (x)+y\")", "tail");
    }

    @Test
    void dropsEmptyParts() {
        assertThat(BalancedSplitter.split("a,, b, ", ',')).containsExactly("a", "b");
        assertThat(BalancedSplitter.split("", ',')).isEmpty();
        assertThat(BalancedSplitter.split(null, ',')).isEmpty();
    }

    @Test
    void sameStateMachineForBothSeparators() {
        String text = "f(a + b, c) + \"d, e\"";
        assertThat(BalancedSplitter.split(text, ',')).containsExactly(text);
        assertThat(BalancedSplitter.split(text, '+')).containsExactly("f(a + b, c)", "\"d, e\"");
    }
}
