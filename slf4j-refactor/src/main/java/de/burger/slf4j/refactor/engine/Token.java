package de.burger.slf4j.refactor.engine;

/** One top-level operand of a string concatenation. */
public sealed interface Token permits Token.StringLiteral, Token.Expression {

    /** A quoted literal; {@code content} holds the decoded runtime text. */
    record StringLiteral(String content) implements Token {}

    /** Any other operand, kept as source text with whitespace runs collapsed. */
    record Expression(String text) implements Token {}
}
