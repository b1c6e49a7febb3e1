package org.parenc.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** An opening or closing parenthesis. */
    PAREN,
    /** A numeric literal. Holds a single digit unless multi-digit numerals are enabled. */
    NUMBER,
    /** A string literal, without its quotes. */
    STRING,
    /** A run of ASCII letters, used as a call name. */
    NAME
}
