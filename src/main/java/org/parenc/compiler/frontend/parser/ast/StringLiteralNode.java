package org.parenc.compiler.frontend.parser.ast;

/**
 * An AST node that represents a string literal.
 *
 * @param value The content between the quotes.
 */
public record StringLiteralNode(String value) implements AstNode {

    @Override
    public String typeName() {
        return "StringLiteral";
    }
}
