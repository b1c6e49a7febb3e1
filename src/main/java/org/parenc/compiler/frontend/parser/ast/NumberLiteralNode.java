package org.parenc.compiler.frontend.parser.ast;

/**
 * An AST node that represents a numeric literal.
 * The value is kept as the raw source text and never parsed.
 *
 * @param value The digits as written.
 */
public record NumberLiteralNode(String value) implements AstNode {

    @Override
    public String typeName() {
        return "NumberLiteral";
    }

    // This node has no children and inherits the empty list from getChildren().
}
