package org.parenc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An AST node that represents a prefix call, {@code (name param...)}.
 *
 * @param name The name of the called function. Never empty.
 * @param params The arguments, in source order.
 */
public record CallExpressionNode(
        String name,
        List<AstNode> params
) implements AstNode {

    public CallExpressionNode {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("A call expression needs a name");
        }
        params = List.copyOf(params);
    }

    @Override
    public String typeName() {
        return "CallExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return params;
    }
}
