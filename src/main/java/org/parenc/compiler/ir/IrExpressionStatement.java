package org.parenc.compiler.ir;

import java.util.List;
import java.util.Objects;

/**
 * Wraps a top-level call so that it is emitted as a statement.
 *
 * @param expression The wrapped expression.
 */
public record IrExpressionStatement(IrNode expression) implements IrNode {

    public IrExpressionStatement {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public String typeName() {
        return "ExpressionStatement";
    }

    @Override
    public List<IrNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }
}
