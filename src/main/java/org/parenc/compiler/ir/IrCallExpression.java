package org.parenc.compiler.ir;

import java.util.List;
import java.util.Objects;

/**
 * A call in C form, {@code callee(arguments...)}.
 * <p>
 * Only the arguments are children; the callee is part of the call itself.
 *
 * @param callee The called function.
 * @param arguments The arguments, in source order.
 */
public record IrCallExpression(IrIdentifier callee, List<IrNode> arguments) implements IrNode {

    public IrCallExpression {
        Objects.requireNonNull(callee, "callee");
        arguments = List.copyOf(arguments);
    }

    @Override
    public String typeName() {
        return "CallExpression";
    }

    @Override
    public List<IrNode> getChildren() {
        return arguments;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitCallExpression(this);
    }
}
