package org.parenc.compiler.ir;

import java.util.List;

/**
 * The root of the lowered tree.
 *
 * @param body The top-level statements and literals, in source order.
 */
public record IrProgram(List<IrNode> body) implements IrNode {

    public IrProgram {
        body = List.copyOf(body);
    }

    @Override
    public String typeName() {
        return "Program";
    }

    @Override
    public List<IrNode> getChildren() {
        return body;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
