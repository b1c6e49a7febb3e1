package org.parenc.compiler.ir;

/**
 * A function name in callee position.
 *
 * @param name The name as written in the source.
 */
public record IrIdentifier(String name) implements IrNode {

    @Override
    public String typeName() {
        return "Identifier";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
