package org.parenc.compiler.ir;

/**
 * A numeric literal, carried over from the source tree unchanged.
 *
 * @param value The digits as written.
 */
public record IrNumberLiteral(String value) implements IrNode {

    @Override
    public String typeName() {
        return "NumberLiteral";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitNumberLiteral(this);
    }
}
