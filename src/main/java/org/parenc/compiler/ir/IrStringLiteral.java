package org.parenc.compiler.ir;

/**
 * A string literal, carried over from the source tree unchanged.
 *
 * @param value The content between the quotes.
 */
public record IrStringLiteral(String value) implements IrNode {

    @Override
    public String typeName() {
        return "StringLiteral";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }
}
