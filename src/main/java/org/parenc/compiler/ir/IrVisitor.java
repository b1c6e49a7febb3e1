package org.parenc.compiler.ir;

/**
 * One method per {@link IrNode} type.
 *
 * @param <R> The result type.
 */
public interface IrVisitor<R> {

    R visitProgram(IrProgram program);

    R visitExpressionStatement(IrExpressionStatement statement);

    R visitCallExpression(IrCallExpression call);

    R visitIdentifier(IrIdentifier identifier);

    R visitNumberLiteral(IrNumberLiteral literal);

    R visitStringLiteral(IrStringLiteral literal);
}
