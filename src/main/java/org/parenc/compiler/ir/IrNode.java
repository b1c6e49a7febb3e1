package org.parenc.compiler.ir;

import org.parenc.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A node of the lowered, C-shaped tree produced by the
 * {@link org.parenc.compiler.frontend.transform.Transformer}.
 * <p>
 * The set of node types is closed by {@link IrVisitor}: adding a type means adding a
 * visit method, so every consumer must handle it before the code compiles again.
 */
public interface IrNode extends AstNode {

    /**
     * Dispatches to the visit method for this node type.
     *
     * @param visitor The visitor to call.
     * @param <R> The result type of the visitor.
     * @return The visitor's result.
     */
    <R> R accept(IrVisitor<R> visitor);

    @Override
    default List<? extends IrNode> getChildren() {
        return List.of();
    }
}
