package org.parenc.compiler.frontend;

import org.parenc.compiler.frontend.parser.ast.AstNode;

/**
 * Callbacks the {@link Traverser} invokes for one node type.
 * <p>
 * Both methods are optional. The context is whatever the walk threads through the tree,
 * e.g. the list lowered nodes are appended to. {@link #enter} decides which context the
 * node's children receive; {@link #exit} sees both the context the node itself received
 * and the one its children were given.
 *
 * @param <T> The concrete node type handled.
 * @param <C> The context type threaded through the walk.
 */
public interface NodeHandler<T extends AstNode, C> {

    /**
     * Called before the children of {@code node} are walked.
     *
     * @param node The node being entered.
     * @param parent The parent node, or {@code null} for the root.
     * @param context The context handed down by the parent.
     * @return The context to hand to the children of {@code node}.
     */
    default C enter(T node, AstNode parent, C context) {
        return context;
    }

    /**
     * Called after all children of {@code node} have been walked.
     *
     * @param node The node being left.
     * @param parent The parent node, or {@code null} for the root.
     * @param context The context handed down by the parent.
     * @param childContext The context that was handed to the children.
     */
    default void exit(T node, AstNode parent, C context, C childContext) {
    }
}
