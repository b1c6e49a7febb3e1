package org.parenc.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in an Abstract Syntax Tree (AST).
 * Both the source tree built by the parser and the lowered tree in
 * {@link org.parenc.compiler.ir} implement it, so one
 * {@link org.parenc.compiler.frontend.Traverser} can walk either.
 */
public interface AstNode {

    /**
     * Returns the canonical name of this node type, e.g. {@code CallExpression}.
     * Used in error messages and stage dumps.
     *
     * @return The type name.
     */
    String typeName();

    /**
     * Returns a list of the direct child nodes in source order.
     * This allows a generic traverser to walk the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<? extends AstNode> getChildren() {
        return Collections.emptyList();
    }
}
