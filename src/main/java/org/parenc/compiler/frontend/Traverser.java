package org.parenc.compiler.frontend;

import org.parenc.compiler.api.CompilerErrorCode;
import org.parenc.compiler.frontend.parser.ast.AstNode;

import java.util.List;
import java.util.Optional;

/**
 * A generic, depth-first walker for Abstract Syntax Trees.
 * <p>
 * For every node the walker calls the registered {@link NodeHandler#enter}, walks the
 * children from left to right and then calls {@link NodeHandler#exit}. It knows nothing
 * about what the handlers do; the children of a node come from {@link AstNode#getChildren()}.
 * Instead of attaching scratch state to the nodes, handlers receive an explicit context
 * that {@code enter} may replace for the subtree below it.
 */
public class Traverser {

    /**
     * Walks the tree below {@code root}, starting with {@code root} itself.
     *
     * @param root The node to start at. Visited with a {@code null} parent.
     * @param visitor The handlers to call.
     * @param rootContext The context handed to the root.
     * @param <C> The context type.
     * @throws TraversalException if a node reports no child list or a {@code null} child.
     */
    public <C> void traverse(AstNode root, Visitor<C> visitor, C rootContext) {
        if (root == null) {
            throw new TraversalException(CompilerErrorCode.MALFORMED_NODE, "Cannot traverse a null tree");
        }
        traverseNode(root, null, visitor, rootContext);
    }

    private <C> void traverseNode(AstNode node, AstNode parent, Visitor<C> visitor, C context) {
        Optional<NodeHandler<AstNode, C>> handler = visitor.handlerFor(node);

        C childContext = handler.isPresent() ? handler.get().enter(node, parent, context) : context;

        List<? extends AstNode> children = node.getChildren();
        if (children == null) {
            throw new TraversalException(CompilerErrorCode.MALFORMED_NODE,
                    "Node of type '" + node.typeName() + "' reported no child list");
        }
        for (AstNode child : children) {
            if (child == null) {
                throw new TraversalException(CompilerErrorCode.MALFORMED_NODE,
                        "Node of type '" + node.typeName() + "' has a null child");
            }
            traverseNode(child, node, visitor, childContext);
        }

        if (handler.isPresent()) {
            handler.get().exit(node, parent, context, childContext);
        }
    }
}
