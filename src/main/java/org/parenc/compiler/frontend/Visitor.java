package org.parenc.compiler.frontend;

import org.parenc.compiler.frontend.parser.ast.AstNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps node classes to the {@link NodeHandler} the {@link Traverser} should call for them.
 * Node types without a registered handler are walked but not reported.
 *
 * @param <C> The context type threaded through the walk.
 */
public final class Visitor<C> {

    private final Map<Class<? extends AstNode>, NodeHandler<? extends AstNode, C>> byClass = new HashMap<>();

    /**
     * Registers a handler for the given node class, replacing any earlier one.
     *
     * @param nodeType The concrete node class.
     * @param handler The handler for that class.
     * @param <T> Concrete node type parameter.
     * @return This visitor, for chaining.
     */
    public <T extends AstNode> Visitor<C> register(Class<T> nodeType, NodeHandler<T, C> handler) {
        byClass.put(nodeType, handler);
        return this;
    }

    /**
     * Looks up the handler registered for the class of {@code node}.
     *
     * @param node The node to look up.
     * @return The handler, if one is registered.
     */
    @SuppressWarnings("unchecked")
    public Optional<NodeHandler<AstNode, C>> handlerFor(AstNode node) {
        return Optional.ofNullable((NodeHandler<AstNode, C>) byClass.get(node.getClass()));
    }
}
