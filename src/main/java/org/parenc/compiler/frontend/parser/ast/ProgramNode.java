package org.parenc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of the source tree. Holds the top-level forms in input order.
 *
 * @param body The top-level expressions.
 */
public record ProgramNode(List<AstNode> body) implements AstNode {

    public ProgramNode {
        body = List.copyOf(body);
    }

    @Override
    public String typeName() {
        return "Program";
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
