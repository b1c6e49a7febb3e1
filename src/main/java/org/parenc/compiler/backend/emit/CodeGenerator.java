package org.parenc.compiler.backend.emit;

import org.parenc.compiler.api.CompilerErrorCode;
import org.parenc.compiler.ir.IrCallExpression;
import org.parenc.compiler.ir.IrExpressionStatement;
import org.parenc.compiler.ir.IrIdentifier;
import org.parenc.compiler.ir.IrNode;
import org.parenc.compiler.ir.IrNumberLiteral;
import org.parenc.compiler.ir.IrProgram;
import org.parenc.compiler.ir.IrStringLiteral;
import org.parenc.compiler.ir.IrVisitor;

import java.util.List;
import java.util.StringJoiner;

/**
 * The final stage of the compiler. Renders a lowered tree as C-style call syntax,
 * e.g. {@code add(2, subtract(4, 2));}.
 * <p>
 * Rendering is a pure function of the tree. Literal values are emitted verbatim.
 */
public class CodeGenerator implements IrVisitor<String> {

    /**
     * Renders a node and everything below it.
     *
     * @param node The node to render.
     * @return The generated code.
     * @throws CodeGenException if {@code node} or a node below it is missing.
     */
    public String generate(IrNode node) {
        if (node == null) {
            throw new CodeGenException(CompilerErrorCode.UNSUPPORTED_NODE, "Cannot generate code for a missing node");
        }
        return node.accept(this);
    }

    @Override
    public String visitProgram(IrProgram program) {
        return join(program.body(), "\n");
    }

    @Override
    public String visitExpressionStatement(IrExpressionStatement statement) {
        return generate(statement.expression()) + ";";
    }

    @Override
    public String visitCallExpression(IrCallExpression call) {
        return generate(call.callee()) + "(" + join(call.arguments(), ", ") + ")";
    }

    @Override
    public String visitIdentifier(IrIdentifier identifier) {
        return identifier.name();
    }

    @Override
    public String visitNumberLiteral(IrNumberLiteral literal) {
        return literal.value();
    }

    @Override
    public String visitStringLiteral(IrStringLiteral literal) {
        return "\"" + literal.value() + "\"";
    }

    private String join(List<IrNode> nodes, String separator) {
        StringJoiner joiner = new StringJoiner(separator);
        for (IrNode node : nodes) {
            joiner.add(generate(node));
        }
        return joiner.toString();
    }
}
