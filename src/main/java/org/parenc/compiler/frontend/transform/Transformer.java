package org.parenc.compiler.frontend.transform;

import org.parenc.compiler.frontend.NodeHandler;
import org.parenc.compiler.frontend.Traverser;
import org.parenc.compiler.frontend.Visitor;
import org.parenc.compiler.frontend.parser.ast.AstNode;
import org.parenc.compiler.frontend.parser.ast.CallExpressionNode;
import org.parenc.compiler.frontend.parser.ast.NumberLiteralNode;
import org.parenc.compiler.frontend.parser.ast.ProgramNode;
import org.parenc.compiler.frontend.parser.ast.StringLiteralNode;
import org.parenc.compiler.ir.IrCallExpression;
import org.parenc.compiler.ir.IrExpressionStatement;
import org.parenc.compiler.ir.IrIdentifier;
import org.parenc.compiler.ir.IrNode;
import org.parenc.compiler.ir.IrNumberLiteral;
import org.parenc.compiler.ir.IrProgram;
import org.parenc.compiler.ir.IrStringLiteral;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase: lowers the source tree into the C-shaped {@link IrProgram}.
 * <p>
 * The walk is driven by the {@link Traverser}. The context threaded through it is the
 * list the current node's output is appended to; the root's list becomes the program body.
 * A call opens a fresh argument list for its children on entry and is assembled on exit,
 * so every lowered node is complete and immutable when it is created.
 */
public final class Transformer {

    private final Traverser traverser;
    private final Visitor<List<IrNode>> visitor;

    /**
     * Creates a transformer with a fresh {@link Traverser}.
     */
    public Transformer() {
        this(new Traverser());
    }

    /**
     * Creates a transformer that walks with the given traverser.
     * @param traverser The traverser to use.
     */
    public Transformer(Traverser traverser) {
        this.traverser = traverser;
        this.visitor = new Visitor<List<IrNode>>()
                .register(NumberLiteralNode.class, new NumberLiteralLowering())
                .register(StringLiteralNode.class, new StringLiteralLowering())
                .register(CallExpressionNode.class, new CallExpressionLowering());
    }

    /**
     * Lowers a source program.
     *
     * @param program The source tree. It is not modified.
     * @return A new target tree.
     */
    public IrProgram transform(ProgramNode program) {
        List<IrNode> body = new ArrayList<>();
        traverser.traverse(program, visitor, body);
        return new IrProgram(body);
    }

    private static final class NumberLiteralLowering implements NodeHandler<NumberLiteralNode, List<IrNode>> {
        @Override
        public List<IrNode> enter(NumberLiteralNode node, AstNode parent, List<IrNode> out) {
            out.add(new IrNumberLiteral(node.value()));
            return out;
        }
    }

    private static final class StringLiteralLowering implements NodeHandler<StringLiteralNode, List<IrNode>> {
        @Override
        public List<IrNode> enter(StringLiteralNode node, AstNode parent, List<IrNode> out) {
            out.add(new IrStringLiteral(node.value()));
            return out;
        }
    }

    private static final class CallExpressionLowering implements NodeHandler<CallExpressionNode, List<IrNode>> {
        @Override
        public List<IrNode> enter(CallExpressionNode node, AstNode parent, List<IrNode> out) {
            return new ArrayList<>();
        }

        @Override
        public void exit(CallExpressionNode node, AstNode parent, List<IrNode> out, List<IrNode> arguments) {
            IrCallExpression call = new IrCallExpression(new IrIdentifier(node.name()), arguments);
            if (parent instanceof CallExpressionNode) {
                out.add(call);
            } else {
                out.add(new IrExpressionStatement(call));
            }
        }
    }
}
