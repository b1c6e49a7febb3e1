package org.parenc.compiler.frontend;

import org.parenc.compiler.api.CompilerErrorCode;
import org.parenc.compiler.frontend.parser.ast.AstNode;
import org.parenc.compiler.frontend.parser.ast.CallExpressionNode;
import org.parenc.compiler.frontend.parser.ast.NumberLiteralNode;
import org.parenc.compiler.frontend.parser.ast.ProgramNode;
import org.parenc.compiler.frontend.parser.ast.StringLiteralNode;
import org.parenc.compiler.ir.IrCallExpression;
import org.parenc.compiler.ir.IrExpressionStatement;
import org.parenc.compiler.ir.IrIdentifier;
import org.parenc.compiler.ir.IrNumberLiteral;
import org.parenc.compiler.ir.IrProgram;
import org.parenc.compiler.ir.IrStringLiteral;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link Traverser}.
 * These tests verify the visiting order, the parent passed to each callback and how the
 * context is handed down the tree.
 */
@ExtendWith(MockitoExtension.class)
public class TraverserTest {

    private static final NumberLiteralNode ONE = new NumberLiteralNode("1");
    private static final NumberLiteralNode FOUR = new NumberLiteralNode("4");
    private static final NumberLiteralNode TWO = new NumberLiteralNode("2");
    private static final CallExpressionNode SUBTRACT = new CallExpressionNode("subtract", List.of(FOUR, TWO));
    private static final CallExpressionNode ADD = new CallExpressionNode("add", List.of(ONE, SUBTRACT));
    private static final ProgramNode PROGRAM = new ProgramNode(List.of(ADD));

    @Mock
    private NodeHandler<ProgramNode, String> programHandler;
    @Mock
    private NodeHandler<CallExpressionNode, String> callHandler;
    @Mock
    private NodeHandler<NumberLiteralNode, String> numberHandler;

    /**
     * Every node is entered before its children and exited after them, with its parent as second argument.
     */
    @Test
    @Tag("unit")
    void visitsDepthFirstWithEnterBeforeAndExitAfterChildren() {
        when(programHandler.enter(any(), any(), any())).thenAnswer(inv -> inv.getArgument(2));
        when(callHandler.enter(any(), any(), any())).thenAnswer(inv -> inv.getArgument(2));
        when(numberHandler.enter(any(), any(), any())).thenAnswer(inv -> inv.getArgument(2));
        Visitor<String> visitor = new Visitor<String>()
                .register(ProgramNode.class, programHandler)
                .register(CallExpressionNode.class, callHandler)
                .register(NumberLiteralNode.class, numberHandler);

        new Traverser().traverse(PROGRAM, visitor, "ctx");

        InOrder order = inOrder(programHandler, callHandler, numberHandler);
        order.verify(programHandler).enter(PROGRAM, null, "ctx");
        order.verify(callHandler).enter(ADD, PROGRAM, "ctx");
        order.verify(numberHandler).enter(ONE, ADD, "ctx");
        order.verify(numberHandler).exit(ONE, ADD, "ctx", "ctx");
        order.verify(callHandler).enter(SUBTRACT, ADD, "ctx");
        order.verify(numberHandler).enter(FOUR, SUBTRACT, "ctx");
        order.verify(numberHandler).exit(FOUR, SUBTRACT, "ctx", "ctx");
        order.verify(numberHandler).enter(TWO, SUBTRACT, "ctx");
        order.verify(numberHandler).exit(TWO, SUBTRACT, "ctx", "ctx");
        order.verify(callHandler).exit(SUBTRACT, ADD, "ctx", "ctx");
        order.verify(callHandler).exit(ADD, PROGRAM, "ctx", "ctx");
        order.verify(programHandler).exit(PROGRAM, null, "ctx", "ctx");
        order.verifyNoMoreInteractions();
    }

    /**
     * The context returned by enter reaches the children, and exit sees both contexts.
     */
    @Test
    @Tag("unit")
    void handsContextReturnedByEnterToChildren() {
        List<String> seen = new ArrayList<>();
        Visitor<String> visitor = new Visitor<String>()
                .register(CallExpressionNode.class, new NodeHandler<CallExpressionNode, String>() {
                    @Override
                    public String enter(CallExpressionNode node, AstNode parent, String context) {
                        return context + "/" + node.name();
                    }

                    @Override
                    public void exit(CallExpressionNode node, AstNode parent, String context, String childContext) {
                        seen.add("exit " + node.name() + " " + context + " " + childContext);
                    }
                })
                .register(NumberLiteralNode.class, new NodeHandler<NumberLiteralNode, String>() {
                    @Override
                    public String enter(NumberLiteralNode node, AstNode parent, String context) {
                        seen.add(node.value() + " " + context);
                        return context;
                    }
                });

        new Traverser().traverse(PROGRAM, visitor, "root");

        assertThat(seen).containsExactly(
                "1 root/add",
                "4 root/add/subtract",
                "2 root/add/subtract",
                "exit subtract root/add root/add/subtract",
                "exit add root root/add");
    }

    @Test
    @Tag("unit")
    void passesContextThroughNodesWithoutHandler() {
        List<String> seen = new ArrayList<>();
        Visitor<String> visitor = new Visitor<String>()
                .register(StringLiteralNode.class, new NodeHandler<StringLiteralNode, String>() {
                    @Override
                    public String enter(StringLiteralNode node, AstNode parent, String context) {
                        seen.add(node.value() + " in " + ((CallExpressionNode) parent).name() + " with " + context);
                        return context;
                    }
                });
        ProgramNode program = new ProgramNode(List.of(
                new CallExpressionNode("outer", List.of(
                        new CallExpressionNode("inner", List.of(new StringLiteralNode("a")))))));

        new Traverser().traverse(program, visitor, "root");

        assertThat(seen).containsExactly("a in inner with root");
    }

    /**
     * The same walker handles lowered trees; the callee of a call is not a child.
     */
    @Test
    @Tag("unit")
    void walksLoweredTrees() {
        List<String> order = new ArrayList<>();
        Visitor<Void> visitor = new Visitor<Void>()
                .register(IrProgram.class, recorder(order))
                .register(IrExpressionStatement.class, recorder(order))
                .register(IrCallExpression.class, recorder(order))
                .register(IrIdentifier.class, recorder(order))
                .register(IrNumberLiteral.class, recorder(order))
                .register(IrStringLiteral.class, recorder(order));
        IrProgram program = new IrProgram(List.of(new IrExpressionStatement(
                new IrCallExpression(new IrIdentifier("print"), List.of(new IrStringLiteral("x"), new IrNumberLiteral("1"))))));

        new Traverser().traverse(program, visitor, null);

        assertThat(order).containsExactly("Program", "ExpressionStatement", "CallExpression", "StringLiteral", "NumberLiteral");
    }

    private static <T extends AstNode> NodeHandler<T, Void> recorder(List<String> order) {
        return new NodeHandler<T, Void>() {
            @Override
            public Void enter(T node, AstNode parent, Void context) {
                order.add(node.typeName());
                return null;
            }
        };
    }

    @Test
    @Tag("unit")
    void rejectsNodeWithoutChildList() {
        AstNode broken = new AstNode() {
            @Override
            public String typeName() {
                return "Broken";
            }

            @Override
            public List<AstNode> getChildren() {
                return null;
            }
        };

        assertThatThrownBy(() -> new Traverser().traverse(broken, new Visitor<String>(), "ctx"))
                .isInstanceOfSatisfying(TraversalException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.MALFORMED_NODE))
                .hasMessageContaining("'Broken'");
    }

    @Test
    @Tag("unit")
    void rejectsNullChild() {
        AstNode withHole = new AstNode() {
            @Override
            public String typeName() {
                return "WithHole";
            }

            @Override
            public List<AstNode> getChildren() {
                return Arrays.asList(ONE, null);
            }
        };

        assertThatThrownBy(() -> new Traverser().traverse(withHole, new Visitor<String>(), "ctx"))
                .isInstanceOf(TraversalException.class)
                .hasMessageContaining("'WithHole' has a null child");
    }

    @Test
    @Tag("unit")
    void rejectsNullRoot() {
        assertThatThrownBy(() -> new Traverser().traverse(null, new Visitor<String>(), "ctx"))
                .isInstanceOf(TraversalException.class);
    }
}
