package org.parenc.compiler.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.parenc.compiler.frontend.lexer.Token;
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
import org.parenc.compiler.ir.IrVisitor;

import java.util.List;
import java.util.Locale;

/**
 * Utility class for rendering the intermediate results of a compilation as JSON.
 * Every object carries a {@code type} member naming its token or node type.
 */
public final class StageDump {

	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

	private StageDump() {}

	/**
	 * @param tokens The tokens to render.
	 * @return A JSON array with one {@code {type, value}} object per token.
	 */
	public static String tokens(List<Token> tokens) {
		JsonArray array = new JsonArray();
		for (Token token : tokens) {
			JsonObject o = new JsonObject();
			o.addProperty("type", token.type().name().toLowerCase(Locale.ROOT));
			o.addProperty("value", token.text());
			array.add(o);
		}
		return GSON.toJson(array);
	}

	/**
	 * @param node The root of a source tree.
	 * @return The tree as nested JSON objects.
	 * @throws IllegalArgumentException if the tree holds a node that is not a source node.
	 */
	public static String sourceTree(AstNode node) {
		return GSON.toJson(toJson(node));
	}

	/**
	 * @param node The root of a lowered tree.
	 * @return The tree as nested JSON objects.
	 */
	public static String loweredTree(IrNode node) {
		return GSON.toJson(node.accept(new IrJsonRenderer()));
	}

	private static JsonElement toJson(AstNode node) {
		JsonObject o = typed(node);
		if (node instanceof ProgramNode program) {
			o.add("body", toJsonArray(program.body()));
		} else if (node instanceof CallExpressionNode call) {
			o.addProperty("name", call.name());
			o.add("params", toJsonArray(call.params()));
		} else if (node instanceof NumberLiteralNode number) {
			o.addProperty("value", number.value());
		} else if (node instanceof StringLiteralNode string) {
			o.addProperty("value", string.value());
		} else {
			throw new IllegalArgumentException("Not a source tree node: " + node.typeName());
		}
		return o;
	}

	private static JsonArray toJsonArray(List<? extends AstNode> nodes) {
		JsonArray array = new JsonArray();
		nodes.forEach(n -> array.add(toJson(n)));
		return array;
	}

	private static JsonObject typed(AstNode node) {
		JsonObject o = new JsonObject();
		o.addProperty("type", node.typeName());
		return o;
	}

	private static final class IrJsonRenderer implements IrVisitor<JsonElement> {

		@Override
		public JsonElement visitProgram(IrProgram program) {
			JsonObject o = typed(program);
			o.add("body", array(program.body()));
			return o;
		}

		@Override
		public JsonElement visitExpressionStatement(IrExpressionStatement statement) {
			JsonObject o = typed(statement);
			o.add("expression", statement.expression().accept(this));
			return o;
		}

		@Override
		public JsonElement visitCallExpression(IrCallExpression call) {
			JsonObject o = typed(call);
			o.add("callee", call.callee().accept(this));
			o.add("arguments", array(call.arguments()));
			return o;
		}

		@Override
		public JsonElement visitIdentifier(IrIdentifier identifier) {
			JsonObject o = typed(identifier);
			o.addProperty("name", identifier.name());
			return o;
		}

		@Override
		public JsonElement visitNumberLiteral(IrNumberLiteral literal) {
			JsonObject o = typed(literal);
			o.addProperty("value", literal.value());
			return o;
		}

		@Override
		public JsonElement visitStringLiteral(IrStringLiteral literal) {
			JsonObject o = typed(literal);
			o.addProperty("value", literal.value());
			return o;
		}

		private JsonArray array(List<IrNode> nodes) {
			JsonArray array = new JsonArray();
			nodes.forEach(n -> array.add(n.accept(this)));
			return array;
		}
	}
}
