package uniconv.print;

import uniconv.ast.Comparison;
import uniconv.ast.Expr;
import uniconv.ast.FunctionCall;
import uniconv.ast.MathOp;
import uniconv.ast.NodeVisitor;
import uniconv.ast.NumberLiteral;
import uniconv.ast.Program;
import uniconv.ast.Stmt;
import uniconv.ast.StringLiteral;
import uniconv.ast.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Back end for one target language.
 *
 * Statement visits return complete lines, indented for the context's depth and
 * joined with the configured line separator; expression visits return inline
 * text. Printers keep no state between calls and may be shared.
 */
public abstract class SourcePrinter implements NodeVisitor<String, RenderContext> {
	private final FormatOptions options;

	protected SourcePrinter(FormatOptions options) {
		this.options = options;
	}

	public final String render(Program program) {
		return program.accept(this, RenderContext.root(options));
	}

	public final FormatOptions options() {
		return options;
	}

	/**
	 * Text closing a simple statement, e.g. {@code ;}.
	 */
	protected abstract String statementEnd();

	/**
	 * Placeholder line for a body with no statements.
	 */
	protected abstract String emptyBody();

	protected final String expression(Expr expr, RenderContext ctx) {
		return expr.accept(this, ctx);
	}

	/**
	 * Renders an operand of a binary operator, parenthesizing comparisons.
	 */
	protected final String operand(Expr expr, RenderContext ctx) {
		String text = expression(expr, ctx);
		return expr instanceof Comparison ? "(" + text + ")" : text;
	}

	protected final String statement(Stmt stmt, RenderContext ctx) {
		if (stmt instanceof FunctionCall call) {
			return ctx.indent() + expression(call, ctx) + statementEnd();
		}
		return stmt.accept(this, ctx);
	}

	protected final String statements(List<Stmt> body, RenderContext ctx) {
		if (body.isEmpty()) {
			return ctx.indent() + emptyBody();
		}
		List<String> lines = new ArrayList<>(body.size());
		for (Stmt stmt : body) {
			lines.add(statement(stmt, ctx));
		}
		return String.join(ctx.nl(), lines);
	}

	@Override
	public String visitFunctionCall(FunctionCall call, RenderContext ctx) {
		List<String> args = new ArrayList<>(call.args().size());
		for (Expr arg : call.args()) {
			args.add(expression(arg, ctx));
		}
		return call.name() + "(" + String.join(", ", args) + ")";
	}

	/**
	 * Sums nest to the left, so only a sum on the right needs parentheses.
	 */
	@Override
	public String visitMathOp(MathOp op, RenderContext ctx) {
		String right = op.right() instanceof MathOp ? "(" + expression(op.right(), ctx) + ")" : operand(op.right(), ctx);
		return operand(op.left(), ctx) + " " + op.operator() + " " + right;
	}

	@Override
	public String visitComparison(Comparison comparison, RenderContext ctx) {
		return operand(comparison.left(), ctx) + " " + comparison.operator() + " " + operand(comparison.right(), ctx);
	}

	@Override
	public String visitVariable(Variable variable, RenderContext ctx) {
		return variable.name();
	}

	@Override
	public String visitStringLiteral(StringLiteral literal, RenderContext ctx) {
		return quote(literal.value());
	}

	@Override
	public String visitNumberLiteral(NumberLiteral literal, RenderContext ctx) {
		return literal.text();
	}

	/**
	 * Double-quotes a literal. Quotes and control characters are escaped;
	 * escape sequences already present in the text are kept as they are.
	 */
	static String quote(String value) {
		StringBuilder out = new StringBuilder(value.length() + 2).append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == '\\' && i + 1 < value.length()) {
				out.append(c).append(value.charAt(++i));
				continue;
			}
			switch (c) {
				case '"' -> out.append("\\\"");
				case '\n' -> out.append("\\n");
				case '\t' -> out.append("\\t");
				case '\r' -> out.append("\\r");
				case '\\' -> out.append("\\\\");
				default -> out.append(c);
			}
		}
		return out.append('"').toString();
	}

	static boolean isLiteral(Expr expr, String text) {
		return expr instanceof NumberLiteral number && number.text().equals(text);
	}

	/**
	 * Operands of a chain of {@code +} operations, left to right. Only the left
	 * spine is followed: a sum on the right stays one grouped operand.
	 */
	static List<Expr> concatenationParts(Expr expr) {
		List<Expr> parts = new ArrayList<>();
		collectParts(expr, parts);
		return parts;
	}

	private static void collectParts(Expr expr, List<Expr> parts) {
		if (expr instanceof MathOp op && op.operator().equals("+")) {
			collectParts(op.left(), parts);
			parts.add(op.right());
			return;
		}
		parts.add(expr);
	}

	static boolean containsString(List<Expr> parts) {
		for (Expr part : parts) {
			if (part instanceof StringLiteral) {
				return true;
			}
		}
		return false;
	}
}
