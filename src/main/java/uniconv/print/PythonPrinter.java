package uniconv.print;

import uniconv.ast.Assignment;
import uniconv.ast.Comparison;
import uniconv.ast.CountedRange;
import uniconv.ast.Expr;
import uniconv.ast.ForLoop;
import uniconv.ast.Function;
import uniconv.ast.FunctionCall;
import uniconv.ast.MathOp;
import uniconv.ast.NumberLiteral;
import uniconv.ast.PowerNode;
import uniconv.ast.Print;
import uniconv.ast.Program;
import uniconv.ast.Variable;
import uniconv.ast.WhileLoop;

import java.util.ArrayList;
import java.util.List;

public final class PythonPrinter extends SourcePrinter {
	public PythonPrinter() {
		this(FormatOptions.defaults());
	}

	public PythonPrinter(FormatOptions options) {
		super(options);
	}

	@Override
	protected String statementEnd() {
		return "";
	}

	@Override
	protected String emptyBody() {
		return "pass";
	}

	@Override
	public String visitProgram(Program program, RenderContext ctx) {
		if (program.isEmpty()) {
			return "";
		}
		return statements(program.statements(), ctx);
	}

	@Override
	public String visitFunction(Function function, RenderContext ctx) {
		return ctx.indent() + "def " + function.name() + "(" + String.join(", ", function.params()) + "):"
				+ ctx.nl() + statements(function.body(), ctx.deeper());
	}

	@Override
	public String visitPrint(Print print, RenderContext ctx) {
		return ctx.indent() + "print(" + expression(print.expression(), ctx) + ")";
	}

	@Override
	public String visitAssignment(Assignment assignment, RenderContext ctx) {
		return ctx.indent() + assignment.target().name() + " = " + expression(assignment.value(), ctx);
	}

	@Override
	public String visitForLoop(ForLoop loop, RenderContext ctx) {
		String iterable = loop.range().fold(
				counted -> range(counted, ctx),
				each -> expression(each.iterable(), ctx));
		return ctx.indent() + "for " + loop.iterator() + " in " + iterable + ":"
				+ ctx.nl() + statements(loop.body(), ctx.deeper());
	}

	/**
	 * Shortest {@code range} call for the triple.
	 */
	private String range(CountedRange range, RenderContext ctx) {
		String end = expression(range.end(), ctx);
		if (isLiteral(range.step(), "1")) {
			if (isLiteral(range.start(), "0")) {
				return "range(" + end + ")";
			}
			return "range(" + expression(range.start(), ctx) + ", " + end + ")";
		}
		return "range(" + expression(range.start(), ctx) + ", " + end + ", " + expression(range.step(), ctx) + ")";
	}

	@Override
	public String visitWhileLoop(WhileLoop loop, RenderContext ctx) {
		return ctx.indent() + "while " + expression(loop.condition(), ctx) + ":"
				+ ctx.nl() + statements(loop.body(), ctx.deeper());
	}

	/**
	 * Concatenations that involve a string literal convert the other operands
	 * with {@code str()}, which Python does not do implicitly.
	 */
	@Override
	public String visitMathOp(MathOp op, RenderContext ctx) {
		List<Expr> parts = concatenationParts(op);
		if (!op.operator().equals("+") || !containsString(parts)) {
			return super.visitMathOp(op, ctx);
		}
		List<String> rendered = new ArrayList<>(parts.size());
		for (Expr part : parts) {
			rendered.add(concatenationOperand(part, ctx));
		}
		return String.join(" + ", rendered);
	}

	private String concatenationOperand(Expr part, RenderContext ctx) {
		String text = operand(part, ctx);
		if (part instanceof MathOp grouped) {
			return containsString(concatenationParts(grouped)) ? "(" + text + ")" : "str(" + text + ")";
		}
		return needsConversion(part) ? "str(" + text + ")" : text;
	}

	private static boolean needsConversion(Expr part) {
		return part instanceof Variable || part instanceof NumberLiteral || part instanceof PowerNode
				|| (part instanceof FunctionCall call && !call.name().equals("str"));
	}

	@Override
	public String visitPower(PowerNode power, RenderContext ctx) {
		return powerOperand(power.base(), ctx) + " ** " + powerOperand(power.exponent(), ctx);
	}

	private String powerOperand(Expr expr, RenderContext ctx) {
		String text = expression(expr, ctx);
		boolean compound = expr instanceof MathOp || expr instanceof Comparison || expr instanceof PowerNode
				|| (expr instanceof NumberLiteral number && number.isNegative());
		return compound ? "(" + text + ")" : text;
	}
}
