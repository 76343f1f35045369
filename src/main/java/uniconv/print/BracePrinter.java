package uniconv.print;

import uniconv.ast.Assignment;
import uniconv.ast.CountedRange;
import uniconv.ast.Expr;
import uniconv.ast.ForLoop;
import uniconv.ast.Function;
import uniconv.ast.NumberLiteral;
import uniconv.ast.Stmt;
import uniconv.ast.StringLiteral;
import uniconv.ast.WhileLoop;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared rendering for targets with braces, semicolons and declared locals.
 *
 * A variable is declared at its first assignment in the enclosing block chain
 * and plainly reassigned afterwards. One that is first assigned inside a loop
 * and read after it is declared before the loop instead.
 */
abstract class BracePrinter extends SourcePrinter {
	protected BracePrinter(FormatOptions options) {
		super(options);
	}

	/**
	 * Keyword declaring a local initialized with {@code value}.
	 */
	protected abstract String declarationKeyword(Expr value);

	/**
	 * Keyword declaring a counted loop variable.
	 */
	protected abstract String loopVariableKeyword();

	protected abstract String forEachHeader(String iterator, String iterable);

	protected abstract String functionHeader(Function function);

	/**
	 * Statement declaring {@code name} ahead of the loop that first assigns it
	 * {@code value}.
	 */
	protected abstract String hoistedDeclaration(String name, Expr value);

	/**
	 * Typed declaration with a zero value: {@code double} for a decimal
	 * literal, {@code stringType} for a string, otherwise {@code int}.
	 */
	protected static String zeroDeclaration(String name, Expr value, String stringType) {
		if (value instanceof StringLiteral) {
			return stringType + " " + name + " = \"\";";
		}
		if (value instanceof NumberLiteral number && number.text().contains(".")) {
			return "double " + name + " = 0.0;";
		}
		return "int " + name + " = 0;";
	}

	@Override
	protected String statementEnd() {
		return ";";
	}

	@Override
	protected String emptyBody() {
		return "// empty body";
	}

	@Override
	public String visitFunction(Function function, RenderContext ctx) {
		RenderContext inner = ctx.block();
		for (String param : function.params()) {
			inner.scope().declare(param);
		}
		return block(functionHeader(function), function.body(), ctx, inner);
	}

	@Override
	public String visitAssignment(Assignment assignment, RenderContext ctx) {
		String name = assignment.target().name();
		String prefix = ctx.scope().declare(name) ? declarationKeyword(assignment.value()) + " " : "";
		return ctx.indent() + prefix + name + " = " + expression(assignment.value(), ctx) + ";";
	}

	@Override
	public String visitForLoop(ForLoop loop, RenderContext ctx) {
		RenderContext inner = ctx.block();
		String header = loop.range().fold(
				counted -> countedHeader(loop.iterator(), counted, ctx, inner),
				each -> forEachHeader(loop.iterator(), expression(each.iterable(), ctx)));
		return block(header, loop.body(), ctx, inner);
	}

	/**
	 * Re-expands the half-open triple into {@code init; test; update}. The test
	 * is {@code <} for an ascending step and {@code >} for a descending one. A
	 * step that is neither a literal nor a variable is added as it stands.
	 */
	private String countedHeader(String iterator, CountedRange range, RenderContext ctx, RenderContext inner) {
		boolean fresh = !ctx.scope().isDeclared(iterator);
		if (fresh) {
			inner.scope().declare(iterator);
		}
		String init = (fresh ? loopVariableKeyword() + " " : "") + iterator + " = " + expression(range.start(), ctx);
		String test = iterator + (range.descending() ? " > " : " < ") + expression(range.end(), ctx);
		String update;
		if (!range.simpleStep()) {
			update = iterator + " += " + expression(range.step(), ctx);
		} else if (range.unitStep()) {
			update = iterator + (range.descending() ? "--" : "++");
		} else {
			update = iterator + (range.descending() ? " -= " : " += ") + range.stepMagnitude();
		}
		return "for (" + init + "; " + test + "; " + update + ")";
	}

	@Override
	public String visitWhileLoop(WhileLoop loop, RenderContext ctx) {
		String header = "while (" + expression(loop.condition(), ctx) + ")";
		return block(header, loop.body(), ctx, ctx.block());
	}

	private String block(String header, List<Stmt> body, RenderContext ctx, RenderContext inner) {
		return ctx.indent() + header + " {" + ctx.nl()
				+ blockBody(body, inner) + ctx.nl()
				+ ctx.indent() + "}";
	}

	/**
	 * Renders the statements of one block. A name first assigned inside a
	 * loop and read after it is declared just before that loop, in this block.
	 */
	protected final String blockBody(List<Stmt> body, RenderContext ctx) {
		if (body.isEmpty()) {
			return statements(body, ctx);
		}
		List<String> lines = new ArrayList<>();
		for (int i = 0; i < body.size(); i++) {
			Stmt stmt = body.get(i);
			if (stmt instanceof ForLoop || stmt instanceof WhileLoop) {
				Set<String> readLater = Hoisting.readNames(body.subList(i + 1, body.size()));
				for (Map.Entry<String, Expr> first : Hoisting.firstAssignments(stmt).entrySet()) {
					String name = first.getKey();
					if (readLater.contains(name) && ctx.scope().declare(name)) {
						lines.add(ctx.indent() + hoistedDeclaration(name, first.getValue()));
					}
				}
			}
			lines.add(statement(stmt, ctx));
		}
		return String.join(ctx.nl(), lines);
	}
}
