package uniconv.print;

import uniconv.ast.Expr;
import uniconv.ast.Function;
import uniconv.ast.PowerNode;
import uniconv.ast.Print;
import uniconv.ast.Program;

/**
 * Renders a plain script. There is no front end for this language.
 */
public final class JavaScriptPrinter extends BracePrinter {
	public JavaScriptPrinter() {
		this(FormatOptions.defaults());
	}

	public JavaScriptPrinter(FormatOptions options) {
		super(options);
	}

	@Override
	public String visitProgram(Program program, RenderContext ctx) {
		if (program.isEmpty()) {
			return "";
		}
		return blockBody(program.statements(), ctx);
	}

	@Override
	protected String functionHeader(Function function) {
		return "function " + function.name() + "(" + String.join(", ", function.params()) + ")";
	}

	@Override
	protected String declarationKeyword(Expr value) {
		return "let";
	}

	@Override
	protected String hoistedDeclaration(String name, Expr value) {
		return "let " + name + ";";
	}

	@Override
	protected String loopVariableKeyword() {
		return "let";
	}

	@Override
	protected String forEachHeader(String iterator, String iterable) {
		return "for (const " + iterator + " of " + iterable + ")";
	}

	@Override
	public String visitPrint(Print print, RenderContext ctx) {
		return ctx.indent() + "console.log(" + expression(print.expression(), ctx) + ");";
	}

	@Override
	public String visitPower(PowerNode power, RenderContext ctx) {
		return "Math.pow(" + expression(power.base(), ctx) + ", " + expression(power.exponent(), ctx) + ")";
	}
}
