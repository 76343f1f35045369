package uniconv.print;

import uniconv.ast.Expr;
import uniconv.ast.Function;
import uniconv.ast.PowerNode;
import uniconv.ast.Print;
import uniconv.ast.Program;
import uniconv.ast.Stmt;
import uniconv.ast.StringLiteral;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the standard includes, then every top-level function in source
 * order, then an {@code int main()} holding the remaining top-level statements
 * in source order.
 */
public final class CppPrinter extends BracePrinter {
	private static final List<String> PRELUDE = List.of(
			"#include <cmath>",
			"#include <iostream>",
			"#include <string>",
			"using namespace std;");

	public CppPrinter() {
		this(FormatOptions.defaults());
	}

	public CppPrinter(FormatOptions options) {
		super(options);
	}

	@Override
	public String visitProgram(Program program, RenderContext ctx) {
		if (program.isEmpty()) {
			return "";
		}
		List<String> sections = new ArrayList<>();
		sections.add(String.join(ctx.nl(), PRELUDE));
		List<Stmt> loose = new ArrayList<>();
		for (Stmt stmt : program.statements()) {
			if (stmt instanceof Function function) {
				sections.add(visitFunction(function, ctx));
			} else {
				loose.add(stmt);
			}
		}
		if (!loose.isEmpty()) {
			RenderContext body = ctx.block();
			sections.add("int main() {" + ctx.nl()
					+ blockBody(loose, body) + ctx.nl()
					+ body.indent() + "return 0;" + ctx.nl()
					+ "}");
		}
		return String.join(ctx.nl() + ctx.nl(), sections);
	}

	@Override
	protected String functionHeader(Function function) {
		List<String> params = new ArrayList<>(function.params().size());
		for (String param : function.params()) {
			params.add(options().parameterType() + " " + param);
		}
		return "void " + function.name() + "(" + String.join(", ", params) + ")";
	}

	@Override
	protected String declarationKeyword(Expr value) {
		return value instanceof StringLiteral ? "string" : "auto";
	}

	@Override
	protected String hoistedDeclaration(String name, Expr value) {
		return zeroDeclaration(name, value, "string");
	}

	@Override
	protected String loopVariableKeyword() {
		return "int";
	}

	@Override
	protected String forEachHeader(String iterator, String iterable) {
		return "for (auto " + iterator + " : " + iterable + ")";
	}

	/**
	 * A concatenation with a string literal is streamed part by part, so no
	 * operand needs converting to a string first.
	 */
	@Override
	public String visitPrint(Print print, RenderContext ctx) {
		List<Expr> parts = concatenationParts(print.expression());
		if (!containsString(parts)) {
			parts = List.of(print.expression());
		}
		List<String> rendered = new ArrayList<>(parts.size());
		for (Expr part : parts) {
			rendered.add(operand(part, ctx));
		}
		return ctx.indent() + "cout << " + String.join(" << ", rendered) + " << endl;";
	}

	@Override
	public String visitPower(PowerNode power, RenderContext ctx) {
		return "pow(" + expression(power.base(), ctx) + ", " + expression(power.exponent(), ctx) + ")";
	}
}
