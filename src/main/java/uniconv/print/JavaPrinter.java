package uniconv.print;

import uniconv.ast.Expr;
import uniconv.ast.Function;
import uniconv.ast.PowerNode;
import uniconv.ast.Print;
import uniconv.ast.Program;
import uniconv.ast.Stmt;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a runnable class. Top-level functions become static methods, in
 * their original order, followed by a {@code main} method holding every other
 * top-level statement in its original order. How functions and loose
 * statements were interleaved in the source is not preserved.
 */
public final class JavaPrinter extends BracePrinter {
	public JavaPrinter() {
		this(FormatOptions.defaults());
	}

	public JavaPrinter(FormatOptions options) {
		super(options);
	}

	@Override
	public String visitProgram(Program program, RenderContext ctx) {
		RenderContext member = ctx.deeper();
		List<String> members = new ArrayList<>();
		List<Stmt> loose = new ArrayList<>();
		for (Stmt stmt : program.statements()) {
			if (stmt instanceof Function function) {
				members.add(visitFunction(function, member));
			} else {
				loose.add(stmt);
			}
		}
		if (!loose.isEmpty()) {
			members.add(member.indent() + "public static void main(String[] args) {" + ctx.nl()
					+ blockBody(loose, member.block()) + ctx.nl()
					+ member.indent() + "}");
		}

		StringBuilder out = new StringBuilder();
		out.append("public class ").append(options().className()).append(" {").append(ctx.nl());
		if (!members.isEmpty()) {
			out.append(String.join(ctx.nl() + ctx.nl(), members)).append(ctx.nl());
		}
		return out.append("}").toString();
	}

	@Override
	protected String functionHeader(Function function) {
		List<String> params = new ArrayList<>(function.params().size());
		for (String param : function.params()) {
			params.add(options().parameterType() + " " + param);
		}
		return "public static void " + function.name() + "(" + String.join(", ", params) + ")";
	}

	@Override
	protected String declarationKeyword(Expr value) {
		return "var";
	}

	@Override
	protected String hoistedDeclaration(String name, Expr value) {
		return zeroDeclaration(name, value, "String");
	}

	@Override
	protected String loopVariableKeyword() {
		return "int";
	}

	@Override
	protected String forEachHeader(String iterator, String iterable) {
		return "for (var " + iterator + " : " + iterable + ")";
	}

	@Override
	public String visitPrint(Print print, RenderContext ctx) {
		return ctx.indent() + "System.out.println(" + expression(print.expression(), ctx) + ");";
	}

	@Override
	public String visitPower(PowerNode power, RenderContext ctx) {
		return "Math.pow(" + expression(power.base(), ctx) + ", " + expression(power.exponent(), ctx) + ")";
	}
}
