package uniconv.parse;

import uniconv.ast.CountedRange;
import uniconv.ast.Expr;
import uniconv.ast.IterableRange;
import uniconv.ast.MathOp;
import uniconv.ast.NumberLiteral;
import uniconv.ast.Variable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Common ground of the brace-and-semicolon front ends: {@code //} comments,
 * closing-brace lines, parameter declarations of the form {@code type name},
 * and the three-part counted for-loop header.
 *
 * Bodies are still delimited by indentation. A closing brace at the opener's
 * indentation ends the body; the brace line itself carries nothing.
 */
public abstract class BraceLineParser extends LineParser {
	private static final Pattern COUNTED_FOR = Pattern.compile(
			"for\\s*\\(\\s*(?:(?:int|long|short|unsigned|size_t|auto|var)\\s+)?(?<iterator>[A-Za-z_]\\w*)\\s*=\\s*(?<start>[^;]+?)\\s*;"
					+ "\\s*\\k<iterator>\\s*(?<cmp><=|>=|<|>)\\s*(?<end>[^;]+?)\\s*;"
					+ "\\s*(?:\\k<iterator>\\s*(?<postfix>\\+\\+|--)|(?<prefix>\\+\\+|--)\\s*\\k<iterator>"
					+ "|\\k<iterator>\\s*(?<compound>\\+=|-=)\\s*(?<amount>[^)]+?))\\s*\\)\\s*\\{(?<rest>.*)");

	protected BraceLineParser(ParseMode mode, ExpressionSyntax syntax) {
		super(mode, syntax);
	}

	/**
	 * Pattern of the for-each header, with groups {@code iterator},
	 * {@code iterable} and {@code rest}.
	 */
	protected abstract Pattern forEachPattern();

	@Override
	protected boolean isComment(String text) {
		return text.startsWith("//") || text.startsWith("/*") || text.startsWith("*");
	}

	@Override
	protected boolean isIgnorable(String text) {
		return text.equals("}") || text.equals("};");
	}

	@Override
	protected final boolean bracedBlocks() {
		return true;
	}

	@Override
	protected String parameterName(String declaration) {
		String[] words = declaration.strip().split("\\s+");
		String name = words[words.length - 1];
		return name.replaceAll("[&*\\[\\]]", "");
	}

	@Override
	protected LoopHeader matchForLoop(String text, int lineNumber) {
		Matcher m = COUNTED_FOR.matcher(text);
		if (m.matches()) {
			Expr start = expression(m.group("start"), lineNumber);
			Expr end = expression(m.group("end"), lineNumber);
			CountedRange range = normalize(start, m.group("cmp"), end, step(m, lineNumber));
			return new LoopHeader(m.group("iterator"), range, m.group("rest"));
		}
		Matcher each = forEachPattern().matcher(text);
		if (each.matches()) {
			return new LoopHeader(each.group("iterator"),
					new IterableRange(expression(each.group("iterable"), lineNumber)), each.group("rest"));
		}
		return null;
	}

	private Expr step(Matcher m, int lineNumber) {
		String unary = m.group("postfix") != null ? m.group("postfix") : m.group("prefix");
		if (unary != null) {
			return new NumberLiteral(unary.equals("++") ? "1" : "-1");
		}
		Expr amount = expression(m.group("amount"), lineNumber);
		return m.group("compound").equals("+=") ? amount : negate(amount, m.group("amount").strip());
	}

	/**
	 * Turns {@code start; i cmp end; step} into the half-open triple that
	 * visits the same values. Inclusive bounds move one unit past the end
	 * in the direction of travel.
	 */
	static CountedRange normalize(Expr start, String comparison, Expr end, Expr step) {
		return switch (comparison) {
			case "<=" -> new CountedRange(start, new MathOp("+", end, CountedRange.UNIT), step);
			case ">=" -> new CountedRange(start, new MathOp("-", end, CountedRange.UNIT), step);
			default -> new CountedRange(start, end, step);
		};
	}

	static Expr negate(Expr amount, String text) {
		if (amount instanceof NumberLiteral number) {
			return new NumberLiteral(number.isNegative() ? number.text().substring(1) : "-" + number.text());
		}
		if (amount instanceof Variable variable && !variable.name().startsWith("-")) {
			return new Variable("-" + variable.name());
		}
		return new Variable("-(" + text + ")");
	}
}
