package uniconv.parse.cpp;

import uniconv.ast.Expr;
import uniconv.ast.MathOp;
import uniconv.ast.StringLiteral;
import uniconv.parse.BraceLineParser;
import uniconv.parse.ExpressionSyntax;
import uniconv.parse.ParseMode;
import uniconv.parse.TextScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Front end for the C-style language. String literals have their escapes
 * resolved, and a chain of {@code <<} operands in an output statement is read
 * as one concatenation.
 */
public final class CppParser extends BraceLineParser {
	private static final String QUOTES = "\"";
	private static final ExpressionSyntax SYNTAX = new ExpressionSyntax(List.of("pow", "std::pow"), null, QUOTES,
			true);

	private static final String TYPES = "(?:int|long|short|unsigned|double|float|bool|char|auto|string|std::string)";

	private static final List<Pattern> CONTAINERS = List.of(
			Pattern.compile("int\\s+main\\s*\\([^)]*\\)\\s*\\{(?<rest>.*)"));
	private static final Pattern ASSIGNMENT = Pattern.compile(
			"(?:const\\s+)?(?:" + TYPES + "\\s+)?(?<target>[A-Za-z_]\\w*)\\s*=(?!=)\\s*(?<value>.+?)\\s*;?");
	private static final Pattern INCREMENT = Pattern.compile(
			"(?<target>[A-Za-z_]\\w*)\\s*(?:\\+=\\s*(?<value>.+?)|\\+\\+)\\s*;?");
	private static final Pattern CALL = Pattern.compile("(?<name>[A-Za-z_]\\w*)\\s*\\((?<args>.*)\\)\\s*;?");
	private static final Pattern FUNCTION = Pattern.compile("(?:(?:static|inline)\\s+)*(?:void|" + TYPES
			+ ")\\s+(?<name>[A-Za-z_]\\w*)\\s*\\((?<params>[^)]*)\\)\\s*\\{(?<rest>.*)");
	private static final Pattern FOR_EACH = Pattern.compile(
			"for\\s*\\(\\s*(?:const\\s+)?[\\w:<>]+\\s*[&*]?\\s*(?<iterator>[A-Za-z_]\\w*)\\s*:\\s*(?<iterable>.+?)\\s*\\)\\s*\\{(?<rest>.*)");
	private static final Pattern WHILE = Pattern.compile("while\\s*\\((?<condition>.*?)\\)\\s*\\{(?<rest>.*)");
	private static final Pattern PRINT = Pattern.compile("(?:std::)?cout\\s*<<\\s*(?<value>.+?)\\s*;?");

	private static final Set<String> RESERVED = Set.of("if", "while", "for", "switch", "return", "sizeof");
	private static final Set<String> LINE_ENDS = Set.of("endl", "std::endl");

	public CppParser() {
		this(ParseMode.BEST_EFFORT);
	}

	public CppParser(ParseMode mode) {
		super(mode, SYNTAX);
	}

	@Override
	protected boolean isIgnorable(String text) {
		return super.isIgnorable(text)
				|| text.startsWith("#")
				|| text.startsWith("using namespace")
				|| text.matches("return\\s+0\\s*;?");
	}

	/**
	 * {@code a << b << endl} prints the parts back to back, which is read as
	 * {@code a + b}. Each part is parsed on its own and the sum nests to the
	 * left, so {@code "s" << a + b} keeps {@code a + b} as one operand.
	 */
	@Override
	protected Expr printExpression(String value, int lineNumber) {
		Expr result = null;
		for (String part : splitShifts(value)) {
			if (LINE_ENDS.contains(part)) {
				continue;
			}
			Expr next = expression(part, lineNumber);
			result = result == null ? next : new MathOp("+", result, next);
		}
		return result == null ? new StringLiteral("") : result;
	}

	private static List<String> splitShifts(String value) {
		List<String> parts = new ArrayList<>();
		String remaining = value;
		int at = TextScanner.indexOfTopLevel(remaining, "<<", QUOTES);
		while (at >= 0) {
			parts.add(remaining.substring(0, at).strip());
			remaining = remaining.substring(at + 2);
			at = TextScanner.indexOfTopLevel(remaining, "<<", QUOTES);
		}
		parts.add(remaining.strip());
		return parts;
	}

	@Override
	protected List<Pattern> containerPatterns() {
		return CONTAINERS;
	}

	@Override
	protected Pattern assignmentPattern() {
		return ASSIGNMENT;
	}

	@Override
	protected Pattern incrementPattern() {
		return INCREMENT;
	}

	@Override
	protected Pattern callStatementPattern() {
		return CALL;
	}

	@Override
	protected Set<String> reservedNames() {
		return RESERVED;
	}

	@Override
	protected Pattern functionPattern() {
		return FUNCTION;
	}

	@Override
	protected Pattern forEachPattern() {
		return FOR_EACH;
	}

	@Override
	protected Pattern whilePattern() {
		return WHILE;
	}

	@Override
	protected Pattern printPattern() {
		return PRINT;
	}

	@Override
	protected String quotes() {
		return QUOTES;
	}
}
