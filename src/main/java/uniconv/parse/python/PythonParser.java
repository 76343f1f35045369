package uniconv.parse.python;

import uniconv.ast.CountedRange;
import uniconv.ast.Expr;
import uniconv.ast.IterableRange;
import uniconv.ast.LoopRange;
import uniconv.ast.NumberLiteral;
import uniconv.parse.ExpressionSyntax;
import uniconv.parse.LineParser;
import uniconv.parse.ParseMode;
import uniconv.parse.TextScanner;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Front end for the indentation language. Bodies follow a trailing {@code :}
 * and are delimited purely by indentation.
 */
public final class PythonParser extends LineParser {
	private static final String QUOTES = "\"'";
	private static final ExpressionSyntax SYNTAX = new ExpressionSyntax(List.of("pow", "math.pow"), "**", QUOTES,
			false);

	private static final Pattern ASSIGNMENT = Pattern.compile("(?<target>[A-Za-z_]\\w*)\\s*=(?!=)\\s*(?<value>.+)");
	private static final Pattern INCREMENT = Pattern.compile("(?<target>[A-Za-z_]\\w*)\\s*\\+=\\s*(?<value>.+)");
	private static final Pattern CALL = Pattern.compile("(?<name>[A-Za-z_]\\w*)\\s*\\((?<args>.*)\\)");
	private static final Pattern FUNCTION = Pattern.compile(
			"def\\s+(?<name>[A-Za-z_]\\w*)\\s*\\((?<params>[^)]*)\\)\\s*(?:->\\s*[^:]+)?:(?<rest>.*)");
	private static final Pattern FOR = Pattern.compile(
			"for\\s+(?<iterator>[A-Za-z_]\\w*)\\s+in\\s+(?<iterable>.+?)\\s*:(?<rest>.*)");
	private static final Pattern RANGE = Pattern.compile("range\\s*\\(");
	private static final Pattern WHILE = Pattern.compile("while\\s+(?<condition>.+?)\\s*:(?<rest>.*)");
	private static final Pattern PRINT = Pattern.compile("print\\s*\\((?<value>.*)\\)");

	private static final Set<String> RESERVED = Set.of("print", "if", "elif", "while", "for", "return", "def",
			"range", "pass");

	public PythonParser() {
		this(ParseMode.BEST_EFFORT);
	}

	public PythonParser(ParseMode mode) {
		super(mode, SYNTAX);
	}

	@Override
	protected boolean isComment(String text) {
		return text.startsWith("#");
	}

	@Override
	protected boolean isIgnorable(String text) {
		return text.equals("pass");
	}

	@Override
	protected boolean bracedBlocks() {
		return false;
	}

	@Override
	protected List<Pattern> containerPatterns() {
		return List.of();
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

	@Override
	protected Expr whileCondition(String condition, int lineNumber) {
		return expression(unwrapParentheses(condition.strip()), lineNumber);
	}

	@Override
	protected LoopHeader matchForLoop(String text, int lineNumber) {
		Matcher m = FOR.matcher(text);
		if (!m.matches()) {
			return null;
		}
		return new LoopHeader(m.group("iterator"), range(m.group("iterable").strip(), lineNumber), m.group("rest"));
	}

	/**
	 * {@code range(...)} with one to three arguments becomes the counted triple;
	 * anything else is iterated as is.
	 */
	private LoopRange range(String iterable, int lineNumber) {
		Matcher m = RANGE.matcher(iterable);
		if (m.lookingAt() && TextScanner.closingIndex(iterable, m.end() - 1, QUOTES) == iterable.length() - 1) {
			List<String> args = TextScanner.splitTopLevel(iterable.substring(m.end(), iterable.length() - 1), ',',
					QUOTES);
			switch (args.size()) {
				case 1:
					return new CountedRange(new NumberLiteral("0"), expression(args.get(0), lineNumber),
							CountedRange.UNIT);
				case 2:
					return new CountedRange(expression(args.get(0), lineNumber), expression(args.get(1), lineNumber),
							CountedRange.UNIT);
				case 3:
					return new CountedRange(expression(args.get(0), lineNumber), expression(args.get(1), lineNumber),
							expression(args.get(2), lineNumber));
				default:
					break;
			}
		}
		return new IterableRange(expression(iterable, lineNumber));
	}

	private static String unwrapParentheses(String text) {
		if (text.startsWith("(") && TextScanner.closingIndex(text, 0, QUOTES) == text.length() - 1) {
			return text.substring(1, text.length() - 1);
		}
		return text;
	}
}
