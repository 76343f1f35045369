package uniconv.parse;

import uniconv.ast.Comparison;
import uniconv.ast.Expr;
import uniconv.ast.FunctionCall;
import uniconv.ast.MathOp;
import uniconv.ast.NumberLiteral;
import uniconv.ast.PowerNode;
import uniconv.ast.StringLiteral;
import uniconv.ast.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies an expression fragment. Rules are tried in a fixed order:
 * grouping parentheses, comparison, power call, addition, string, number,
 * identifier, call, and finally the raw-text variable fallback.
 *
 * There is no precedence beyond that order: a comparison splits before an
 * addition. An addition splits on its last top-level occurrence, so
 * {@code a + b + c} reads as {@code (a + b) + c}, the way every supported
 * language evaluates it.
 */
public final class ExpressionParser {
	private static final Logger LOG = Logger.getLogger(ExpressionParser.class.getName());

	private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");
	private static final Pattern CALL = Pattern.compile("(?<name>[A-Za-z_][\\w.:]*)\\s*\\(");

	private final ExpressionSyntax syntax;
	private final ParseMode mode;

	public ExpressionParser(ExpressionSyntax syntax, ParseMode mode) {
		this.syntax = syntax;
		this.mode = mode;
	}

	public Expr parse(String fragment, int lineNumber) {
		String text = fragment.strip();

		if (isGrouped(text)) {
			return parse(text.substring(1, text.length() - 1), lineNumber);
		}

		for (String op : Comparison.OPERATORS) {
			String token = " " + op + " ";
			int at = TextScanner.indexOutsideQuotes(text, token, syntax.quotes());
			if (at >= 0) {
				return new Comparison(op,
						parse(text.substring(0, at), lineNumber),
						parse(text.substring(at + token.length()), lineNumber));
			}
		}

		PowerNode power = parsePowerCall(text, lineNumber);
		if (power != null) {
			return power;
		}

		int plus = TextScanner.lastIndexOfTopLevel(text, " + ", syntax.quotes());
		if (plus >= 0) {
			return new MathOp("+",
					parse(text.substring(0, plus), lineNumber),
					parse(text.substring(plus + 3), lineNumber));
		}

		if (syntax.infixPower() != null) {
			String token = " " + syntax.infixPower() + " ";
			int at = TextScanner.indexOfTopLevel(text, token, syntax.quotes());
			if (at >= 0) {
				return new PowerNode(
						parse(text.substring(0, at), lineNumber),
						parse(text.substring(at + token.length()), lineNumber));
			}
		}

		if (TextScanner.isSingleLiteral(text, syntax.quotes())) {
			String interior = text.substring(1, text.length() - 1);
			return new StringLiteral(syntax.unescapeStrings() ? unescape(interior) : interior);
		}

		if (NUMBER.matcher(text).matches()) {
			return new NumberLiteral(text);
		}

		if (IDENTIFIER.matcher(text).matches()) {
			return new Variable(text);
		}

		FunctionCall call = parseCall(text, lineNumber);
		if (call != null) {
			return call;
		}

		if (mode == ParseMode.STRICT) {
			throw new SourceParseException("unrecognized expression", lineNumber, text);
		}
		LOG.fine(() -> "line " + lineNumber + ": keeping unrecognized expression as raw text: " + text);
		return new Variable(text);
	}

	/**
	 * Parses a comma separated argument list.
	 */
	public List<Expr> parseArguments(String text, int lineNumber) {
		List<Expr> args = new ArrayList<>();
		for (String arg : TextScanner.splitTopLevel(text, ',', syntax.quotes())) {
			args.add(parse(arg, lineNumber));
		}
		return args;
	}

	private boolean isGrouped(String text) {
		return text.startsWith("(") && TextScanner.closingIndex(text, 0, syntax.quotes()) == text.length() - 1;
	}

	private PowerNode parsePowerCall(String text, int lineNumber) {
		String inner = callArguments(text);
		if (inner == null || !syntax.powerFunctions().contains(calleeName(text))) {
			return null;
		}
		List<String> args = TextScanner.splitTopLevel(inner, ',', syntax.quotes());
		if (args.size() != 2) {
			return null;
		}
		return new PowerNode(parse(args.get(0), lineNumber), parse(args.get(1), lineNumber));
	}

	private FunctionCall parseCall(String text, int lineNumber) {
		String inner = callArguments(text);
		if (inner == null) {
			return null;
		}
		return new FunctionCall(calleeName(text), parseArguments(inner, lineNumber));
	}

	/**
	 * @return the text between the parentheses when {@code text} is a single
	 *         call {@code name(...)}, otherwise null
	 */
	private String callArguments(String text) {
		Matcher m = CALL.matcher(text);
		if (!m.lookingAt()) {
			return null;
		}
		int open = m.end() - 1;
		if (TextScanner.closingIndex(text, open, syntax.quotes()) != text.length() - 1) {
			return null;
		}
		return text.substring(open + 1, text.length() - 1);
	}

	private static String calleeName(String text) {
		return text.substring(0, text.indexOf('(')).strip();
	}

	static String unescape(String interior) {
		StringBuilder out = new StringBuilder(interior.length());
		for (int i = 0; i < interior.length(); i++) {
			char c = interior.charAt(i);
			if (c != '\\' || i + 1 == interior.length()) {
				out.append(c);
				continue;
			}
			char next = interior.charAt(++i);
			switch (next) {
				case '"' -> out.append('"');
				case 'n' -> out.append('\n');
				case 't' -> out.append('\t');
				case '\\' -> out.append('\\');
				default -> out.append('\\').append(next);
			}
		}
		return out.toString();
	}
}
