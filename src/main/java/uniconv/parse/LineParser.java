package uniconv.parse;

import uniconv.ast.Assignment;
import uniconv.ast.Expr;
import uniconv.ast.ForLoop;
import uniconv.ast.Function;
import uniconv.ast.FunctionCall;
import uniconv.ast.LoopRange;
import uniconv.ast.MathOp;
import uniconv.ast.NumberLiteral;
import uniconv.ast.Print;
import uniconv.ast.Program;
import uniconv.ast.Stmt;
import uniconv.ast.StringLiteral;
import uniconv.ast.Variable;
import uniconv.ast.WhileLoop;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented front end shared by all source languages.
 *
 * Each non-blank, non-comment line is tried against the statement rules in a
 * fixed order: transparent container, assignment, call statement, function
 * definition, for loop, while loop, print. Statements sharing a line are
 * separated by top-level semicolons. A line that opens a body owns every
 * following line indented deeper than itself; the body ends at the first
 * non-blank line indented the same or less. All nesting levels advance one
 * shared {@link LineCursor}.
 *
 * Subclasses supply the surface patterns. Named groups used by the rules:
 * <ul>
 * <li>assignment: {@code target}, {@code value}</li>
 * <li>increment: {@code target}, optional {@code value} (absent for
 * {@code ++})</li>
 * <li>call statement: {@code name}, {@code args}</li>
 * <li>function: {@code name}, {@code params}, {@code rest}</li>
 * <li>while: {@code condition}, {@code rest}</li>
 * <li>print: {@code value}</li>
 * <li>container: {@code rest}</li>
 * </ul>
 * {@code rest} is whatever follows the block opener on the same line and is
 * parsed as the first statements of the body.
 */
public abstract class LineParser implements SourceParser {
	private static final Logger LOG = Logger.getLogger(LineParser.class.getName());

	private final ParseMode mode;
	private final ExpressionParser expressions;

	protected LineParser(ParseMode mode, ExpressionSyntax syntax) {
		this.mode = mode;
		this.expressions = new ExpressionParser(syntax, mode);
	}

	@Override
	public final Program parse(String source) {
		LineCursor cursor = LineCursor.of(source);
		List<Stmt> statements = new ArrayList<>();
		parseBlock(cursor, -1, statements);
		return new Program(statements);
	}

	protected abstract boolean isComment(String text);

	/**
	 * Lines that carry no statement of their own, such as closing braces.
	 */
	protected abstract boolean isIgnorable(String text);

	/**
	 * Whether a trailing {@code }} on an opener line closes the body inline.
	 */
	protected abstract boolean bracedBlocks();

	protected abstract List<Pattern> containerPatterns();

	protected abstract Pattern assignmentPattern();

	protected abstract Pattern incrementPattern();

	protected abstract Pattern callStatementPattern();

	/**
	 * Names never treated as a call statement, e.g. control keywords.
	 */
	protected abstract Set<String> reservedNames();

	protected abstract Pattern functionPattern();

	protected abstract Pattern whilePattern();

	protected abstract Pattern printPattern();

	protected abstract String quotes();

	/**
	 * @return the loop header on this line, or null when it is not a for loop
	 */
	protected abstract LoopHeader matchForLoop(String text, int lineNumber);

	/**
	 * Extracts the parameter name from one declared parameter.
	 */
	protected String parameterName(String declaration) {
		return declaration.strip();
	}

	protected Expr printExpression(String value, int lineNumber) {
		if (value.isBlank()) {
			return new StringLiteral("");
		}
		return expression(value, lineNumber);
	}

	protected Expr whileCondition(String condition, int lineNumber) {
		return expression(condition, lineNumber);
	}

	protected final Expr expression(String text, int lineNumber) {
		return expressions.parse(text, lineNumber);
	}

	protected final List<Expr> arguments(String text, int lineNumber) {
		return expressions.parseArguments(text, lineNumber);
	}

	private void parseBlock(LineCursor cursor, int parentIndent, List<Stmt> out) {
		while (cursor.hasNext()) {
			SourceLine line = cursor.peek();
			if (line.isBlank()) {
				cursor.next();
				continue;
			}
			if (line.indent() <= parentIndent) {
				return;
			}
			cursor.next();
			if (isComment(line.text())) {
				continue;
			}
			// only the last statement on a line may open a body that continues below
			List<String> parts = TextScanner.splitTopLevel(line.text(), ';', quotes());
			for (int i = 0; i < parts.size(); i++) {
				parseText(line, parts.get(i), i == parts.size() - 1 ? cursor : LineCursor.EMPTY, out);
			}
		}
	}

	private void parseText(SourceLine line, String text, LineCursor cursor, List<Stmt> out) {
		if (text.isEmpty() || isComment(text) || isIgnorable(text)) {
			return;
		}
		boolean matched = parseContainer(line, text, cursor, out)
				|| parseAssignment(line, text, out)
				|| parseCallStatement(line, text, out)
				|| parseFunction(line, text, cursor, out)
				|| parseForLoop(line, text, cursor, out)
				|| parseWhileLoop(line, text, cursor, out)
				|| parsePrint(line, text, out);
		if (matched) {
			return;
		}
		if (mode == ParseMode.STRICT) {
			throw new SourceParseException("unrecognized statement", line.number(), text);
		}
		LOG.fine(() -> "dropping unrecognized line " + line.number() + ": " + text);
	}

	private boolean parseContainer(SourceLine line, String text, LineCursor cursor, List<Stmt> out) {
		for (Pattern pattern : containerPatterns()) {
			Matcher m = pattern.matcher(text);
			if (m.matches()) {
				out.addAll(parseBody(line, m.group("rest"), cursor));
				return true;
			}
		}
		return false;
	}

	private boolean parseAssignment(SourceLine line, String text, List<Stmt> out) {
		Matcher m = assignmentPattern().matcher(text);
		if (m.matches()) {
			out.add(new Assignment(new Variable(m.group("target")), expression(m.group("value"), line.number())));
			return true;
		}
		m = incrementPattern().matcher(text);
		if (m.matches()) {
			Variable target = new Variable(m.group("target"));
			String amount = m.group("value");
			Expr step = amount == null ? new NumberLiteral("1") : expression(amount, line.number());
			out.add(new Assignment(target, new MathOp("+", target, step)));
			return true;
		}
		return false;
	}

	private boolean parseCallStatement(SourceLine line, String text, List<Stmt> out) {
		Matcher m = callStatementPattern().matcher(text);
		if (!m.matches() || reservedNames().contains(m.group("name"))) {
			return false;
		}
		int open = text.indexOf('(');
		if (TextScanner.closingIndex(text, open, quotes()) != m.end("args")) {
			return false;
		}
		out.add(new FunctionCall(m.group("name"), arguments(m.group("args"), line.number())));
		return true;
	}

	private boolean parseFunction(SourceLine line, String text, LineCursor cursor, List<Stmt> out) {
		Matcher m = functionPattern().matcher(text);
		if (!m.matches()) {
			return false;
		}
		List<String> params = new ArrayList<>();
		for (String param : TextScanner.splitTopLevel(m.group("params"), ',', quotes())) {
			params.add(parameterName(param));
		}
		out.add(new Function(m.group("name"), params, parseBody(line, m.group("rest"), cursor)));
		return true;
	}

	private boolean parseForLoop(SourceLine line, String text, LineCursor cursor, List<Stmt> out) {
		LoopHeader header = matchForLoop(text, line.number());
		if (header == null) {
			return false;
		}
		out.add(new ForLoop(header.iterator(), header.range(), parseBody(line, header.rest(), cursor)));
		return true;
	}

	private boolean parseWhileLoop(SourceLine line, String text, LineCursor cursor, List<Stmt> out) {
		Matcher m = whilePattern().matcher(text);
		if (!m.matches()) {
			return false;
		}
		Expr condition = whileCondition(m.group("condition"), line.number());
		out.add(new WhileLoop(condition, parseBody(line, m.group("rest"), cursor)));
		return true;
	}

	private boolean parsePrint(SourceLine line, String text, List<Stmt> out) {
		Matcher m = printPattern().matcher(text);
		if (!m.matches()) {
			return false;
		}
		out.add(new Print(printExpression(m.group("value"), line.number())));
		return true;
	}

	/**
	 * Body of an opener: statements written after it on the same line, then the
	 * indented block below it unless the inline part already closed the body.
	 */
	private List<Stmt> parseBody(SourceLine opener, String rest, LineCursor cursor) {
		List<Stmt> body = new ArrayList<>();
		String inline = rest == null ? "" : rest.strip();
		boolean closed = false;
		if (bracedBlocks() && inline.endsWith("}")) {
			inline = inline.substring(0, inline.length() - 1);
			closed = true;
		}
		for (String part : TextScanner.splitTopLevel(inline, ';', quotes())) {
			parseText(opener, part, LineCursor.EMPTY, body);
		}
		if (!closed) {
			parseBlock(cursor, opener.indent(), body);
		}
		return body;
	}

	/**
	 * A recognized for-loop opener.
	 *
	 * @param rest text after the block opener on the same line
	 */
	public record LoopHeader(String iterator, LoopRange range, String rest) {
	}
}
