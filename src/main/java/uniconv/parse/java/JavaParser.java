package uniconv.parse.java;

import uniconv.parse.BraceLineParser;
import uniconv.parse.ExpressionSyntax;
import uniconv.parse.ParseMode;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Front end for the brace language.
 *
 * A class header and the {@code main} method are transparent: the members and
 * statements they enclose are read as if written at the enclosing level.
 */
public final class JavaParser extends BraceLineParser {
	private static final String QUOTES = "\"'";
	private static final ExpressionSyntax SYNTAX = new ExpressionSyntax(List.of("Math.pow"), null, QUOTES, false);

	private static final String MODIFIERS = "(?:(?:public|private|protected|static|final|abstract)\\s+)*";
	private static final String TYPES = "(?:int|long|short|byte|double|float|boolean|char|String|var)(?:\\[\\])?";

	private static final List<Pattern> CONTAINERS = List.of(
			Pattern.compile(MODIFIERS + "class\\s+[A-Za-z_]\\w*[^{]*\\{(?<rest>.*)"),
			Pattern.compile(MODIFIERS + "void\\s+main\\s*\\([^)]*\\)\\s*\\{(?<rest>.*)"));
	private static final Pattern ASSIGNMENT = Pattern.compile(
			"(?:final\\s+)?(?:" + TYPES + "\\s+)?(?<target>[A-Za-z_]\\w*)\\s*=(?!=)\\s*(?<value>.+?)\\s*;?");
	private static final Pattern INCREMENT = Pattern.compile(
			"(?<target>[A-Za-z_]\\w*)\\s*(?:\\+=\\s*(?<value>.+?)|\\+\\+)\\s*;?");
	private static final Pattern CALL = Pattern.compile("(?<name>[A-Za-z_]\\w*)\\s*\\((?<args>.*)\\)\\s*;?");
	private static final Pattern FUNCTION = Pattern.compile(MODIFIERS
			+ "(?:void|" + TYPES + ")\\s+(?<name>[A-Za-z_]\\w*)\\s*\\((?<params>[^)]*)\\)\\s*\\{(?<rest>.*)");
	private static final Pattern FOR_EACH = Pattern.compile(
			"for\\s*\\(\\s*(?:final\\s+)?[\\w<>\\[\\],.?]+\\s+(?<iterator>[A-Za-z_]\\w*)\\s*:\\s*(?<iterable>.+?)\\s*\\)\\s*\\{(?<rest>.*)");
	private static final Pattern WHILE = Pattern.compile("while\\s*\\((?<condition>.*?)\\)\\s*\\{(?<rest>.*)");
	private static final Pattern PRINT = Pattern.compile("System\\.out\\.println\\s*\\((?<value>.*)\\)\\s*;?");

	private static final Set<String> RESERVED = Set.of("if", "while", "for", "switch", "return", "catch",
			"synchronized", "super", "this");

	public JavaParser() {
		this(ParseMode.BEST_EFFORT);
	}

	public JavaParser(ParseMode mode) {
		super(mode, SYNTAX);
	}

	@Override
	protected boolean isIgnorable(String text) {
		return super.isIgnorable(text) || text.startsWith("package ") || text.startsWith("import ");
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
