package uniconv.parse;

import uniconv.ast.Program;

/**
 * Front end for one source language.
 */
public interface SourceParser {
	/**
	 * Parses source text into a fresh IR tree. Blank input yields an empty
	 * program.
	 */
	Program parse(String source);
}
