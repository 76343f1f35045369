package uniconv.parse;

import java.util.List;

/**
 * Surface spelling of expressions in one source language.
 *
 * @param powerFunctions   call names that denote exponentiation, e.g.
 *                         {@code Math.pow}
 * @param infixPower       infix exponent operator such as {@code **}, or
 *                         {@code null} when the language has none
 * @param quotes           characters that open and close string literals
 * @param unescapeStrings  whether {@code \" \n \t \\} inside literals are
 *                         resolved; otherwise the interior is kept verbatim
 */
public record ExpressionSyntax(List<String> powerFunctions, String infixPower, String quotes,
		boolean unescapeStrings) {
	public ExpressionSyntax {
		powerFunctions = List.copyOf(powerFunctions);
	}
}
