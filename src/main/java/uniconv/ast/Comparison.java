package uniconv.ast;

import java.util.List;

public record Comparison(String operator, Expr left, Expr right) implements Expr {
	/**
	 * Operators in the order the expression parsers try them.
	 */
	public static final List<String> OPERATORS = List.of("==", "!=", "<=", ">=", "<", ">");

	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitComparison(this, context);
	}
}
