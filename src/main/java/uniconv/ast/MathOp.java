package uniconv.ast;

/**
 * Binary arithmetic. Parsers only ever build {@code +}; counted-loop
 * normalization may also build {@code -} for an inclusive descending bound.
 */
public record MathOp(String operator, Expr left, Expr right) implements Expr {
	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitMathOp(this, context);
	}
}
