package uniconv.ast;

/**
 * Numeric literal kept as source text. Nothing in the pipeline evaluates it.
 */
public record NumberLiteral(String text) implements Expr {
	public boolean isNegative() {
		return text.startsWith("-");
	}

	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitNumberLiteral(this, context);
	}
}
