package uniconv.ast;

public record PowerNode(Expr base, Expr exponent) implements Expr {
	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitPower(this, context);
	}
}
