package uniconv.ast;

public record StringLiteral(String value) implements Expr {
	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitStringLiteral(this, context);
	}
}
