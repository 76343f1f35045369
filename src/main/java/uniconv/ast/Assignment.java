package uniconv.ast;

public record Assignment(Variable target, Expr value) implements Stmt {
	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitAssignment(this, context);
	}
}
