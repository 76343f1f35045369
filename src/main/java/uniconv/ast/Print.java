package uniconv.ast;

public record Print(Expr expression) implements Stmt {
	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitPrint(this, context);
	}
}
