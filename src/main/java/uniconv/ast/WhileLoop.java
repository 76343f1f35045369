package uniconv.ast;

import java.util.List;

public record WhileLoop(Expr condition, List<Stmt> body) implements Stmt {
	public WhileLoop {
		body = List.copyOf(body);
	}

	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitWhileLoop(this, context);
	}
}
