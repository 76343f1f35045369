package uniconv.ast;

import java.util.List;

public record ForLoop(String iterator, LoopRange range, List<Stmt> body) implements Stmt {
	public ForLoop {
		body = List.copyOf(body);
	}

	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitForLoop(this, context);
	}
}
