package uniconv.ast;

import java.util.List;

public record Program(List<Stmt> statements) implements Node {
	public Program {
		statements = List.copyOf(statements);
	}

	public static Program empty() {
		return new Program(List.of());
	}

	public boolean isEmpty() {
		return statements.isEmpty();
	}

	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitProgram(this, context);
	}
}
