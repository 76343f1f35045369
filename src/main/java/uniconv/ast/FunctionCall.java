package uniconv.ast;

import java.util.List;

/**
 * Call of a named function. Appears both as a statement on its own line and
 * as an expression operand.
 */
public record FunctionCall(String name, List<Expr> args) implements Stmt, Expr {
	public FunctionCall {
		args = List.copyOf(args);
	}

	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitFunctionCall(this, context);
	}
}
