package uniconv.ast;

import java.util.List;

/**
 * Function definition. Parameters are bare names; no types are carried.
 */
public record Function(String name, List<String> params, List<Stmt> body) implements Stmt {
	public Function {
		params = List.copyOf(params);
		body = List.copyOf(body);
	}

	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitFunction(this, context);
	}
}
