package uniconv.ast;

/**
 * Variable reference. Also used for expressions no parser rule recognized, in
 * which case {@code name} holds the raw source fragment.
 */
public record Variable(String name) implements Expr {
	@Override
	public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
		return visitor.visitVariable(this, context);
	}
}
