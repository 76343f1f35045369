package uniconv.ast;

/**
 * Root of the intermediate representation shared by every parser and printer.
 *
 * The hierarchy is closed: every variant is a record listed in {@link Stmt} or
 * {@link Expr}, and every consumer handles all of them through
 * {@link NodeVisitor}.
 */
public sealed interface Node permits Program, Stmt, Expr {
	<R, C> R accept(NodeVisitor<R, C> visitor, C context);
}
