package uniconv.ast;

/**
 * One method per IR variant. Implementations receive a caller-defined context
 * value instead of keeping traversal state in fields.
 */
public interface NodeVisitor<R, C> {
	R visitProgram(Program program, C context);

	R visitFunction(Function function, C context);

	R visitPrint(Print print, C context);

	R visitAssignment(Assignment assignment, C context);

	R visitForLoop(ForLoop loop, C context);

	R visitWhileLoop(WhileLoop loop, C context);

	R visitFunctionCall(FunctionCall call, C context);

	R visitMathOp(MathOp op, C context);

	R visitComparison(Comparison comparison, C context);

	R visitVariable(Variable variable, C context);

	R visitStringLiteral(StringLiteral literal, C context);

	R visitNumberLiteral(NumberLiteral literal, C context);

	R visitPower(PowerNode power, C context);
}
