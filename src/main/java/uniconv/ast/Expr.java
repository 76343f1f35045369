package uniconv.ast;

public sealed interface Expr extends Node
		permits MathOp, Comparison, Variable, StringLiteral, NumberLiteral, PowerNode, FunctionCall {
}
