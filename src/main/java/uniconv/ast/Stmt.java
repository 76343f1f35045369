package uniconv.ast;

public sealed interface Stmt extends Node permits Function, Print, Assignment, ForLoop, WhileLoop, FunctionCall {
}
