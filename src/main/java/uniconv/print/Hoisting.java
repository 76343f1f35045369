package uniconv.print;

import uniconv.ast.Assignment;
import uniconv.ast.Comparison;
import uniconv.ast.Expr;
import uniconv.ast.ForLoop;
import uniconv.ast.Function;
import uniconv.ast.FunctionCall;
import uniconv.ast.MathOp;
import uniconv.ast.NodeVisitor;
import uniconv.ast.NumberLiteral;
import uniconv.ast.PowerNode;
import uniconv.ast.Print;
import uniconv.ast.Program;
import uniconv.ast.Stmt;
import uniconv.ast.StringLiteral;
import uniconv.ast.Variable;
import uniconv.ast.WhileLoop;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the locals a brace target has to declare ahead of a loop: names first
 * assigned inside the loop body and still read after the loop.
 */
final class Hoisting {
	private Hoisting() {
		// utility class
	}

	/**
	 * First value assigned to each name inside the bodies of {@code loop},
	 * in source order. Function definitions are not entered.
	 */
	static Map<String, Expr> firstAssignments(Stmt loop) {
		Map<String, Expr> first = new LinkedHashMap<>();
		if (loop instanceof ForLoop forLoop) {
			collectAssignments(forLoop.body(), first);
		} else if (loop instanceof WhileLoop whileLoop) {
			collectAssignments(whileLoop.body(), first);
		}
		return first;
	}

	private static void collectAssignments(List<Stmt> body, Map<String, Expr> first) {
		for (Stmt stmt : body) {
			if (stmt instanceof Assignment assignment) {
				first.putIfAbsent(assignment.target().name(), assignment.value());
			} else if (stmt instanceof ForLoop || stmt instanceof WhileLoop) {
				firstAssignments(stmt).forEach(first::putIfAbsent);
			}
		}
	}

	/**
	 * Names read by {@code stmts}. Assignment targets count only where the
	 * assigned value reads them; function bodies are skipped.
	 */
	static Set<String> readNames(List<Stmt> stmts) {
		Set<String> names = new HashSet<>();
		for (Stmt stmt : stmts) {
			stmt.accept(ReadNames.INSTANCE, names);
		}
		return names;
	}

	private static final class ReadNames implements NodeVisitor<Void, Set<String>> {
		static final ReadNames INSTANCE = new ReadNames();

		@Override
		public Void visitProgram(Program program, Set<String> names) {
			for (Stmt stmt : program.statements()) {
				stmt.accept(this, names);
			}
			return null;
		}

		@Override
		public Void visitFunction(Function function, Set<String> names) {
			return null;
		}

		@Override
		public Void visitPrint(Print print, Set<String> names) {
			return print.expression().accept(this, names);
		}

		@Override
		public Void visitAssignment(Assignment assignment, Set<String> names) {
			return assignment.value().accept(this, names);
		}

		@Override
		public Void visitForLoop(ForLoop loop, Set<String> names) {
			loop.range().fold(
					counted -> {
						counted.start().accept(this, names);
						counted.end().accept(this, names);
						return counted.step().accept(this, names);
					},
					each -> each.iterable().accept(this, names));
			names.addAll(readNames(loop.body()));
			return null;
		}

		@Override
		public Void visitWhileLoop(WhileLoop loop, Set<String> names) {
			loop.condition().accept(this, names);
			names.addAll(readNames(loop.body()));
			return null;
		}

		@Override
		public Void visitFunctionCall(FunctionCall call, Set<String> names) {
			for (Expr arg : call.args()) {
				arg.accept(this, names);
			}
			return null;
		}

		@Override
		public Void visitMathOp(MathOp op, Set<String> names) {
			op.left().accept(this, names);
			return op.right().accept(this, names);
		}

		@Override
		public Void visitComparison(Comparison comparison, Set<String> names) {
			comparison.left().accept(this, names);
			return comparison.right().accept(this, names);
		}

		@Override
		public Void visitVariable(Variable variable, Set<String> names) {
			names.add(variable.name());
			return null;
		}

		@Override
		public Void visitStringLiteral(StringLiteral literal, Set<String> names) {
			return null;
		}

		@Override
		public Void visitNumberLiteral(NumberLiteral literal, Set<String> names) {
			return null;
		}

		@Override
		public Void visitPower(PowerNode power, Set<String> names) {
			power.base().accept(this, names);
			return power.exponent().accept(this, names);
		}
	}
}
