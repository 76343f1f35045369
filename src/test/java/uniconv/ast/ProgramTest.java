package uniconv.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProgramTest {
	@Test
	void copiesStatementListOnConstruction() {
		List<Stmt> statements = new ArrayList<>();
		statements.add(new Print(new Variable("x")));
		Program program = new Program(statements);

		statements.add(new Print(new Variable("y")));

		assertEquals(1, program.statements().size());
		assertThrows(UnsupportedOperationException.class,
				() -> program.statements().add(new Print(new Variable("z"))));
	}

	@Test
	void bodiesAreImmutable() {
		List<Stmt> body = new ArrayList<>();
		body.add(new Print(new NumberLiteral("1")));
		Function function = new Function("f", List.of("a"), body);
		WhileLoop loop = new WhileLoop(new Variable("go"), body);
		body.clear();

		assertEquals(1, function.body().size());
		assertEquals(1, loop.body().size());
	}

	@Test
	void countedRangeReadsStepDirection() {
		CountedRange up = new CountedRange(new NumberLiteral("0"), new NumberLiteral("5"), CountedRange.UNIT);
		CountedRange down = new CountedRange(new NumberLiteral("5"), new NumberLiteral("0"), new NumberLiteral("-2"));
		CountedRange byVariable = new CountedRange(new NumberLiteral("0"), new Variable("n"), new Variable("-k"));

		assertFalse(up.descending());
		assertTrue(up.unitStep());
		assertTrue(down.descending());
		assertFalse(down.unitStep());
		assertEquals("2", down.stepMagnitude());
		assertTrue(byVariable.descending());
		assertEquals("k", byVariable.stepMagnitude());
	}

	@Test
	void visitorDispatchesOnVariant() {
		NodeVisitor<String, Void> names = new NameVisitor();

		assertEquals("program", Program.empty().accept(names, null));
		assertEquals("call", new FunctionCall("f", List.of()).accept(names, null));
		assertEquals("power", new PowerNode(new NumberLiteral("2"), new NumberLiteral("3")).accept(names, null));
	}

	private static final class NameVisitor implements NodeVisitor<String, Void> {
		@Override
		public String visitProgram(Program program, Void context) {
			return "program";
		}

		@Override
		public String visitFunction(Function function, Void context) {
			return "function";
		}

		@Override
		public String visitPrint(Print print, Void context) {
			return "print";
		}

		@Override
		public String visitAssignment(Assignment assignment, Void context) {
			return "assignment";
		}

		@Override
		public String visitForLoop(ForLoop loop, Void context) {
			return "for";
		}

		@Override
		public String visitWhileLoop(WhileLoop loop, Void context) {
			return "while";
		}

		@Override
		public String visitFunctionCall(FunctionCall call, Void context) {
			return "call";
		}

		@Override
		public String visitMathOp(MathOp op, Void context) {
			return "math";
		}

		@Override
		public String visitComparison(Comparison comparison, Void context) {
			return "comparison";
		}

		@Override
		public String visitVariable(Variable variable, Void context) {
			return "variable";
		}

		@Override
		public String visitStringLiteral(StringLiteral literal, Void context) {
			return "string";
		}

		@Override
		public String visitNumberLiteral(NumberLiteral literal, Void context) {
			return "number";
		}

		@Override
		public String visitPower(PowerNode power, Void context) {
			return "power";
		}
	}
}
