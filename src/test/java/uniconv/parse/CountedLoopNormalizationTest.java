package uniconv.parse;

import org.junit.jupiter.api.Test;
import uniconv.ast.CountedRange;
import uniconv.ast.Expr;
import uniconv.ast.ForLoop;
import uniconv.ast.MathOp;
import uniconv.ast.NumberLiteral;
import uniconv.ast.Program;
import uniconv.ast.Variable;
import uniconv.parse.cpp.CppParser;
import uniconv.parse.java.JavaParser;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Checks that a counted loop header and its canonical triple visit the same
 * values, by running both on integer bounds.
 */
public class CountedLoopNormalizationTest {
	private static final List<String> COMPARISONS = List.of("<", "<=", ">", ">=");
	private static final int[][] BOUNDS = {{0, 5}, {0, 6}, {5, 0}, {6, 0}, {-3, 4}, {4, -3}, {2, 2}};

	@Test
	void tripleVisitsSameValuesAsHeader() {
		int checked = 0;
		for (String cmp : COMPARISONS) {
			boolean ascending = cmp.startsWith("<");
			for (Update update : ascending ? ascendingUpdates() : descendingUpdates()) {
				for (int[] bound : BOUNDS) {
					String header = "for (int i = " + bound[0] + "; i " + cmp + " " + bound[1] + "; " + update.text
							+ ") {";
					List<Integer> expected = runHeader(bound[0], cmp, bound[1], update.step);

					assertEquals(expected, runTriple(parseCpp(header)), header);
					assertEquals(expected, runTriple(parseJava(header)), header);
					checked++;
				}
			}
		}
		assertTrue(checked > 100);
	}

	@Test
	void normalizesEachComparison() {
		Expr start = new NumberLiteral("0");
		Expr end = new Variable("n");
		Expr step = CountedRange.UNIT;

		assertEquals(new CountedRange(start, end, step), BraceLineParser.normalize(start, "<", end, step));
		assertEquals(new CountedRange(start, new MathOp("+", end, CountedRange.UNIT), step),
				BraceLineParser.normalize(start, "<=", end, step));
		assertEquals(new CountedRange(start, end, step), BraceLineParser.normalize(start, ">", end, step));
		assertEquals(new CountedRange(start, new MathOp("-", end, CountedRange.UNIT), step),
				BraceLineParser.normalize(start, ">=", end, step));
	}

	@Test
	void negatesStepAmount() {
		assertEquals(new NumberLiteral("-2"), BraceLineParser.negate(new NumberLiteral("2"), "2"));
		assertEquals(new NumberLiteral("2"), BraceLineParser.negate(new NumberLiteral("-2"), "-2"));
		assertEquals(new Variable("-k"), BraceLineParser.negate(new Variable("k"), "k"));
		assertEquals(new Variable("-(a + b)"),
				BraceLineParser.negate(new MathOp("+", new Variable("a"), new Variable("b")), "a + b"));
	}

	@Test
	void headerWithoutDeclarationKeepsIterator() {
		ForLoop loop = assertInstanceOf(ForLoop.class,
				new JavaParser().parse("for (j = n; j > 0; --j) {\n}").statements().get(0));

		assertEquals("j", loop.iterator());
		assertEquals(new CountedRange(new Variable("n"), new NumberLiteral("0"), new NumberLiteral("-1")),
				loop.range());
	}

	private static List<Update> ascendingUpdates() {
		return List.of(new Update("i++", 1), new Update("++i", 1), new Update("i += 2", 2), new Update("i += 3", 3));
	}

	private static List<Update> descendingUpdates() {
		return List.of(new Update("i--", -1), new Update("--i", -1), new Update("i -= 2", -2),
				new Update("i -= 3", -3));
	}

	private static CountedRange parseCpp(String header) {
		return rangeOf(new CppParser().parse(header + "\n    cout << i;\n}"));
	}

	private static CountedRange parseJava(String header) {
		return rangeOf(new JavaParser().parse(header + "\n    System.out.println(i);\n}"));
	}

	private static CountedRange rangeOf(Program program) {
		ForLoop loop = assertInstanceOf(ForLoop.class, program.statements().get(0));
		return assertInstanceOf(CountedRange.class, loop.range());
	}

	private static List<Integer> runHeader(int start, String cmp, int end, int step) {
		List<Integer> visited = new ArrayList<>();
		for (int i = start; holds(i, cmp, end); i += step) {
			visited.add(i);
		}
		return visited;
	}

	private static boolean holds(int i, String cmp, int end) {
		switch (cmp) {
			case "<":
				return i < end;
			case "<=":
				return i <= end;
			case ">":
				return i > end;
			default:
				return i >= end;
		}
	}

	private static List<Integer> runTriple(CountedRange range) {
		int start = eval(range.start());
		int end = eval(range.end());
		int step = eval(range.step());
		List<Integer> visited = new ArrayList<>();
		for (int i = start; step > 0 ? i < end : i > end; i += step) {
			visited.add(i);
		}
		return visited;
	}

	private static int eval(Expr expr) {
		if (expr instanceof NumberLiteral number) {
			return Integer.parseInt(number.text());
		}
		MathOp op = assertInstanceOf(MathOp.class, expr);
		int left = eval(op.left());
		int right = eval(op.right());
		return op.operator().equals("+") ? left + right : left - right;
	}

	private record Update(String text, int step) {
	}
}
