package uniconv.print;

import org.junit.jupiter.api.Test;
import uniconv.ast.Assignment;
import uniconv.ast.Comparison;
import uniconv.ast.CountedRange;
import uniconv.ast.ForLoop;
import uniconv.ast.Function;
import uniconv.ast.IterableRange;
import uniconv.ast.MathOp;
import uniconv.ast.NumberLiteral;
import uniconv.ast.PowerNode;
import uniconv.ast.Print;
import uniconv.ast.Program;
import uniconv.ast.Variable;
import uniconv.ast.WhileLoop;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class JavaScriptPrinterTest {
	private final JavaScriptPrinter printer = new JavaScriptPrinter(FormatOptions.defaults().withLineSeparator("\n"));

	@Test
	void rendersScript() {
		Variable t = new Variable("t");
		Program program = new Program(List.of(
				new Function("add", List.of("a", "b"),
						List.of(new Print(new MathOp("+", new Variable("a"), new Variable("b"))))),
				new Assignment(t, new NumberLiteral("0")),
				new ForLoop("i", new CountedRange(new NumberLiteral("0"), new NumberLiteral("5"), CountedRange.UNIT),
						List.of(new Assignment(t, new MathOp("+", t, new Variable("i"))))),
				new WhileLoop(new Comparison(">", t, new NumberLiteral("0")),
						List.of(new Assignment(t, new MathOp("+", t, new NumberLiteral("-1"))))),
				new ForLoop("x", new IterableRange(new Variable("xs")), List.of(new Print(new Variable("x")))),
				new Print(new PowerNode(new NumberLiteral("2"), new NumberLiteral("8")))));

		assertEquals(String.join("\n",
				"function add(a, b) {",
				"    console.log(a + b);",
				"}",
				"let t = 0;",
				"for (let i = 0; i < 5; i++) {",
				"    t = t + i;",
				"}",
				"while (t > 0) {",
				"    t = t + -1;",
				"}",
				"for (const x of xs) {",
				"    console.log(x);",
				"}",
				"console.log(Math.pow(2, 8));"), printer.render(program));
	}

	@Test
	void reusesDeclaredIterator() {
		Variable i = new Variable("i");
		Program program = new Program(List.of(
				new Assignment(i, new NumberLiteral("0")),
				new ForLoop("i", new CountedRange(i, new NumberLiteral("3"), CountedRange.UNIT), List.of())));

		assertEquals(String.join("\n",
				"let i = 0;",
				"for (i = i; i < 3; i++) {",
				"    // empty body",
				"}"), printer.render(program));
	}

	@Test
	void emptyProgramRendersNothing() {
		assertEquals("", printer.render(Program.empty()));
	}

	@Test
	void nestedLoopResultIsDeclaredInEnclosingLoop() {
		Variable total = new Variable("total");
		Program program = new Program(List.of(
				new Function("run", List.of("n"), List.of(
						new WhileLoop(new Comparison("<", new Variable("n"), new NumberLiteral("3")), List.of(
								new ForLoop("i", new IterableRange(new Variable("xs")),
										List.of(new Assignment(total, new Variable("i")))),
								new Print(total),
								new Assignment(new Variable("n"), new MathOp("+", new Variable("n"), new NumberLiteral("1")))))))));

		assertEquals(String.join("\n",
				"function run(n) {",
				"    while (n < 3) {",
				"        let total;",
				"        for (const i of xs) {",
				"            total = i;",
				"        }",
				"        console.log(total);",
				"        n = n + 1;",
				"    }",
				"}"), printer.render(program));
	}
}
