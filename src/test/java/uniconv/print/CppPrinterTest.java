package uniconv.print;

import org.junit.jupiter.api.Test;
import uniconv.ast.Assignment;
import uniconv.ast.Comparison;
import uniconv.ast.Function;
import uniconv.ast.FunctionCall;
import uniconv.ast.IterableRange;
import uniconv.ast.ForLoop;
import uniconv.ast.MathOp;
import uniconv.ast.NumberLiteral;
import uniconv.ast.PowerNode;
import uniconv.ast.Print;
import uniconv.ast.Program;
import uniconv.ast.StringLiteral;
import uniconv.ast.Variable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CppPrinterTest {
	private final CppPrinter printer = new CppPrinter(FormatOptions.defaults().withLineSeparator("\n"));

	@Test
	void rendersFunctionsBeforeMain() {
		Variable k = new Variable("k");
		Program program = new Program(List.of(
				new Function("show", List.of("n"),
						List.of(new Print(new MathOp("+", new StringLiteral("n = "), new Variable("n"))))),
				new Assignment(new Variable("s"), new StringLiteral("hi")),
				new Assignment(k, new PowerNode(new NumberLiteral("2"), new NumberLiteral("3"))),
				new ForLoop("v", new IterableRange(new Variable("values")), List.of(new Print(new Variable("v")))),
				new FunctionCall("show", List.of(k)),
				new Function("twice", List.of("x"), List.of(new Print(new MathOp("+", new Variable("x"), new Variable("x")))))));

		assertEquals(String.join("\n",
				"#include <cmath>",
				"#include <iostream>",
				"#include <string>",
				"using namespace std;",
				"",
				"void show(int n) {",
				"    cout << \"n = \" << n << endl;",
				"}",
				"",
				"void twice(int x) {",
				"    cout << x + x << endl;",
				"}",
				"",
				"int main() {",
				"    string s = \"hi\";",
				"    auto k = pow(2, 3);",
				"    for (auto v : values) {",
				"        cout << v << endl;",
				"    }",
				"    show(k);",
				"    return 0;",
				"}"), printer.render(program));
	}

	@Test
	void programOfFunctionsHasNoMain() {
		Program program = new Program(List.of(new Function("noop", List.of(), List.of())));

		assertEquals(String.join("\n",
				"#include <cmath>",
				"#include <iostream>",
				"#include <string>",
				"using namespace std;",
				"",
				"void noop() {",
				"    // empty body",
				"}"), printer.render(program));
	}

	@Test
	void groupedSumIsStreamedAsOneOperand() {
		Program program = new Program(List.of(new Print(new MathOp("+", new StringLiteral("Sum: "),
				new MathOp("+", new Variable("a"), new Variable("b"))))));

		String rendered = printer.render(program);

		assertEquals("cout << \"Sum: \" << a + b << endl;", rendered.lines()
				.filter(line -> line.contains("cout"))
				.findFirst()
				.orElseThrow()
				.strip());
	}

	@Test
	void numericSumIsPrintedAsOneOperand() {
		Program program = new Program(List.of(
				new Print(new MathOp("+", new Variable("a"), new Variable("b"))),
				new Print(new Comparison("==", new Variable("a"), new Variable("b")))));

		String rendered = printer.render(program);

		assertEquals("cout << a + b << endl;\n    cout << (a == b) << endl;\n    return 0;\n}",
				rendered.substring(rendered.indexOf("cout")));
	}

	@Test
	void emptyProgramRendersNothing() {
		assertEquals("", printer.render(Program.empty()));
	}
}
