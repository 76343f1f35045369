package uniconv;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	private final StringWriter out = new StringWriter();
	private final StringWriter err = new StringWriter();

	private int run(String... args) {
		CommandLine cmd = new CommandLine(new Main());
		cmd.setOut(new PrintWriter(out));
		cmd.setErr(new PrintWriter(err));
		return cmd.execute(args);
	}

	@Test
	void convertsFileToStandardOutput(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("hello.py");
		Files.writeString(input, "print(\"hello\")\n");

		int code = run("-f", "python", "-t", "java", "--class-name", "Hello", input.toString());

		assertEquals(0, code);
		String text = out.toString();
		assertTrue(text.startsWith("public class Hello {"), text);
		assertTrue(text.contains("System.out.println(\"hello\");"), text);
	}

	@Test
	void writesOutputFile(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("loop.cpp");
		Path output = dir.resolve("loop.py");
		Files.writeString(input, "for (int i = 0; i < 3; i++) {\n    cout << i;\n}\n");

		int code = run("--from", "cpp", "--to", "python", "--tabs", "-o", output.toString(), input.toString());

		assertEquals(0, code);
		assertEquals("for i in range(3):\n\tprint(i)", Files.readString(output).replace("\r\n", "\n"));
	}

	@Test
	void unknownLanguageExitsWithTwo(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("x.py");
		Files.writeString(input, "x = 1\n");

		assertEquals(Main.EXIT_UNSUPPORTED, run("-f", "cobol", "-t", "java", input.toString()));
		assertTrue(err.toString().contains("cobol"), err.toString());
		assertEquals("", out.toString());
	}

	@Test
	void javaScriptSourceExitsWithTwo(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("x.js");
		Files.writeString(input, "let x = 1;\n");

		assertEquals(Main.EXIT_UNSUPPORTED, run("-f", "javascript", "-t", "python", input.toString()));
	}

	@Test
	void strictParseFailureExitsWithOne(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("bad.py");
		Files.writeString(input, "x = 1\nclass Foo:\n");

		assertEquals(Main.EXIT_PARSE_ERROR, run("-f", "python", "-t", "cpp", "--strict", input.toString()));
		assertTrue(err.toString().contains("line 2"), err.toString());
	}

	@Test
	void directoryInputNeedsOutput(@TempDir Path dir) throws Exception {
		Files.writeString(dir.resolve("a.py"), "print(1)\n");

		assertEquals(CommandLine.ExitCode.USAGE, run("-f", "python", "-t", "cpp", dir.toString()));
	}

	@Test
	void convertsDirectory(@TempDir Path dir) throws Exception {
		Path src = dir.resolve("src");
		Path dst = dir.resolve("dst");
		Files.createDirectories(src);
		Files.writeString(src.resolve("a.py"), "print(1)\n");
		Files.writeString(src.resolve("b.py"), "print(2)\n");

		assertEquals(0, run("-f", "python", "-t", "cpp", "-o", dst.toString(), src.toString()));
		assertTrue(Files.exists(dst.resolve("a.cpp")));
		assertTrue(Files.exists(dst.resolve("b.cpp")));
		assertTrue(out.toString().contains("converted 2 file(s)"), out.toString());
	}

	@Test
	void indentOptionSetsWidth() {
		Main main = new Main();
		new CommandLine(main).parseArgs("-f", "python", "-t", "java", "--indent", "2");

		assertEquals("  ", main.options().format().indentUnit());
		assertEquals("ConvertedCode", main.options().format().className());
	}
}
