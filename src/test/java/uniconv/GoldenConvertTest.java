package uniconv;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class GoldenConvertTest {
	private final Converter converter = new Converter();

	@Test
	void convertsSamplePythonToJava() throws Exception {
		assertGolden("sample.py", Language.PYTHON, "sample.java", Language.JAVA);
	}

	@Test
	void convertsSamplePythonToCpp() throws Exception {
		assertGolden("sample.py", Language.PYTHON, "sample.cpp", Language.CPP);
	}

	@Test
	void convertsSamplePythonToJavaScript() throws Exception {
		assertGolden("sample.py", Language.PYTHON, "sample.js", Language.JAVASCRIPT);
	}

	@Test
	void convertsCppLoopsToPython() throws Exception {
		assertGolden("loops.cpp", Language.CPP, "loops.py", Language.PYTHON);
	}

	@Test
	void convertsCppLoopsToJava() throws Exception {
		assertGolden("loops.cpp", Language.CPP, "loops.java", Language.JAVA);
	}

	@Test
	void generatedJavaReadsBackToSameProgram() throws Exception {
		String expected = Files.readString(golden("sample.java"));

		String roundTrip = converter.convert(expected, Language.JAVA, Language.JAVA);

		assertEquals(normalize(expected), normalize(roundTrip));
	}

	@Test
	void generatedCppReadsBackToSameProgram() throws Exception {
		String expected = Files.readString(golden("sample.cpp"));

		String roundTrip = converter.convert(expected, Language.CPP, Language.CPP);

		assertEquals(normalize(expected), normalize(roundTrip));
	}

	private void assertGolden(String sourceName, Language source, String expectedName, Language target)
			throws Exception {
		String input = Files.readString(golden(sourceName));
		String expected = Files.readString(golden(expectedName));

		String actual = converter.convert(input, source, target);

		assertEquals(normalize(expected), normalize(actual));
	}

	private static Path golden(String name) {
		return Path.of("src", "test", "resources", "golden", name);
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
