package uniconv.print;

/**
 * Output formatting shared by all printers.
 *
 * @param indentUnit    text for one level of nesting
 * @param lineSeparator text between output lines
 * @param className     name of the class wrapping generated Java
 * @param parameterType declared type of function parameters in typed targets
 */
public record FormatOptions(String indentUnit, String lineSeparator, String className, String parameterType) {
	public static FormatOptions defaults() {
		return new FormatOptions("    ", System.lineSeparator(), "ConvertedCode", "int");
	}

	public FormatOptions withIndentWidth(int width) {
		if (width < 0) {
			throw new IllegalArgumentException("indent width must not be negative: " + width);
		}
		return new FormatOptions(" ".repeat(width), lineSeparator, className, parameterType);
	}

	public FormatOptions withTabs() {
		return new FormatOptions("\t", lineSeparator, className, parameterType);
	}

	public FormatOptions withLineSeparator(String separator) {
		return new FormatOptions(indentUnit, separator, className, parameterType);
	}

	public FormatOptions withClassName(String name) {
		return new FormatOptions(indentUnit, lineSeparator, name, parameterType);
	}
}
