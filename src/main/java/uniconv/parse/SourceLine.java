package uniconv.parse;

/**
 * One physical source line. {@code text} has surrounding whitespace removed;
 * {@code indent} counts the leading whitespace characters that were removed
 * from the front.
 */
public record SourceLine(int number, int indent, String text) {
	static SourceLine of(int number, String raw) {
		String stripped = raw.stripLeading();
		return new SourceLine(number, raw.length() - stripped.length(), stripped.stripTrailing());
	}

	public boolean isBlank() {
		return text.isEmpty();
	}
}
