package uniconv.parse;

/**
 * Raised in {@link ParseMode#STRICT} mode for a line or expression no rule
 * recognizes.
 */
public final class SourceParseException extends IllegalArgumentException {
	private final int lineNumber;
	private final String fragment;

	public SourceParseException(String message, int lineNumber, String fragment) {
		super(message + " at line " + lineNumber + ": " + fragment);
		this.lineNumber = lineNumber;
		this.fragment = fragment;
	}

	/**
	 * @return 1-based line number in the parsed source
	 */
	public int lineNumber() {
		return lineNumber;
	}

	public String fragment() {
		return fragment;
	}
}
