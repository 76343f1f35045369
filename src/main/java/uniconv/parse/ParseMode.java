package uniconv.parse;

/**
 * How a parser reacts to input it does not recognize.
 */
public enum ParseMode {
	/**
	 * Unrecognized lines are dropped and unrecognized expressions become a
	 * variable holding the raw text. Both are logged at {@code FINE}.
	 */
	BEST_EFFORT,
	/**
	 * Either condition raises {@link SourceParseException}.
	 */
	STRICT
}
