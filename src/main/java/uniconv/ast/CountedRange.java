package uniconv.ast;

/**
 * Canonical half-open iteration triple. The loop visits {@code start},
 * {@code start + step}, {@code start + 2 * step}, ... while the value is still
 * before {@code end}: below it for a positive step, above it for a negative
 * one.
 *
 * A simple step is a literal, or a variable whose name carries a leading minus
 * when it was negated during normalization. Any other step expression is taken
 * to be ascending.
 */
public record CountedRange(Expr start, Expr end, Expr step) implements LoopRange {
	public static final NumberLiteral UNIT = new NumberLiteral("1");

	public boolean descending() {
		return stepText().startsWith("-");
	}

	/**
	 * @return the step without its sign, as source text
	 */
	public String stepMagnitude() {
		String text = stepText();
		return text.startsWith("-") ? text.substring(1) : text;
	}

	public boolean unitStep() {
		return stepMagnitude().equals("1");
	}

	/**
	 * @return true when the step is a literal or a possibly negated variable,
	 *         so its sign and magnitude can be read from its text
	 */
	public boolean simpleStep() {
		return step instanceof NumberLiteral || step instanceof Variable;
	}

	private String stepText() {
		if (step instanceof NumberLiteral number) {
			return number.text();
		}
		if (step instanceof Variable variable) {
			return variable.name();
		}
		return "";
	}

	@Override
	public <R> R fold(java.util.function.Function<CountedRange, R> counted,
			java.util.function.Function<IterableRange, R> iterable) {
		return counted.apply(this);
	}
}
