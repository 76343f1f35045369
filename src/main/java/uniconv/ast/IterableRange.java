package uniconv.ast;

public record IterableRange(Expr iterable) implements LoopRange {
	@Override
	public <R> R fold(java.util.function.Function<CountedRange, R> counted,
			java.util.function.Function<IterableRange, R> iterable) {
		return iterable.apply(this);
	}
}
