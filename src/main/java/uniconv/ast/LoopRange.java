package uniconv.ast;

/**
 * What a {@link ForLoop} iterates over: either the canonical counted triple or
 * an arbitrary iterable expression.
 */
public sealed interface LoopRange permits CountedRange, IterableRange {
	<R> R fold(java.util.function.Function<CountedRange, R> counted,
			java.util.function.Function<IterableRange, R> iterable);
}
