package uniconv.transform;

import uniconv.ast.Program;

/**
 * Optional stage between parsing and printing.
 *
 * Implementations return a complete tree and never modify the one they are
 * given; since nodes are immutable, returning the input unchanged is always
 * valid.
 */
@FunctionalInterface
public interface IrTransformer {
	Program transform(Program program);

	static IrTransformer identity() {
		return program -> program;
	}

	/**
	 * @return a transformer applying this stage, then {@code next}
	 */
	default IrTransformer andThen(IrTransformer next) {
		return program -> next.transform(transform(program));
	}
}
