package uniconv.print;

/**
 * Position of the code being rendered: nesting depth, formatting, and the
 * declaration scope of the enclosing block. Passed down every visitor call in
 * place of printer fields, so a printer instance holds no per-render state.
 */
public record RenderContext(int depth, FormatOptions options, Scope scope) {
	static RenderContext root(FormatOptions options) {
		return new RenderContext(0, options, new Scope(null));
	}

	/**
	 * One level deeper, same declarations.
	 */
	RenderContext deeper() {
		return new RenderContext(depth + 1, options, scope);
	}

	/**
	 * One level deeper, inside a new block scope.
	 */
	RenderContext block() {
		return new RenderContext(depth + 1, options, scope.child());
	}

	String indent() {
		return options.indentUnit().repeat(depth);
	}

	String nl() {
		return options.lineSeparator();
	}
}
