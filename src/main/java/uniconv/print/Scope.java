package uniconv.print;

import java.util.HashSet;
import java.util.Set;

/**
 * Names declared so far in one block of generated code, chained to the
 * enclosing block. A scope belongs to a single render call.
 */
final class Scope {
	private final Scope parent;
	private final Set<String> names = new HashSet<>();

	Scope(Scope parent) {
		this.parent = parent;
	}

	Scope child() {
		return new Scope(this);
	}

	boolean isDeclared(String name) {
		for (Scope s = this; s != null; s = s.parent) {
			if (s.names.contains(name)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return true when {@code name} was not visible before this call
	 */
	boolean declare(String name) {
		if (isDeclared(name)) {
			return false;
		}
		names.add(name);
		return true;
	}
}
