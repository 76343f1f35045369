package uniconv.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Forward-only cursor shared by every nesting level of one parse.
 */
final class LineCursor {
	static final LineCursor EMPTY = new LineCursor(List.of());

	private final List<SourceLine> lines;
	private int pos;

	private LineCursor(List<SourceLine> lines) {
		this.lines = lines;
		this.pos = 0;
	}

	static LineCursor of(String source) {
		String[] raw = source.split("\\R", -1);
		List<SourceLine> lines = new ArrayList<>(raw.length);
		for (int i = 0; i < raw.length; i++) {
			lines.add(SourceLine.of(i + 1, raw[i]));
		}
		return new LineCursor(lines);
	}

	boolean hasNext() {
		return pos < lines.size();
	}

	SourceLine peek() {
		return lines.get(pos);
	}

	SourceLine next() {
		return lines.get(pos++);
	}
}
