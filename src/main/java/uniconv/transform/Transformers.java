package uniconv.transform;

import uniconv.Language;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-target transformer registry. Every language currently maps to the
 * identity stage.
 */
public final class Transformers {
	private static final Map<Language, IrTransformer> BY_TARGET = new EnumMap<>(Language.class);

	static {
		for (Language language : Language.values()) {
			BY_TARGET.put(language, IrTransformer.identity());
		}
	}

	private Transformers() {
		// utility class
	}

	public static IrTransformer forTarget(Language target) {
		return BY_TARGET.get(target);
	}
}
