package uniconv;

import java.util.Locale;

/**
 * Languages known to the converter. Every language can be a target; only
 * those with {@link #hasParser()} can be a source.
 */
public enum Language {
	PYTHON("python", "py", true),
	JAVA("java", "java", true),
	CPP("cpp", "cpp", true),
	JAVASCRIPT("javascript", "js", false);

	private final String key;
	private final String extension;
	private final boolean parser;

	Language(String key, String extension, boolean parser) {
		this.key = key;
		this.extension = extension;
		this.parser = parser;
	}

	public String key() {
		return key;
	}

	/**
	 * File extension without the dot.
	 */
	public String extension() {
		return extension;
	}

	public boolean hasParser() {
		return parser;
	}

	/**
	 * Resolves a key such as {@code "python"}, ignoring case.
	 *
	 * @throws UnsupportedLanguageException for any other key
	 */
	public static Language fromKey(String key) {
		if (key != null) {
			String normalized = key.strip().toLowerCase(Locale.ROOT);
			for (Language language : values()) {
				if (language.key.equals(normalized)) {
					return language;
				}
			}
		}
		throw new UnsupportedLanguageException(key);
	}
}
