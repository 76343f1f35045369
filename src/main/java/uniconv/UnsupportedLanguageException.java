package uniconv;

/**
 * A language key that is unknown, or known but unusable in the requested
 * role.
 */
public final class UnsupportedLanguageException extends IllegalArgumentException {
	private final String key;

	public UnsupportedLanguageException(String key) {
		super("Unsupported language: " + key);
		this.key = key;
	}

	public UnsupportedLanguageException(Language language, String role) {
		super("Unsupported " + role + " language: " + language.key());
		this.key = language.key();
	}

	public String key() {
		return key;
	}
}
