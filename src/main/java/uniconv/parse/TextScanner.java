package uniconv.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Quote- and bracket-aware searches over single-line source fragments.
 *
 * Inside a quoted region a backslash escapes the next character. Brackets of
 * any kind ({@code ( [ {}) count towards the nesting depth.
 */
public final class TextScanner {
	private static final String OPENING = "([{";
	private static final String CLOSING = ")]}";

	private TextScanner() {
		// utility class
	}

	/**
	 * @return index of the first occurrence of {@code token} outside string
	 *         literals, or -1
	 */
	public static int indexOutsideQuotes(String text, String token, String quotes) {
		return find(text, token, quotes, false, false);
	}

	/**
	 * @return index of the first occurrence of {@code token} outside string
	 *         literals and outside any brackets, or -1
	 */
	public static int indexOfTopLevel(String text, String token, String quotes) {
		return find(text, token, quotes, true, false);
	}

	/**
	 * @return index of the last occurrence of {@code token} outside string
	 *         literals and outside any brackets, or -1
	 */
	public static int lastIndexOfTopLevel(String text, String token, String quotes) {
		return find(text, token, quotes, true, true);
	}

	private static int find(String text, String token, String quotes, boolean topLevelOnly, boolean last) {
		char quote = 0;
		int depth = 0;
		int found = -1;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (quote != 0) {
				if (c == '\\') {
					i++;
				} else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (quotes.indexOf(c) >= 0) {
				quote = c;
				continue;
			}
			if ((!topLevelOnly || depth == 0) && text.startsWith(token, i)) {
				if (!last) {
					return i;
				}
				found = i;
			}
			if (OPENING.indexOf(c) >= 0) {
				depth++;
			} else if (CLOSING.indexOf(c) >= 0) {
				depth--;
			}
		}
		return found;
	}

	/**
	 * Splits on {@code separator} where it occurs outside literals and brackets.
	 * Parts are stripped; blank parts are dropped.
	 */
	public static List<String> splitTopLevel(String text, char separator, String quotes) {
		List<String> parts = new ArrayList<>();
		char quote = 0;
		int depth = 0;
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (quote != 0) {
				if (c == '\\') {
					i++;
				} else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (quotes.indexOf(c) >= 0) {
				quote = c;
			} else if (OPENING.indexOf(c) >= 0) {
				depth++;
			} else if (CLOSING.indexOf(c) >= 0) {
				depth--;
			} else if (c == separator && depth == 0) {
				addPart(parts, text.substring(start, i));
				start = i + 1;
			}
		}
		addPart(parts, text.substring(start));
		return parts;
	}

	private static void addPart(List<String> parts, String part) {
		String stripped = part.strip();
		if (!stripped.isEmpty()) {
			parts.add(stripped);
		}
	}

	/**
	 * @param open index of an opening bracket
	 * @return index of the bracket closing it, or -1 when it is never closed
	 */
	public static int closingIndex(String text, int open, String quotes) {
		char quote = 0;
		int depth = 0;
		for (int i = open; i < text.length(); i++) {
			char c = text.charAt(i);
			if (quote != 0) {
				if (c == '\\') {
					i++;
				} else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (quotes.indexOf(c) >= 0) {
				quote = c;
			} else if (OPENING.indexOf(c) >= 0) {
				depth++;
			} else if (CLOSING.indexOf(c) >= 0) {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		return -1;
	}

	/**
	 * @return true when {@code text} is exactly one quoted literal, opened and
	 *         closed by the same quote character
	 */
	public static boolean isSingleLiteral(String text, String quotes) {
		if (text.length() < 2 || quotes.indexOf(text.charAt(0)) < 0) {
			return false;
		}
		char quote = text.charAt(0);
		for (int i = 1; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\\') {
				i++;
			} else if (c == quote) {
				return i == text.length() - 1;
			}
		}
		return false;
	}
}
