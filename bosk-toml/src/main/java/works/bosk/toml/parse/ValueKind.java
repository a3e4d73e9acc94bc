package works.bosk.toml.parse;

import java.util.Optional;
import java.util.regex.Pattern;
import works.bosk.toml.tree.TomlArray;
import works.bosk.toml.tree.TomlNode;
import works.bosk.toml.tree.TomlTable;
import works.bosk.toml.tree.TomlTableArray;
import works.bosk.toml.tree.TomlValue;

import static works.bosk.toml.parse.LineCursor.isDigit;

/**
 * The kinds of value that can appear on the right of a {@code =} or as an array element.
 * <p>
 * There's no separate tokenizing pass: {@link #infer} decides the kind
 * by looking at the first character and, for date-times and numbers,
 * scanning a little further.
 */
public enum ValueKind {
	STRING,
	DATE_TIME,
	INTEGER,
	FLOAT,
	BOOLEAN,
	ARRAY;

	static final Pattern DATE_TIME_PATTERN = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})T(\\d{2}):(\\d{2}):(\\d{2})Z");

	/**
	 * Checks, in this order: a quote means {@link #STRING};
	 * a run of date-time characters matching {@link #DATE_TIME_PATTERN} means {@link #DATE_TIME};
	 * a digit or minus sign means {@link #FLOAT} if a {@code '.'} follows the digits,
	 * {@link #INTEGER} otherwise; {@code t} or {@code f} means {@link #BOOLEAN};
	 * and {@code [} means {@link #ARRAY}.
	 * <p>
	 * Only the kind is decided here.
	 * A literal that starts like a kind but turns out to be malformed,
	 * like {@code tru} or {@code 1.}, is left for the parser to reject.
	 *
	 * @param text contains the value starting at {@code start}
	 * @param end the scan never goes this far
	 * @return the kind of value at {@code start}, or empty if no value can start there
	 */
	public static Optional<ValueKind> infer(String text, int start, int end) {
		if (start >= end) {
			return Optional.empty();
		}
		char c = text.charAt(start);
		if (c == '"') {
			return Optional.of(STRING);
		} else if (isDateTime(text, start, end)) {
			return Optional.of(DATE_TIME);
		} else if (isDigit(c) || c == '-') {
			return Optional.of(numberKind(text, start, end));
		} else if (c == 't' || c == 'f') {
			return Optional.of(BOOLEAN);
		} else if (c == '[') {
			return Optional.of(ARRAY);
		} else {
			return Optional.empty();
		}
	}

	/**
	 * @return the kind of an already-parsed node
	 * @throws IllegalArgumentException for tables, which are not values
	 */
	public static ValueKind of(TomlNode node) {
		if (node instanceof TomlArray) {
			return ARRAY;
		} else if (node instanceof TomlValue<?> value) {
			return switch (value.type()) {
				case STRING -> STRING;
				case INTEGER -> INTEGER;
				case FLOAT -> FLOAT;
				case BOOLEAN -> BOOLEAN;
				case DATE_TIME -> DATE_TIME;
			};
		} else if (node instanceof TomlTable || node instanceof TomlTableArray) {
			throw new IllegalArgumentException("Tables have no value kind");
		} else {
			throw new IllegalArgumentException("Unexpected node type: " + node.getClass());
		}
	}

	/**
	 * @return the end of the contiguous run of digits, {@code T}, {@code Z}, {@code :} and {@code -}
	 * starting at {@code start}
	 */
	static int dateTimeEnd(String text, int start, int end) {
		int p = start;
		while (p < end && isDateTimeChar(text.charAt(p))) {
			p++;
		}
		return p;
	}

	/**
	 * Any date-time form other than the exact UTC {@code Z} one fails this check,
	 * and falls through to be treated as a number.
	 */
	static boolean isDateTime(String text, int start, int end) {
		int dateEnd = dateTimeEnd(text, start, end);
		return DATE_TIME_PATTERN.matcher(text.substring(start, dateEnd)).matches();
	}

	/**
	 * @return the end of the numeric literal at {@code start}:
	 * an optional minus sign, digits, and optionally a {@code '.'} followed by more digits.
	 */
	static int numberEnd(String text, int start, int end) {
		int p = skipDigits(text, signEnd(text, start, end), end);
		if (p < end && text.charAt(p) == '.') {
			p = skipDigits(text, p + 1, end);
		}
		return p;
	}

	private static ValueKind numberKind(String text, int start, int end) {
		int p = skipDigits(text, signEnd(text, start, end), end);
		if (p < end && text.charAt(p) == '.') {
			return FLOAT;
		} else {
			return INTEGER;
		}
	}

	private static int signEnd(String text, int start, int end) {
		if (start < end && text.charAt(start) == '-') {
			return start + 1;
		} else {
			return start;
		}
	}

	private static int skipDigits(String text, int start, int end) {
		int p = start;
		while (p < end && isDigit(text.charAt(p))) {
			p++;
		}
		return p;
	}

	private static boolean isDateTimeChar(char c) {
		return isDigit(c) || c == 'T' || c == 'Z' || c == ':' || c == '-';
	}
}
