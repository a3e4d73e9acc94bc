package works.bosk.toml.exceptions;

import java.util.OptionalInt;

/**
 * The input text is not valid in the supported TOML dialect,
 * or could not be opened at all.
 * <p>
 * Every grammar violation carries the 1-based number of the line
 * being parsed when it was detected.
 * The only parse error without a line number is the failure to open a file,
 * since no line has been read at that point.
 */
public final class TomlParseException extends TomlException {
	private static final int NO_LINE = 0;

	private final String reason;
	private final int lineNumber;

	public TomlParseException(String reason) {
		this(reason, NO_LINE, null);
	}

	public TomlParseException(String reason, Throwable cause) {
		this(reason, NO_LINE, cause);
	}

	public TomlParseException(String reason, int lineNumber) {
		this(reason, lineNumber, null);
	}

	public TomlParseException(String reason, int lineNumber, Throwable cause) {
		super(messageFor(reason, lineNumber), cause);
		this.reason = reason;
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the message without the line number suffix
	 */
	public String reason() {
		return reason;
	}

	public OptionalInt lineNumber() {
		if (lineNumber == NO_LINE) {
			return OptionalInt.empty();
		} else {
			return OptionalInt.of(lineNumber);
		}
	}

	private static String messageFor(String reason, int lineNumber) {
		if (lineNumber == NO_LINE) {
			return reason;
		} else {
			return reason + " at line " + lineNumber;
		}
	}
}
