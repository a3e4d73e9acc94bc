package works.bosk.toml.parse;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import works.bosk.toml.exceptions.TomlParseException;

/**
 * Position-tracking view of one line at a time from a {@link BufferedReader}.
 * <p>
 * Most grammar only ever looks at the current line.
 * Constructs that can span lines, like arrays, call {@link #nextLine} explicitly
 * to pull in the next one.
 * <p>
 * Positions passed to and returned from these methods are indexes into {@link #line()}.
 */
final class LineCursor {
	private final BufferedReader reader;
	private String line = "";
	private int pos = 0;
	private int lineNumber = 0;

	LineCursor(BufferedReader reader) {
		this.reader = reader;
	}

	/**
	 * Discards the rest of the current line and reads the next one.
	 *
	 * @return false if the input is exhausted, in which case
	 * the cursor still refers to the last line read.
	 * @throws TomlParseException if the next line's bytes can't be decoded
	 * @throws UncheckedIOException if the reader fails
	 */
	boolean nextLine() {
		String next;
		try {
			next = reader.readLine();
		} catch (CharacterCodingException e) {
			throw new TomlParseException("Invalid character encoding", lineNumber + 1, e);
		} catch (IOException e) {
			throw new UncheckedIOException("Error reading line " + (lineNumber + 1), e);
		}
		if (next == null) {
			pos = line.length();
			return false;
		}
		line = next;
		pos = 0;
		lineNumber++;
		return true;
	}

	String line() {
		return line;
	}

	/**
	 * @return the 1-based number of the current line, or zero if none has been read yet
	 */
	int lineNumber() {
		return lineNumber;
	}

	int position() {
		return pos;
	}

	void moveTo(int position) {
		assert pos <= position && position <= line.length();
		pos = position;
	}

	boolean atEnd() {
		return pos >= line.length();
	}

	/**
	 * @return the current character, or -1 at the end of the line
	 */
	int peek() {
		if (atEnd()) {
			return -1;
		} else {
			return line.charAt(pos);
		}
	}

	char next() {
		return line.charAt(pos++);
	}

	void advance() {
		pos++;
	}

	void skipWhitespace() {
		while (!atEnd() && isWhitespace(line.charAt(pos))) {
			pos++;
		}
	}

	/**
	 * @return the position of the first {@code c} at or after the current position,
	 * or -1 if the rest of the line doesn't have one.
	 */
	int indexOf(char c) {
		return line.indexOf(c, pos);
	}

	/**
	 * @return the position of the first of any of {@code chars} at or after the current position,
	 * or the line length if there is none.
	 */
	int indexOfAny(String chars) {
		for (int i = pos; i < line.length(); i++) {
			if (chars.indexOf(line.charAt(i)) >= 0) {
				return i;
			}
		}
		return line.length();
	}

	String slice(int start, int end) {
		return line.substring(start, end);
	}

	TomlParseException error(String reason) {
		return new TomlParseException(reason, lineNumber);
	}

	TomlParseException error(String reason, Throwable cause) {
		return new TomlParseException(reason, lineNumber, cause);
	}

	static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t';
	}

	static boolean isDigit(char c) {
		return '0' <= c && c <= '9';
	}
}
