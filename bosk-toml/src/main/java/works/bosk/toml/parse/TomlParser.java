package works.bosk.toml.parse;

import java.io.BufferedReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.toml.exceptions.TomlParseException;
import works.bosk.toml.tree.QualifiedKey;
import works.bosk.toml.tree.TomlArray;
import works.bosk.toml.tree.TomlNode;
import works.bosk.toml.tree.TomlTable;
import works.bosk.toml.tree.TomlTableArray;
import works.bosk.toml.tree.TomlValue;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;
import static works.bosk.toml.parse.LineCursor.isWhitespace;

/**
 * Recursive-descent parser that reads a whole document into a {@link TomlTable}.
 * <p>
 * Input is consumed one line at a time.
 * Each line is blank, a comment, a {@code [table]} or {@code [[table array]]} header,
 * or a {@code key = value} assignment into the table named by the latest header.
 * Only arrays may continue onto following lines.
 * <p>
 * There is no error recovery: the first violation throws a {@link TomlParseException}
 * citing the current line, and no partial document is returned.
 * <p>
 * A parser is good for exactly one call to {@link #parse()}, and is not thread-safe.
 */
public final class TomlParser {
	/**
	 * @param charset used to decode byte input; ignored when parsing from a {@link Reader}
	 * @param maxArrayDepth how deeply arrays may nest before the input is rejected
	 */
	public record Settings(
		Charset charset,
		int maxArrayDepth
	) {
		public static final Settings DEFAULT = new Settings(UTF_8, 256);

		public Settings {
			requireNonNull(charset);
			if (maxArrayDepth < 1) {
				throw new IllegalArgumentException("maxArrayDepth must be positive, got " + maxArrayDepth);
			}
		}

		public Settings withCharset(Charset charset) {
			return new Settings(charset, maxArrayDepth);
		}

		public Settings withMaxArrayDepth(int maxArrayDepth) {
			return new Settings(charset, maxArrayDepth);
		}
	}

	private final LineCursor input;
	private final Settings settings;

	/**
	 * Single-table header names seen so far, as written.
	 * Table-array headers are not recorded, since repeating them is the whole point.
	 */
	private final Set<String> declaredTables = new HashSet<>();

	private boolean used = false;

	public TomlParser(Reader reader) {
		this(reader, Settings.DEFAULT);
	}

	public TomlParser(Reader reader, Settings settings) {
		BufferedReader buffered = (reader instanceof BufferedReader b) ? b : new BufferedReader(reader);
		this.input = new LineCursor(buffered);
		this.settings = requireNonNull(settings);
	}

	/**
	 * Reads the input to the end.
	 * The reader is not closed.
	 *
	 * @throws TomlParseException if the input is not valid
	 * @throws java.io.UncheckedIOException if the reader fails
	 * @throws IllegalStateException if called more than once
	 */
	public TomlTable parse() {
		if (used) {
			throw new IllegalStateException("Parser has already been used");
		}
		used = true;
		LOGGER.debug("Beginning parse with {}", settings);

		TomlTable root = new TomlTable();
		TomlTable currentTable = root;
		while (input.nextLine()) {
			input.skipWhitespace();
			if (input.atEnd() || input.peek() == '#') {
				continue;
			}
			if (input.peek() == '[') {
				currentTable = parseTableHeader(root);
			} else {
				parseKeyValue(currentTable);
			}
		}

		declaredTables.clear();
		LOGGER.debug("Finished parse: {} lines, {} top-level keys", input.lineNumber(), root.size());
		return root;
	}

	/**
	 * Every header is relative to the root, not to the previous header.
	 *
	 * @return the table that subsequent assignments go into
	 */
	private TomlTable parseTableHeader(TomlTable root) {
		input.advance(); // '['
		if (input.atEnd()) {
			throw input.error("Unexpected end of table");
		}
		if (input.peek() == '[') {
			return parseTableArrayHeader(root);
		} else {
			return parseSingleTableHeader(root);
		}
	}

	private TomlTable parseSingleTableHeader(TomlTable root) {
		int close = input.indexOf(']');
		if (containsOpenBracket(close)) {
			throw input.error("Cannot have [ in table name");
		}
		if (close < 0) {
			throw input.error("Unterminated table");
		}
		if (close == input.position()) {
			throw input.error("Empty table");
		}

		String tableName = input.slice(input.position(), close);
		if (declaredTables.contains(tableName)) {
			throw input.error("Duplicate table");
		}
		checkNoWhitespace(tableName);
		declaredTables.add(tableName);
		LOGGER.debug("Table [{}] at line {}", tableName, input.lineNumber());

		TomlTable table = root;
		for (String part : QualifiedKey.of(tableName).segments()) {
			table = descend(table, part);
		}

		input.moveTo(close + 1);
		input.skipWhitespace();
		expectEndOfLine();
		return table;
	}

	private TomlTable parseTableArrayHeader(TomlTable root) {
		input.advance(); // second '['
		int close = input.indexOf(']');
		if (containsOpenBracket(close)) {
			throw input.error("Cannot have [ in keytable name");
		}
		if (close < 0) {
			throw input.error("Unterminated keytable array");
		}
		if (close == input.position()) {
			throw input.error("Empty keytable");
		}
		if (close + 1 >= input.line().length() || input.line().charAt(close + 1) != ']') {
			throw input.error("Invalid keytable array specifier");
		}

		String tableName = input.slice(input.position(), close);
		checkNoWhitespace(tableName);
		LOGGER.debug("Table array [[{}]] at line {}", tableName, input.lineNumber());

		QualifiedKey path = QualifiedKey.of(tableName);
		TomlTable table = root;
		for (String part : path.parents()) {
			table = descend(table, part);
		}
		TomlTable result = appendToTableArray(table, path.last());

		input.moveTo(close + 2);
		input.skipWhitespace();
		expectEndOfLine();
		return result;
	}

	/**
	 * One step of a header path that is not the last step of a table-array header.
	 * Existing tables are entered; for an existing table array,
	 * the most recent table is entered; missing tables are created.
	 */
	private TomlTable descend(TomlTable table, String part) {
		if (part.isEmpty()) {
			throw input.error("Empty keytable part");
		}
		Optional<TomlNode> existing = table.find(part);
		if (existing.isEmpty()) {
			TomlTable child = new TomlTable();
			table.insert(part, child);
			return child;
		}
		TomlNode node = existing.get();
		if (node instanceof TomlTable child) {
			return child;
		} else if (node instanceof TomlTableArray tableArray) {
			return tableArray.last().orElseGet(() -> {
				TomlTable child = new TomlTable();
				tableArray.append(child);
				return child;
			});
		} else {
			throw input.error("Keytable already exists as a value");
		}
	}

	private TomlTable appendToTableArray(TomlTable table, String part) {
		if (part.isEmpty()) {
			throw input.error("Empty keytable part");
		}
		TomlTableArray tableArray;
		Optional<TomlNode> existing = table.find(part);
		if (existing.isEmpty()) {
			tableArray = new TomlTableArray();
			table.insert(part, tableArray);
		} else if (existing.get() instanceof TomlTableArray found) {
			tableArray = found;
		} else {
			throw input.error("Expected keytable array");
		}
		TomlTable result = new TomlTable();
		tableArray.append(result);
		return result;
	}

	/**
	 * @param close the position of the header's closing bracket, or negative if there is none
	 */
	private boolean containsOpenBracket(int close) {
		int open = input.indexOf('[');
		return open >= 0 && (close < 0 || open < close);
	}

	private void checkNoWhitespace(String tableName) {
		for (int i = 0; i < tableName.length(); i++) {
			if (isWhitespace(tableName.charAt(i))) {
				throw input.error("Table name " + tableName + " cannot have whitespace");
			}
		}
	}

	private void parseKeyValue(TomlTable table) {
		String key = parseKey();
		if (table.contains(key)) {
			throw input.error("Key " + key + " already present");
		}
		if (input.peek() != '=') {
			throw input.error("Value must follow after a '='");
		}
		input.advance();
		input.skipWhitespace();
		int keyLine = input.lineNumber();
		TomlNode value = parseValue(0);
		table.insert(key, value);
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Key {} at line {}: {}", key, keyLine, value);
		}
		input.skipWhitespace();
		expectEndOfLine();
	}

	/**
	 * Leaves the cursor at the {@code '='}, or wherever the key ended if there is none.
	 */
	private String parseKey() {
		input.skipWhitespace();
		if (input.peek() == '"') {
			String key = parseStringLiteral();
			input.skipWhitespace();
			return key;
		} else {
			return parseBareKey();
		}
	}

	private String parseBareKey() {
		int start = input.position();
		int equals = input.indexOf('=');
		int keyEnd = (equals < 0) ? input.line().length() : equals;
		int stop = keyEnd;
		while (stop > start && isWhitespace(input.line().charAt(stop - 1))) {
			stop--;
		}
		String key = input.slice(start, stop);
		if (key.indexOf('#') >= 0) {
			throw input.error("Key " + key + " cannot contain #");
		}
		for (int i = 0; i < key.length(); i++) {
			if (isWhitespace(key.charAt(i))) {
				throw input.error("Key " + key + " cannot contain whitespace");
			}
		}
		if (key.isEmpty()) {
			throw input.error("Empty key");
		}
		input.moveTo(keyEnd);
		return key;
	}

	/**
	 * @param arrayDepth the number of arrays enclosing this value
	 */
	private TomlNode parseValue(int arrayDepth) {
		String line = input.line();
		ValueKind kind = ValueKind.infer(line, input.position(), line.length())
			.orElseThrow(() -> input.error("Failed to parse value type"));
		return switch (kind) {
			case STRING -> TomlValue.of(parseStringLiteral());
			case DATE_TIME -> parseDateTime();
			case INTEGER -> parseInteger();
			case FLOAT -> parseFloat();
			case BOOLEAN -> parseBoolean();
			case ARRAY -> parseArray(arrayDepth + 1);
		};
	}

	/**
	 * Consumes a quoted string, including both quotes.
	 * Strings cannot span lines.
	 */
	private String parseStringLiteral() {
		input.advance(); // Opening quote
		StringBuilder sb = new StringBuilder();
		while (!input.atEnd()) {
			char c = input.next();
			if (c == '\\') {
				sb.append(parseEscape());
			} else if (c == '"') {
				return sb.toString();
			} else {
				sb.append(c);
			}
		}
		throw input.error("Unterminated string literal");
	}

	private char parseEscape() {
		if (input.atEnd()) {
			throw input.error("Invalid escape sequence");
		}
		char esc = input.next();
		return switch (esc) {
			case 'b' -> '\b';
			case 't' -> '\t';
			case 'n' -> '\n';
			case 'f' -> '\f';
			case 'r' -> '\r';
			case '"', '/', '\\' -> esc;
			default -> throw input.error("Invalid escape sequence");
		};
	}

	private TomlValue<Long> parseInteger() {
		String line = input.line();
		int end = ValueKind.numberEnd(line, input.position(), line.length());
		String text = input.slice(input.position(), end);
		long result;
		try {
			result = Long.parseLong(text);
		} catch (NumberFormatException e) {
			throw input.error("Malformed integer " + text, e);
		}
		input.moveTo(end);
		return TomlValue.of(result);
	}

	private TomlValue<Double> parseFloat() {
		String line = input.line();
		int end = ValueKind.numberEnd(line, input.position(), line.length());
		if (line.charAt(end - 1) == '.') {
			throw input.error("Floats must have trailing digits");
		}
		String text = input.slice(input.position(), end);
		double result;
		try {
			result = Double.parseDouble(text);
		} catch (NumberFormatException e) {
			throw input.error("Malformed float " + text, e);
		}
		if (Double.isInfinite(result) || (result == 0.0 && hasNonZeroDigit(text))) {
			// Out of range for a double
			throw input.error("Malformed float " + text);
		}
		input.moveTo(end);
		return TomlValue.of(result);
	}

	private static boolean hasNonZeroDigit(String text) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if ('1' <= c && c <= '9') {
				return true;
			}
		}
		return false;
	}

	private TomlValue<Boolean> parseBoolean() {
		int end = input.position();
		String line = input.line();
		while (end < line.length() && !isBooleanTerminator(line.charAt(end))) {
			end++;
		}
		String text = input.slice(input.position(), end);
		boolean result;
		if (text.equals("true")) {
			result = true;
		} else if (text.equals("false")) {
			result = false;
		} else {
			throw input.error("Attempted to parse invalid boolean value");
		}
		input.moveTo(end);
		return TomlValue.of(result);
	}

	private static boolean isBooleanTerminator(char c) {
		return isWhitespace(c) || c == '#' || c == ',' || c == ']';
	}

	private TomlValue<OffsetDateTime> parseDateTime() {
		String line = input.line();
		int end = ValueKind.dateTimeEnd(line, input.position(), line.length());
		String text = input.slice(input.position(), end);
		Matcher matcher = ValueKind.DATE_TIME_PATTERN.matcher(text);
		if (!matcher.matches()) {
			throw input.error("Invalid date-time " + text);
		}
		OffsetDateTime result;
		try {
			result = OffsetDateTime.of(
				Integer.parseInt(matcher.group(1)),
				Integer.parseInt(matcher.group(2)),
				Integer.parseInt(matcher.group(3)),
				Integer.parseInt(matcher.group(4)),
				Integer.parseInt(matcher.group(5)),
				Integer.parseInt(matcher.group(6)),
				0,
				UTC);
		} catch (DateTimeException e) {
			throw input.error("Invalid date-time " + text, e);
		}
		input.moveTo(end);
		return TomlValue.of(result);
	}

	/**
	 * The first element decides what kind every element must be.
	 * Elements that are themselves arrays are checked independently when they are parsed.
	 *
	 * @param depth the nesting depth of this array, starting at 1
	 */
	private TomlArray parseArray(int depth) {
		if (depth > settings.maxArrayDepth()) {
			throw input.error("Arrays nested deeper than " + settings.maxArrayDepth());
		}
		input.advance(); // '['
		skipWhitespaceAndComments();
		if (input.peek() == ']') {
			input.advance();
			return TomlArray.empty();
		}

		int firstEnd = input.indexOfAny(",]#");
		ValueKind kind = ValueKind.infer(input.line(), input.position(), firstEnd)
			.orElseThrow(() -> input.error("Failed to parse value type"));

		List<TomlNode> elements = new ArrayList<>();
		while (input.peek() != ']') {
			TomlNode element = parseValue(depth);
			if (ValueKind.of(element) != kind) {
				throw input.error("Arrays must be heterogeneous");
			}
			elements.add(element);
			skipWhitespaceAndComments();
			if (input.peek() != ',') {
				break;
			}
			input.advance();
			skipWhitespaceAndComments();
		}
		if (input.peek() != ']') {
			throw input.error("Expected , or ] in array");
		}
		input.advance();
		return TomlArray.of(elements);
	}

	/**
	 * Within an array, blank lines and comments are insignificant,
	 * so this reads further lines as needed to reach the next significant character.
	 */
	private void skipWhitespaceAndComments() {
		input.skipWhitespace();
		while (input.atEnd() || input.peek() == '#') {
			if (!input.nextLine()) {
				throw input.error("Unclosed array");
			}
			input.skipWhitespace();
		}
	}

	private void expectEndOfLine() {
		if (!input.atEnd() && input.peek() != '#') {
			throw input.error("Unidentified trailing character " + (char) input.peek() + "---did you forget a '#'?");
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TomlParser.class);
}
