package works.bosk.toml.print;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import works.bosk.toml.tree.TomlArray;
import works.bosk.toml.tree.TomlNode;
import works.bosk.toml.tree.TomlTable;
import works.bosk.toml.tree.TomlTableArray;
import works.bosk.toml.tree.TomlValue;

import static java.util.Objects.requireNonNull;

/**
 * Renders document nodes as TOML-like text, indenting one
 * {@link Settings#indent() indent} per level of table nesting.
 * <p>
 * The output is meant for people, not for round-tripping:
 * comments and key quoting from the parsed text are gone,
 * strings are written without quotes,
 * date-times are written in calendar form,
 * and entries come out in whatever order the table iterates them.
 */
public final class TomlPrinter {
	public record Settings(String indent) {
		public static final Settings DEFAULT = new Settings("\t");

		public Settings {
			requireNonNull(indent);
		}
	}

	public static final TomlPrinter DEFAULT = new TomlPrinter(Settings.DEFAULT);

	/**
	 * The C locale's {@code %c} format, like {@code Thu Aug  3 14:55:02 2001}.
	 */
	static final DateTimeFormatter CALENDAR_FORMAT = DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss yyyy", Locale.US);

	private final Settings settings;

	public TomlPrinter(Settings settings) {
		this.settings = requireNonNull(settings);
	}

	public void print(TomlNode node, Appendable out) throws IOException {
		if (node instanceof TomlTable table) {
			printTable(table, 0, out);
		} else if (node instanceof TomlTableArray tableArray) {
			printTableArray(tableArray, 0, "", out);
		} else if (node instanceof TomlArray array) {
			printArray(array, out);
		} else if (node instanceof TomlValue<?> value) {
			printValue(value, out);
		} else {
			throw new IllegalArgumentException("Unexpected node type: " + node.getClass());
		}
	}

	public String toText(TomlNode node) {
		StringBuilder sb = new StringBuilder();
		try {
			print(node, sb);
		} catch (IOException e) {
			// StringBuilder doesn't do this
			throw new UncheckedIOException(e);
		}
		return sb.toString();
	}

	private void printTable(TomlTable table, int depth, Appendable out) throws IOException {
		for (Map.Entry<String, TomlNode> entry : table) {
			String key = entry.getKey();
			TomlNode node = entry.getValue();
			if (node instanceof TomlTableArray tableArray) {
				printTableArray(tableArray, depth, key, out);
			} else {
				indent(depth, out);
				out.append(key).append(" = ");
				if (node instanceof TomlTable nested) {
					out.append('\n');
					printTable(nested, depth + 1, out);
				} else {
					print(node, out);
					out.append('\n');
				}
			}
		}
	}

	private void printTableArray(TomlTableArray tableArray, int depth, String key, Appendable out) throws IOException {
		for (TomlTable table : tableArray.tables()) {
			indent(depth, out);
			out.append("[[").append(key).append("]]\n");
			printTable(table, depth + 1, out);
		}
	}

	private void printArray(TomlArray array, Appendable out) throws IOException {
		out.append("[ ");
		Iterator<TomlNode> iter = array.elements().iterator();
		while (iter.hasNext()) {
			print(iter.next(), out);
			if (iter.hasNext()) {
				out.append(", ");
			}
		}
		out.append(" ]");
	}

	private void printValue(TomlValue<?> value, Appendable out) throws IOException {
		switch (value.type()) {
			case BOOLEAN -> out.append((Boolean) value.value() ? "true" : "false");
			case DATE_TIME -> out.append(CALENDAR_FORMAT.format((OffsetDateTime) value.value()));
			default -> out.append(String.valueOf(value.value()));
		}
	}

	private void indent(int depth, Appendable out) throws IOException {
		for (int i = 0; i < depth; i++) {
			out.append(settings.indent());
		}
	}
}
