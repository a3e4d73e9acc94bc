package works.bosk.toml.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import works.bosk.toml.print.TomlPrinter;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * The tables declared by repeated {@code [[key]]} headers, in declaration order.
 */
public final class TomlTableArray implements TomlNode {
	private final List<TomlTable> tables = new ArrayList<>();

	public TomlTableArray() {
	}

	public TomlTableArray(List<TomlTable> tables) {
		tables.forEach(this::append);
	}

	@Override
	public boolean isTableArray() {
		return true;
	}

	@Override
	public Optional<TomlTableArray> asTableArray() {
		return Optional.of(this);
	}

	public void append(TomlTable table) {
		tables.add(requireNonNull(table));
	}

	public List<TomlTable> tables() {
		return unmodifiableList(tables);
	}

	public TomlTable get(int index) {
		return tables.get(index);
	}

	/**
	 * @return the most recently appended table, to which keys under the
	 * latest {@code [[key]]} header belong.
	 */
	public Optional<TomlTable> last() {
		if (tables.isEmpty()) {
			return Optional.empty();
		} else {
			return Optional.of(tables.get(tables.size() - 1));
		}
	}

	public int size() {
		return tables.size();
	}

	public boolean isEmpty() {
		return tables.isEmpty();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TomlTableArray other && tables.equals(other.tables);
	}

	@Override
	public int hashCode() {
		return tables.hashCode();
	}

	@Override
	public String toString() {
		return TomlPrinter.DEFAULT.toText(this);
	}
}
