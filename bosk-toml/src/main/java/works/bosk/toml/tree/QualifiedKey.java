package works.bosk.toml.tree;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import works.bosk.toml.exceptions.TomlKeyNotFoundException;

/**
 * A dotted path like {@code a.b.c} addressing a node through nested tables.
 * <p>
 * Splitting is purely on {@code '.'}, so {@code "a..b"} has an empty middle segment.
 * Whether that's acceptable is up to the caller:
 * lookups simply won't find anything,
 * while the parser rejects such table headers.
 */
public record QualifiedKey(List<String> segments) {
	public QualifiedKey {
		segments = List.copyOf(segments);
		if (segments.isEmpty()) {
			throw new IllegalArgumentException("Qualified key must have at least one segment");
		}
	}

	public static QualifiedKey of(String dotted) {
		return new QualifiedKey(Arrays.asList(dotted.split("\\.", -1)));
	}

	/**
	 * @return every segment except the {@link #last} one
	 */
	public List<String> parents() {
		return segments.subList(0, segments.size() - 1);
	}

	public String last() {
		return segments.get(segments.size() - 1);
	}

	/**
	 * Walks the {@link #parents} strictly through existing tables,
	 * then looks up the {@link #last} segment in the table reached.
	 *
	 * @return the node at this path, or empty if any segment is missing
	 * or an intermediate segment is not a table.
	 */
	public Optional<TomlNode> resolveIn(TomlTable root) {
		TomlTable table = root;
		for (String part : parents()) {
			Optional<TomlTable> next = table.getTable(part);
			if (next.isEmpty()) {
				return Optional.empty();
			}
			table = next.get();
		}
		return table.find(last());
	}

	/**
	 * Never throws.
	 */
	public boolean existsIn(TomlTable root) {
		return resolveIn(root).isPresent();
	}

	/**
	 * @throws TomlKeyNotFoundException if {@link #resolveIn} would return empty
	 */
	public TomlNode getIn(TomlTable root) {
		return resolveIn(root).orElseThrow(() -> new TomlKeyNotFoundException(toString()));
	}

	@Override
	public String toString() {
		return String.join(".", segments);
	}
}
