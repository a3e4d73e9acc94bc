package works.bosk.toml.tree;

import java.time.OffsetDateTime;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import works.bosk.toml.exceptions.TomlKeyNotFoundException;
import works.bosk.toml.print.TomlPrinter;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * A mapping from keys to nodes: the document root, and every nested keytable.
 * <p>
 * Lookups come in two flavours.
 * The strict ones, {@link #get} and {@link #getQualified},
 * throw {@link TomlKeyNotFoundException} when the key is absent.
 * The typed convenience accessors ({@link #getTable}, {@link #getArray},
 * {@link #getTableArray}, {@link #getAs} and their qualified forms)
 * return empty both when the key is absent and when it maps to a node
 * of some other kind, which suits optional configuration settings.
 * <p>
 * Methods with "qualified" in the name accept dotted paths
 * like {@code "grandparent.parent.child"}; see {@link QualifiedKey}.
 * <p>
 * Iteration order is unspecified.
 */
public final class TomlTable implements TomlNode, Iterable<Map.Entry<String, TomlNode>> {
	private final Map<String, TomlNode> entries = new LinkedHashMap<>();

	@Override
	public boolean isTable() {
		return true;
	}

	@Override
	public Optional<TomlTable> asTable() {
		return Optional.of(this);
	}

	public boolean contains(String key) {
		return entries.containsKey(key);
	}

	public boolean containsQualified(String qualifiedKey) {
		return QualifiedKey.of(qualifiedKey).existsIn(this);
	}

	/**
	 * @throws TomlKeyNotFoundException if there is no such key
	 */
	public TomlNode get(String key) {
		TomlNode result = entries.get(key);
		if (result == null) {
			throw new TomlKeyNotFoundException(key);
		}
		return result;
	}

	/**
	 * @throws TomlKeyNotFoundException if any segment of the path is missing
	 */
	public TomlNode getQualified(String qualifiedKey) {
		return QualifiedKey.of(qualifiedKey).getIn(this);
	}

	/**
	 * Like {@link #get}, but returns empty instead of throwing.
	 */
	public Optional<TomlNode> find(String key) {
		return Optional.ofNullable(entries.get(key));
	}

	public Optional<TomlTable> getTable(String key) {
		return find(key).flatMap(TomlNode::asTable);
	}

	public Optional<TomlTable> getTableQualified(String qualifiedKey) {
		return QualifiedKey.of(qualifiedKey).resolveIn(this).flatMap(TomlNode::asTable);
	}

	public Optional<TomlArray> getArray(String key) {
		return find(key).flatMap(TomlNode::asArray);
	}

	public Optional<TomlArray> getArrayQualified(String qualifiedKey) {
		return QualifiedKey.of(qualifiedKey).resolveIn(this).flatMap(TomlNode::asArray);
	}

	public Optional<TomlTableArray> getTableArray(String key) {
		return find(key).flatMap(TomlNode::asTableArray);
	}

	public Optional<TomlTableArray> getTableArrayQualified(String qualifiedKey) {
		return QualifiedKey.of(qualifiedKey).resolveIn(this).flatMap(TomlNode::asTableArray);
	}

	/**
	 * @return the scalar stored under {@code key}, or empty if there is none
	 * or it is not a {@code javaType}.
	 */
	public <T> Optional<T> getAs(String key, Class<T> javaType) {
		return find(key)
			.flatMap(n -> n.as(javaType))
			.map(TomlValue::value);
	}

	public <T> Optional<T> getQualifiedAs(String qualifiedKey, Class<T> javaType) {
		return QualifiedKey.of(qualifiedKey).resolveIn(this)
			.flatMap(n -> n.as(javaType))
			.map(TomlValue::value);
	}

	/**
	 * Adds {@code value} under {@code key}, replacing any existing entry.
	 * The parser itself rejects duplicate keys before calling this.
	 */
	public void insert(String key, TomlNode value) {
		entries.put(requireNonNull(key), requireNonNull(value));
	}

	public void insert(String key, String value) {
		insert(key, TomlValue.of(value));
	}

	public void insert(String key, long value) {
		insert(key, TomlValue.of(value));
	}

	public void insert(String key, double value) {
		insert(key, TomlValue.of(value));
	}

	public void insert(String key, boolean value) {
		insert(key, TomlValue.of(value));
	}

	public void insert(String key, OffsetDateTime value) {
		insert(key, TomlValue.of(value));
	}

	public Set<String> keySet() {
		return unmodifiableMap(entries).keySet();
	}

	public Set<Map.Entry<String, TomlNode>> entrySet() {
		return unmodifiableMap(entries).entrySet();
	}

	@Override
	public Iterator<Map.Entry<String, TomlNode>> iterator() {
		return entrySet().iterator();
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TomlTable other && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return TomlPrinter.DEFAULT.toText(this);
	}
}
