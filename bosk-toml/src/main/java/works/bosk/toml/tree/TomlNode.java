package works.bosk.toml.tree;

import java.io.IOException;
import java.util.Optional;
import works.bosk.toml.print.TomlPrinter;

/**
 * A node in a parsed TOML document.
 * <p>
 * The hierarchy is closed: every node is a {@link TomlValue}, a {@link TomlArray},
 * a {@link TomlTable}, or a {@link TomlTableArray}.
 * The {@code as...} methods are the safe way to narrow a node whose kind isn't known statically;
 * they return empty rather than throwing when the node is of some other kind.
 */
public sealed interface TomlNode permits TomlValue, TomlArray, TomlTable, TomlTableArray {
	default boolean isValue() {
		return false;
	}

	default boolean isArray() {
		return false;
	}

	default boolean isTable() {
		return false;
	}

	default boolean isTableArray() {
		return false;
	}

	default Optional<TomlArray> asArray() {
		return Optional.empty();
	}

	default Optional<TomlTable> asTable() {
		return Optional.empty();
	}

	default Optional<TomlTableArray> asTableArray() {
		return Optional.empty();
	}

	/**
	 * @param javaType the boxed (or primitive) class of the desired scalar
	 * @return this node as a {@link TomlValue} holding a {@code javaType},
	 * or empty if it is any other kind of node or any other type of value.
	 */
	default <T> Optional<TomlValue<T>> as(Class<T> javaType) {
		return Optional.empty();
	}

	/**
	 * @return this node as a {@link TomlValue} of the given type, or empty otherwise.
	 */
	default Optional<TomlValue<?>> as(ValueType type) {
		return Optional.empty();
	}

	/**
	 * Renders this node as text using {@link TomlPrinter#DEFAULT}.
	 */
	default void print(Appendable out) throws IOException {
		TomlPrinter.DEFAULT.print(this, out);
	}
}
