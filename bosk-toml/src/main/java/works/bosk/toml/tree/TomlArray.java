package works.bosk.toml.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import works.bosk.toml.print.TomlPrinter;

import static java.util.Collections.unmodifiableList;

/**
 * An ordered, immutable sequence of nodes.
 * <p>
 * Arrays are homogeneous: either every element is a {@link TomlValue}
 * of the same {@link ValueType}, or every element is itself a {@link TomlArray}.
 * Nested arrays are checked independently, so {@code [ [1, 2], ["a"] ]} is allowed.
 * Arrays never contain tables.
 */
public final class TomlArray implements TomlNode {
	private static final TomlArray EMPTY = new TomlArray(List.of());

	private final List<TomlNode> elements;

	private TomlArray(List<TomlNode> elements) {
		this.elements = elements;
	}

	public static TomlArray empty() {
		return EMPTY;
	}

	/**
	 * @throws IllegalArgumentException if {@code elements} are not homogeneous
	 */
	public static TomlArray of(List<? extends TomlNode> elements) {
		List<TomlNode> copy = List.copyOf(elements);
		for (int i = 0; i < copy.size(); i++) {
			TomlNode element = copy.get(i);
			if (element.isTable() || element.isTableArray()) {
				throw new IllegalArgumentException("Arrays cannot contain tables; element " + i + " is " + element.getClass().getSimpleName());
			}
			if (!sameKind(copy.get(0), element)) {
				throw new IllegalArgumentException("Arrays must be homogeneous; element " + i + " differs from element 0");
			}
		}
		return copy.isEmpty() ? EMPTY : new TomlArray(copy);
	}

	public static TomlArray of(TomlNode... elements) {
		return of(List.of(elements));
	}

	/**
	 * @return true if {@code a} and {@code b} could both be elements of one array
	 */
	public static boolean sameKind(TomlNode a, TomlNode b) {
		if (a instanceof TomlArray) {
			return b instanceof TomlArray;
		} else if (a instanceof TomlValue<?> va && b instanceof TomlValue<?> vb) {
			return va.type() == vb.type();
		} else {
			return false;
		}
	}

	@Override
	public boolean isArray() {
		return true;
	}

	@Override
	public Optional<TomlArray> asArray() {
		return Optional.of(this);
	}

	public List<TomlNode> elements() {
		return elements;
	}

	/**
	 * @throws IndexOutOfBoundsException if there's no such element
	 */
	public TomlNode get(int index) {
		return elements.get(index);
	}

	public int size() {
		return elements.size();
	}

	public boolean isEmpty() {
		return elements.isEmpty();
	}

	/**
	 * @return the type shared by all elements, or empty if this array
	 * is empty or holds nested arrays.
	 */
	public Optional<ValueType> elementType() {
		if (!elements.isEmpty() && elements.get(0) instanceof TomlValue<?> v) {
			return Optional.of(v.type());
		} else {
			return Optional.empty();
		}
	}

	/**
	 * @return the unwrapped element values, or empty if the elements are not
	 * values of the given type. An empty array yields an empty list for any type.
	 */
	public <T> Optional<List<T>> valuesAs(Class<T> javaType) {
		List<T> result = new ArrayList<>(elements.size());
		for (TomlNode element : elements) {
			Optional<TomlValue<T>> value = element.as(javaType);
			if (value.isEmpty()) {
				return Optional.empty();
			}
			result.add(value.get().value());
		}
		return Optional.of(unmodifiableList(result));
	}

	/**
	 * @return the elements as arrays, or empty if they are scalar values.
	 * An empty array yields an empty list.
	 */
	public Optional<List<TomlArray>> nestedArrays() {
		List<TomlArray> result = new ArrayList<>(elements.size());
		for (TomlNode element : elements) {
			Optional<TomlArray> array = element.asArray();
			if (array.isEmpty()) {
				return Optional.empty();
			}
			result.add(array.get());
		}
		return Optional.of(unmodifiableList(result));
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TomlArray other && elements.equals(other.elements);
	}

	@Override
	public int hashCode() {
		return elements.hashCode();
	}

	@Override
	public String toString() {
		return TomlPrinter.DEFAULT.toText(this);
	}
}
