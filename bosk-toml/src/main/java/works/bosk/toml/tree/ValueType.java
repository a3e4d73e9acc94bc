package works.bosk.toml.tree;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * The closed set of scalar kinds a {@link TomlValue} can hold.
 */
public enum ValueType {
	STRING(String.class),
	INTEGER(Long.class),
	FLOAT(Double.class),
	BOOLEAN(Boolean.class),

	/**
	 * Always in UTC; the dialect has no other offsets.
	 */
	DATE_TIME(OffsetDateTime.class);

	private final Class<?> javaType;

	ValueType(Class<?> javaType) {
		this.javaType = javaType;
	}

	/**
	 * @return the boxed Java class of values of this type
	 */
	public Class<?> javaType() {
		return javaType;
	}

	/**
	 * Primitive classes are accepted too, so that {@code long.class}
	 * means the same thing as {@code Long.class}.
	 *
	 * @return the {@link ValueType} whose values are instances of {@code type},
	 * or empty if no TOML scalar is represented that way.
	 */
	public static Optional<ValueType> forJavaType(Class<?> type) {
		if (type == long.class) {
			return Optional.of(INTEGER);
		} else if (type == double.class) {
			return Optional.of(FLOAT);
		} else if (type == boolean.class) {
			return Optional.of(BOOLEAN);
		}
		for (ValueType candidate : values()) {
			if (candidate.javaType == type) {
				return Optional.of(candidate);
			}
		}
		return Optional.empty();
	}
}
