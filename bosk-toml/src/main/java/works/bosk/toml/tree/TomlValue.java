package works.bosk.toml.tree;

import java.time.OffsetDateTime;
import java.util.Optional;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;

/**
 * A scalar leaf of the document tree.
 * <p>
 * The {@link #type() type} is fixed at construction
 * and {@link #value() value} is always an instance of its {@link ValueType#javaType() javaType}.
 */
public record TomlValue<T>(ValueType type, T value) implements TomlNode {
	public TomlValue {
		requireNonNull(type);
		requireNonNull(value);
		if (!type.javaType().isInstance(value)) {
			throw new IllegalArgumentException("Value of " + value.getClass().getSimpleName() + " cannot have type " + type);
		}
	}

	public static TomlValue<String> of(String value) {
		return new TomlValue<>(ValueType.STRING, value);
	}

	public static TomlValue<Long> of(long value) {
		return new TomlValue<>(ValueType.INTEGER, value);
	}

	public static TomlValue<Double> of(double value) {
		return new TomlValue<>(ValueType.FLOAT, value);
	}

	public static TomlValue<Boolean> of(boolean value) {
		return new TomlValue<>(ValueType.BOOLEAN, value);
	}

	/**
	 * The date-time is converted to UTC, the only offset the dialect can express.
	 */
	public static TomlValue<OffsetDateTime> of(OffsetDateTime value) {
		return new TomlValue<>(ValueType.DATE_TIME, value.withOffsetSameInstant(UTC));
	}

	@Override
	public boolean isValue() {
		return true;
	}

	@Override
	@SuppressWarnings("unchecked")
	public <U> Optional<TomlValue<U>> as(Class<U> javaType) {
		return ValueType.forJavaType(javaType)
			.filter(t -> t == type)
			.map(t -> (TomlValue<U>) this);
	}

	@Override
	public Optional<TomlValue<?>> as(ValueType type) {
		if (type == this.type) {
			return Optional.of(this);
		} else {
			return Optional.empty();
		}
	}

	@Override
	public String toString() {
		return type + "(" + value + ")";
	}
}
