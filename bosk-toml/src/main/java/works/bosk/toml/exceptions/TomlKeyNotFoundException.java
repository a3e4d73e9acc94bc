package works.bosk.toml.exceptions;

/**
 * A key or qualified key named by a caller does not exist in a table.
 * <p>
 * Only the strict lookups throw this.
 * The typed convenience accessors report a missing key as an empty {@link java.util.Optional}.
 */
public final class TomlKeyNotFoundException extends TomlException {
	private final String key;

	public TomlKeyNotFoundException(String key) {
		super(key + " is not a valid key");
		this.key = key;
	}

	public String key() {
		return key;
	}
}
