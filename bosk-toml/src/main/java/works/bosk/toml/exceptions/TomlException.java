package works.bosk.toml.exceptions;

public sealed abstract class TomlException extends RuntimeException permits TomlParseException, TomlKeyNotFoundException {
	protected TomlException(String message) {
		super(message);
	}

	protected TomlException(String message, Throwable cause) {
		super(message, cause);
	}
}
