package works.bosk.toml.parse;

import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.bosk.toml.parse.ValueKind.ARRAY;
import static works.bosk.toml.parse.ValueKind.BOOLEAN;
import static works.bosk.toml.parse.ValueKind.DATE_TIME;
import static works.bosk.toml.parse.ValueKind.FLOAT;
import static works.bosk.toml.parse.ValueKind.INTEGER;
import static works.bosk.toml.parse.ValueKind.STRING;

class ValueKindTest {

	static Stream<Arguments> inferrable() {
		return Stream.of(
			Arguments.of("\"hello\"", STRING),
			Arguments.of("\"1979-05-27T07:32:00Z\"", STRING),
			Arguments.of("1979-05-27T07:32:00Z", DATE_TIME),
			Arguments.of("1979-05-27T07:32:00Z # comment", DATE_TIME),
			Arguments.of("1979-05-27T07:32:00Z,", DATE_TIME),
			Arguments.of("42", INTEGER),
			Arguments.of("-17", INTEGER),
			Arguments.of("0", INTEGER),
			Arguments.of("-", INTEGER),
			Arguments.of("1979-05-27", INTEGER),           // Not a full date-time
			Arguments.of("1979-05-27T07:32:00+01:00", INTEGER), // Offsets fall through
			Arguments.of("3.14", FLOAT),
			Arguments.of("-0.5", FLOAT),
			Arguments.of("1.", FLOAT),
			Arguments.of("42, 43", INTEGER),
			Arguments.of("42.0, 43", FLOAT),
			Arguments.of("true", BOOLEAN),
			Arguments.of("false", BOOLEAN),
			Arguments.of("tru", BOOLEAN),
			Arguments.of("[1, 2]", ARRAY),
			Arguments.of("[]", ARRAY)
		);
	}

	@ParameterizedTest
	@MethodSource("inferrable")
	void infer(String text, ValueKind expected) {
		assertEquals(Optional.of(expected), ValueKind.infer(text, 0, text.length()));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"",
		"'single'",
		"+1",
		".5",
		"yes",
		"{ a = 1 }",
		"#",
	})
	void notAValue(String text) {
		assertEquals(Optional.empty(), ValueKind.infer(text, 0, text.length()));
	}

	@ParameterizedTest
	@ValueSource(ints = {0, 1, 2, 3})
	void inferFromOffset(int leadingSpaces) {
		String text = " ".repeat(leadingSpaces) + "12.5";
		assertEquals(Optional.of(FLOAT), ValueKind.infer(text, leadingSpaces, text.length()));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"1.5",
		"1.5]",
		"1.5.6",
		"1.5e3",
	})
	void numberEnd_stopsAfterFraction(String text) {
		assertEquals(3, ValueKind.numberEnd(text, 0, text.length()));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"1979-05-27T07:32:00Z",
		"1979-05-27T07:32:00Z, 1",
		"1979-05-27T07:32:00Z]",
	})
	void dateTimeEnd(String text) {
		assertEquals(20, ValueKind.dateTimeEnd(text, 0, text.length()));
	}
}
