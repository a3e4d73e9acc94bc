package works.bosk.toml.print;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.bosk.toml.Toml;
import works.bosk.toml.tree.TomlArray;
import works.bosk.toml.tree.TomlNode;
import works.bosk.toml.tree.TomlTable;
import works.bosk.toml.tree.TomlTableArray;
import works.bosk.toml.tree.TomlValue;

import static java.time.ZoneOffset.UTC;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TomlPrinterTest {
	final TomlPrinter printer = TomlPrinter.DEFAULT;

	@Test
	void scalars() {
		assertEquals("hello", printer.toText(TomlValue.of("hello")));
		assertEquals("-42", printer.toText(TomlValue.of(-42L)));
		assertEquals("2.5", printer.toText(TomlValue.of(2.5)));
		assertEquals("true", printer.toText(TomlValue.of(true)));
		assertEquals("false", printer.toText(TomlValue.of(false)));
	}

	@Test
	void dateTimeUsesCalendarForm() {
		TomlValue<OffsetDateTime> value = TomlValue.of(OffsetDateTime.of(2001, 8, 3, 14, 55, 2, 0, UTC));
		assertEquals("Fri Aug  3 14:55:02 2001", printer.toText(value));
		TomlValue<OffsetDateTime> twoDigitDay = TomlValue.of(OffsetDateTime.of(1979, 5, 27, 7, 32, 0, 0, UTC));
		assertEquals("Sun May 27 07:32:00 1979", printer.toText(twoDigitDay));
	}

	@Test
	void arrays() {
		assertEquals("[ 1, 2, 3 ]", printer.toText(TomlArray.of(TomlValue.of(1L), TomlValue.of(2L), TomlValue.of(3L))));
		assertEquals("[ a ]", printer.toText(TomlArray.of(TomlValue.of("a"))));
		assertEquals("[  ]", printer.toText(TomlArray.empty()));
		assertEquals("[ [ 1 ], [  ] ]", printer.toText(TomlArray.of(TomlArray.of(TomlValue.of(1L)), TomlArray.empty())));
	}

	@Test
	void keyValue() {
		TomlTable table = new TomlTable();
		table.insert("name", "Tom");
		assertEquals("name = Tom\n", printer.toText(table));
	}

	@Test
	void nestedTableIsIndented() {
		TomlTable root = new TomlTable();
		TomlTable owner = new TomlTable();
		TomlTable address = new TomlTable();
		root.insert("owner", owner);
		owner.insert("address", address);
		address.insert("city", "Toronto");
		assertEquals("""
			owner = \n\
			\taddress = \n\
			\t\tcity = Toronto
			""", printer.toText(root));
	}

	@Test
	void tableArrayRepeatsHeader() {
		TomlTable root = new TomlTable();
		TomlTable apple = new TomlTable();
		apple.insert("name", "apple");
		TomlTable banana = new TomlTable();
		banana.insert("name", "banana");
		root.insert("fruit", new TomlTableArray(List.of(apple, banana)));
		assertEquals("""
			[[fruit]]
			\tname = apple
			[[fruit]]
			\tname = banana
			""", printer.toText(root));
	}

	@Test
	void tableArrayByItselfHasNoKey() {
		TomlTable member = new TomlTable();
		member.insert("x", 1);
		assertEquals("[[]]\n\tx = 1\n", printer.toText(new TomlTableArray(List.of(member))));
	}

	@ParameterizedTest
	@ValueSource(strings = {"  ", "    ", ""})
	void customIndent(String indent) {
		TomlPrinter custom = new TomlPrinter(new TomlPrinter.Settings(indent));
		TomlTable root = new TomlTable();
		TomlTable child = new TomlTable();
		root.insert("child", child);
		child.insert("k", true);
		assertEquals("child = \n" + indent + "k = true\n", custom.toText(root));
	}

	@Test
	void printParsedDocument() throws IOException {
		TomlTable root = Toml.parse("""
			title = "demo"
			ports = [8080, 8081]
			[owner]
			name = "Tom"
			[[fruit]]
			name = "apple"
			[[fruit]]
			name = "banana"
			""");
		StringBuilder sb = new StringBuilder();
		root.print(sb);

		// Entry order is unspecified, so compare lines
		assertEquals(Set.of(
			"title = demo",
			"ports = [ 8080, 8081 ]",
			"owner = ",
			"\tname = Tom",
			"[[fruit]]",
			"\tname = apple",
			"\tname = banana"
		), Set.copyOf(List.of(sb.toString().split("\n"))));
		assertEquals(sb.toString(), Toml.print(root));
		assertEquals(sb.toString(), root.toString());
	}

	@Test
	void everyNodePrints() throws IOException {
		for (TomlNode node : List.<TomlNode>of(TomlValue.of(1L), TomlArray.empty(), new TomlTable(), new TomlTableArray())) {
			StringBuilder sb = new StringBuilder();
			node.print(sb);
			assertEquals(printer.toText(node), sb.toString());
		}
	}
}
