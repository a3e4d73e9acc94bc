package works.bosk.toml.tree;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.bosk.toml.exceptions.TomlKeyNotFoundException;

import static java.time.ZoneOffset.UTC;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TomlTableTest {
	TomlTable root;
	TomlTable server;
	TomlArray ports;
	TomlTableArray replicas;

	@BeforeEach
	void setUp() {
		root = new TomlTable();
		server = new TomlTable();
		ports = TomlArray.of(TomlValue.of(8080), TomlValue.of(8081));
		replicas = new TomlTableArray();
		replicas.append(new TomlTable());

		root.insert("name", "demo");
		root.insert("server", server);
		server.insert("host", "localhost");
		server.insert("ports", ports);
		server.insert("timeout", 2.5);
		server.insert("enabled", true);
		root.insert("replicas", replicas);
	}

	@Test
	void distinctKeysCoexist() {
		TomlTable table = new TomlTable();
		table.insert("a", 1);
		table.insert("b", 2);
		assertTrue(table.contains("a"));
		assertTrue(table.contains("b"));
		assertEquals(2, table.size());
		assertEquals(Set.of("a", "b"), table.keySet());
	}

	@Test
	void insertReplacesExistingKey() {
		TomlTable table = new TomlTable();
		table.insert("a", 1);
		table.insert("a", "one");
		assertEquals(1, table.size());
		assertEquals(Optional.of("one"), table.getAs("a", String.class));
	}

	@Test
	void get_missingKey_throws() {
		TomlKeyNotFoundException e = assertThrows(TomlKeyNotFoundException.class, () -> root.get("nope"));
		assertEquals("nope", e.key());
	}

	@Test
	void getQualified_matchesChainedLookup() {
		TomlNode chained = root.getTable("server").orElseThrow().get("host");
		assertSame(chained, root.getQualified("server.host"));
	}

	@Test
	void getQualified_missingSegment_throws() {
		assertThrows(TomlKeyNotFoundException.class, () -> root.getQualified("server.missing"));
		assertThrows(TomlKeyNotFoundException.class, () -> root.getQualified("missing.host"));
		assertThrows(TomlKeyNotFoundException.class, () -> root.getQualified("name.host"),
			"Intermediate segment is a value, not a table");
	}

	@Test
	void containsQualified_neverThrows() {
		assertTrue(root.containsQualified("server.ports"));
		assertTrue(root.containsQualified("name"));
		assertFalse(root.containsQualified("server.missing"));
		assertFalse(root.containsQualified("name.length"));
		assertFalse(root.containsQualified(""));
	}

	@Test
	void typedAccessors_absentAndWrongTypeAreBothEmpty() {
		assertEquals(Optional.of(server), root.getTable("server"));
		assertEquals(Optional.empty(), root.getTable("missing"));
		assertEquals(Optional.empty(), root.getTable("name"));

		assertEquals(Optional.of(ports), server.getArray("ports"));
		assertEquals(Optional.empty(), server.getArray("missing"));
		assertEquals(Optional.empty(), server.getArray("host"));

		assertEquals(Optional.of(replicas), root.getTableArray("replicas"));
		assertEquals(Optional.empty(), root.getTableArray("missing"));
		assertEquals(Optional.empty(), root.getTableArray("server"));
	}

	@Test
	void qualifiedTypedAccessors() {
		assertEquals(Optional.of(ports), root.getArrayQualified("server.ports"));
		assertEquals(Optional.empty(), root.getArrayQualified("server.host"));
		assertEquals(Optional.of(server), root.getTableQualified("server"));
		assertEquals(Optional.of(replicas), root.getTableArrayQualified("replicas"));
		assertEquals(Optional.empty(), root.getTableArrayQualified("server.replicas"));
	}

	@Test
	void getAs_unwrapsMatchingScalars() {
		assertEquals(Optional.of("demo"), root.getAs("name", String.class));
		assertEquals(Optional.of(2.5), server.getAs("timeout", Double.class));
		assertEquals(Optional.of(true), server.getAs("enabled", Boolean.class));
		assertEquals(Optional.of("localhost"), root.getQualifiedAs("server.host", String.class));
	}

	@Test
	void getAs_acceptsPrimitiveClasses() {
		TomlTable table = new TomlTable();
		table.insert("n", 42);
		assertEquals(Optional.of(42L), table.getAs("n", long.class));
		assertEquals(Optional.of(42L), table.getAs("n", Long.class));
	}

	@Test
	void getAs_absentAndWrongTypeAreBothEmpty() {
		assertEquals(Optional.empty(), root.getAs("missing", String.class));
		assertEquals(Optional.empty(), root.getAs("name", Long.class));
		assertEquals(Optional.empty(), root.getAs("server", String.class));
		assertEquals(Optional.empty(), server.getAs("timeout", Long.class), "No numeric coercion");
		assertEquals(Optional.empty(), root.getQualifiedAs("server.missing", String.class));
		assertEquals(Optional.empty(), root.getQualifiedAs("missing.host", String.class));
		assertEquals(Optional.empty(), root.getAs("name", Integer.class), "Not a TOML scalar type");
	}

	@Test
	void insertDateTime_normalizesToUtc() {
		TomlTable table = new TomlTable();
		table.insert("when", OffsetDateTime.parse("2020-01-01T12:00:00+02:00"));
		assertEquals(
			Optional.of(OffsetDateTime.of(2020, 1, 1, 10, 0, 0, 0, UTC)),
			table.getAs("when", OffsetDateTime.class));
	}

	@Test
	void downcasts() {
		TomlNode node = root.get("server");
		assertTrue(node.isTable());
		assertFalse(node.isValue());
		assertFalse(node.isArray());
		assertFalse(node.isTableArray());
		assertEquals(Optional.of(server), node.asTable());
		assertEquals(Optional.empty(), node.asArray());
		assertEquals(Optional.empty(), node.asTableArray());
		assertEquals(Optional.empty(), node.as(String.class));
		assertEquals(Optional.empty(), node.as(ValueType.STRING));
	}

	@Test
	void entrySetIsUnmodifiable() {
		assertThrows(UnsupportedOperationException.class, () -> root.keySet().remove("name"));
	}
}
