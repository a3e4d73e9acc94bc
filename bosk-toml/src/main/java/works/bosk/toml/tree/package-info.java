/**
 * The in-memory form of a TOML document.
 * <p>
 * A document is a tree rooted at a {@link works.bosk.toml.tree.TomlTable}.
 * Tables map keys to any kind of {@link works.bosk.toml.tree.TomlNode};
 * {@link works.bosk.toml.tree.TomlTableArray}s hold the tables
 * declared by repeated {@code [[key]]} headers;
 * {@link works.bosk.toml.tree.TomlArray}s hold homogeneous scalars or nested arrays;
 * and {@link works.bosk.toml.tree.TomlValue}s are the leaves.
 * <p>
 * Nodes are narrowed with the {@code as...} methods, which return an empty
 * {@link java.util.Optional} instead of throwing when the node is of another kind.
 * <p>
 * The tree is built by a single thread during parsing.
 * Once built, it may be read concurrently as long as nobody inserts into it.
 */
package works.bosk.toml.tree;
