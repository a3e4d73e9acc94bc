/**
 * Line-oriented recursive-descent parsing of TOML text into a {@link works.bosk.toml.tree tree}.
 */
package works.bosk.toml.parse;
