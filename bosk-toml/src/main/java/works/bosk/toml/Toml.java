package works.bosk.toml;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.toml.exceptions.TomlParseException;
import works.bosk.toml.parse.TomlParser;
import works.bosk.toml.parse.TomlParser.Settings;
import works.bosk.toml.print.TomlPrinter;
import works.bosk.toml.tree.TomlNode;
import works.bosk.toml.tree.TomlTable;

/**
 * Entry points for reading TOML configuration into a {@link TomlTable}
 * and printing it back out.
 * <p>
 * Each call parses its whole input before returning.
 * Callers that supply a {@link Reader} or {@link InputStream} remain responsible for closing it;
 * {@link #parseFile} closes the file itself whether or not parsing succeeds.
 */
public final class Toml {
	private Toml() { }

	public static TomlTable parse(String text) {
		return parse(new StringReader(text));
	}

	public static TomlTable parse(Reader reader) {
		return parse(reader, Settings.DEFAULT);
	}

	public static TomlTable parse(Reader reader, Settings settings) {
		return new TomlParser(reader, settings).parse();
	}

	public static TomlTable parse(InputStream stream) {
		return parse(stream, Settings.DEFAULT);
	}

	/**
	 * @param settings its {@link Settings#charset() charset} decodes the stream
	 * @throws TomlParseException if the stream is not valid in that charset
	 */
	public static TomlTable parse(InputStream stream, Settings settings) {
		CharsetDecoder decoder = settings.charset().newDecoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
		return parse(new InputStreamReader(stream, decoder), settings);
	}

	public static TomlTable parseFile(Path path) {
		return parseFile(path, Settings.DEFAULT);
	}

	/**
	 * @throws TomlParseException if the file can't be opened, or its contents are not valid
	 */
	public static TomlTable parseFile(Path path, Settings settings) {
		LOGGER.debug("Parsing {}", path);
		if (Files.isDirectory(path)) {
			throw new TomlParseException(path + " could not be opened for parsing");
		}
		BufferedReader reader;
		try {
			reader = Files.newBufferedReader(path, settings.charset());
		} catch (IOException e) {
			throw new TomlParseException(path + " could not be opened for parsing", e);
		}
		try (reader) {
			return parse(reader, settings);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to close " + path, e);
		}
	}

	/**
	 * @return the text {@link TomlPrinter#DEFAULT} produces for {@code node}
	 */
	public static String print(TomlNode node) {
		return TomlPrinter.DEFAULT.toText(node);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Toml.class);
}
