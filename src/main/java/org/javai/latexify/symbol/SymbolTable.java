package org.javai.latexify.symbol;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;

/**
 * Immutable mapping from identifier names to the LaTeX markup typeset in their place.
 *
 * The default table (Greek letters, the Hebrew letters used in set theory and
 * {@code infinity}) is read once from {@code META-INF/latexify-symbols.yml} on first use.
 * Lookups are exact: {@code theta} and {@code Theta} are different entries.
 */
public final class SymbolTable {

	public static final String DEFAULT_RESOURCE = "META-INF/latexify-symbols.yml";

	private final Map<String, String> symbols;

	private SymbolTable(Map<String, String> symbols) {
		this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
	}

	/**
	 * The table bundled with the library.
	 */
	public static SymbolTable defaults() {
		return DefaultHolder.INSTANCE;
	}

	public static SymbolTable of(Map<String, String> symbols) {
		if (symbols == null) {
			throw new IllegalArgumentException("symbols cannot be null");
		}
		return new SymbolTable(symbols);
	}

	/**
	 * Parses a table from YAML with a top-level {@code symbols} mapping.
	 *
	 * @throws IllegalStateException if the document is malformed
	 */
	public static SymbolTable parse(InputStream inputStream) {
		Object data;
		try {
			data = new Yaml().load(inputStream);
		} catch (Exception e) {
			throw new IllegalStateException("Failed to read symbol table", e);
		}
		if (!(data instanceof Map<?, ?> root) || !(root.get("symbols") instanceof Map<?, ?> entries)) {
			throw new IllegalStateException("Symbol table must contain a 'symbols' mapping");
		}
		Map<String, String> symbols = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : entries.entrySet()) {
			if (entry.getValue() == null) {
				throw new IllegalStateException("Symbol '" + entry.getKey() + "' has no markup");
			}
			symbols.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
		}
		return new SymbolTable(symbols);
	}

	static SymbolTable load(String resource) {
		try (InputStream stream = SymbolTable.class.getClassLoader().getResourceAsStream(resource)) {
			if (stream == null) {
				throw new IllegalStateException("Could not load symbol table resource: " + resource);
			}
			return parse(stream);
		} catch (IOException e) {
			throw new IllegalStateException("Failed to close symbol table resource: " + resource, e);
		}
	}

	public Optional<String> lookup(String name) {
		return Optional.ofNullable(symbols.get(name));
	}

	public boolean contains(String name) {
		return symbols.containsKey(name);
	}

	public int size() {
		return symbols.size();
	}

	public Map<String, String> asMap() {
		return symbols;
	}

	private static final class DefaultHolder {
		private static final SymbolTable INSTANCE = load(DEFAULT_RESOURCE);
	}
}
