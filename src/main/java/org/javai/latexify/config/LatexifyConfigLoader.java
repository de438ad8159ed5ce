package org.javai.latexify.config;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link LatexifyConfig} from YAML.
 *
 * The bundled defaults are always read first. A user file only needs the keys it changes:
 * its mappings are merged into the defaults key by key, while lists and scalars replace
 * the default value outright.
 */
public class LatexifyConfigLoader {

	public static final String DEFAULTS_RESOURCE = "META-INF/latexify-defaults.yml";

	private static final Logger logger = LoggerFactory.getLogger(LatexifyConfigLoader.class);

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the bundled defaults.
	 */
	public LatexifyConfig loadDefaults() {
		return buildConfig(readDefaults());
	}

	/**
	 * Loads the defaults overridden by the given file.
	 */
	public LatexifyConfig load(Path path) {
		Map<String, Object> overrides;
		try (var reader = Files.newBufferedReader(path)) {
			overrides = asMap(yaml.load(reader), "root");
		} catch (LatexifyConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new LatexifyConfigException("Failed to read configuration from path: " + path, e);
		}
		logger.debug("Applying configuration overrides from {}", path);
		return buildConfig(merge(readDefaults(), overrides));
	}

	/**
	 * Loads the defaults overridden by the given YAML text.
	 */
	public LatexifyConfig loadString(String yamlContent) {
		Map<String, Object> overrides;
		try {
			overrides = asMap(yaml.load(yamlContent), "root");
		} catch (LatexifyConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new LatexifyConfigException("Failed to parse configuration from string", e);
		}
		return buildConfig(merge(readDefaults(), overrides));
	}

	private Map<String, Object> readDefaults() {
		try (InputStream stream = getClass().getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (stream == null) {
				throw new LatexifyConfigException("Could not load configuration resource: " + DEFAULTS_RESOURCE);
			}
			return asMap(yaml.load(stream), "root");
		} catch (LatexifyConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new LatexifyConfigException("Failed to parse configuration resource: " + DEFAULTS_RESOURCE, e);
		}
	}

	@SuppressWarnings("unchecked")
	static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overrides) {
		Map<String, Object> merged = new LinkedHashMap<>(base);
		for (Map.Entry<String, Object> entry : overrides.entrySet()) {
			Object current = merged.get(entry.getKey());
			Object override = entry.getValue();
			if (current instanceof Map && override instanceof Map) {
				merged.put(entry.getKey(), merge((Map<String, Object>) current, (Map<String, Object>) override));
			} else {
				merged.put(entry.getKey(), override);
			}
		}
		return merged;
	}

	private LatexifyConfig buildConfig(Map<String, Object> data) {
		return new LatexifyConfig(
				buildDocument(asMap(data.get("document"), "document")),
				buildCompiler(asMap(data.get("compiler"), "compiler")),
				buildOutput(asMap(data.get("output"), "output")));
	}

	private LatexifyConfig.DocumentSettings buildDocument(Map<String, Object> map) {
		return new LatexifyConfig.DocumentSettings(
				toString(map.get("class_options")),
				toStringList(map.get("packages"), "document.packages"));
	}

	private LatexifyConfig.CompilerSettings buildCompiler(Map<String, Object> map) {
		String workingDirectory = toString(map.get("working_directory"));
		return new LatexifyConfig.CompilerSettings(
				toStringList(map.get("command"), "compiler.command"),
				workingDirectory != null ? Path.of(workingDirectory) : null,
				toString(map.get("job_prefix")),
				toStringList(map.get("intermediate_extensions"), "compiler.intermediate_extensions"),
				toString(map.get("image_extension")));
	}

	private LatexifyConfig.OutputSettings buildOutput(Map<String, Object> map) {
		String pattern = toString(map.get("timestamp_pattern"));
		if (pattern != null) {
			try {
				DateTimeFormatter.ofPattern(pattern);
			} catch (IllegalArgumentException e) {
				throw new LatexifyConfigException("Invalid output.timestamp_pattern: " + pattern, e);
			}
		}
		return new LatexifyConfig.OutputSettings(toString(map.get("file_prefix")), pattern);
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String section) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new LatexifyConfigException("Section '" + section + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static List<String> toStringList(Object value, String key) {
		if (value == null) {
			return null;
		}
		if (!(value instanceof List<?> list)) {
			throw new LatexifyConfigException("'" + key + "' must be a list");
		}
		return list.stream().map(String::valueOf).toList();
	}

	private static String toString(Object value) {
		return value != null ? String.valueOf(value) : null;
	}
}
