package org.javai.latexify.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Settings for document assembly, compilation and output naming.
 * 
 * Instances are normally produced by {@link LatexifyConfigLoader}; the bundled defaults
 * live in {@code META-INF/latexify-defaults.yml}.
 */
public record LatexifyConfig(DocumentSettings document, CompilerSettings compiler, OutputSettings output) {

	public LatexifyConfig {
		Objects.requireNonNull(document, "document settings must not be null");
		Objects.requireNonNull(compiler, "compiler settings must not be null");
		Objects.requireNonNull(output, "output settings must not be null");
	}

	/**
	 * @param classOptions options passed to the {@code standalone} document class
	 * @param packages packages loaded in the preamble, in order
	 */
	public record DocumentSettings(String classOptions, List<String> packages) {

		public DocumentSettings {
			classOptions = classOptions != null ? classOptions : "";
			packages = packages != null ? List.copyOf(packages) : List.of();
		}
	}

	/**
	 * @param command the compiler executable and its fixed arguments; the job name is appended
	 * @param workingDirectory where the compiler runs and leaves its artifacts
	 * @param jobPrefix prefix of the per-invocation job name
	 * @param intermediateExtensions artifacts deleted after every compilation
	 * @param imageExtension extension of the image the document class converts to
	 */
	public record CompilerSettings(List<String> command, Path workingDirectory, String jobPrefix,
			List<String> intermediateExtensions, String imageExtension) {

		public CompilerSettings {
			command = command != null ? List.copyOf(command) : List.of();
			if (command.isEmpty()) {
				throw new LatexifyConfigException("Compiler command must not be empty");
			}
			workingDirectory = workingDirectory != null ? workingDirectory : Path.of(".");
			jobPrefix = jobPrefix != null ? jobPrefix : "";
			intermediateExtensions = intermediateExtensions != null ? List.copyOf(intermediateExtensions) : List.of();
			if (imageExtension == null || imageExtension.isBlank()) {
				throw new LatexifyConfigException("Image extension must not be empty");
			}
		}
	}

	/**
	 * @param filePrefix prefix of generated image file names
	 * @param timestampPattern {@link java.time.format.DateTimeFormatter} pattern appended to the prefix
	 */
	public record OutputSettings(String filePrefix, String timestampPattern) {

		public OutputSettings {
			filePrefix = filePrefix != null ? filePrefix : "";
			if (timestampPattern == null || timestampPattern.isBlank()) {
				throw new LatexifyConfigException("Timestamp pattern must not be empty");
			}
		}
	}
}
