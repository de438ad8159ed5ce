package org.javai.latexify.compile;

import java.nio.file.Path;

/**
 * Outcome of a {@link LatexCompiler} run.
 *
 * @param success whether the image was produced
 * @param output the image location on success, {@code null} otherwise
 * @param message why compilation failed, {@code null} on success
 */
public record CompileResult(boolean success, Path output, String message) {

	public static CompileResult success(Path output) {
		return new CompileResult(true, output, null);
	}

	public static CompileResult failure(String message) {
		return new CompileResult(false, null, message);
	}
}
