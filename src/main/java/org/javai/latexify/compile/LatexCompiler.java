package org.javai.latexify.compile;

import java.nio.file.Path;

/**
 * Compiles a complete LaTeX document into an image file.
 *
 * Implementations report failure through the returned {@link CompileResult} rather
 * than by throwing, and remove their intermediate artifacts whatever the outcome.
 */
public interface LatexCompiler {

	/**
	 * @param document the full document source, preamble included
	 * @param output where the image should end up
	 * @return the outcome; on success {@link CompileResult#output()} is {@code output}
	 */
	CompileResult compile(String document, Path output);
}
