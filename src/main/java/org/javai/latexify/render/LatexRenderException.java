package org.javai.latexify.render;

/**
 * Exception thrown when an expression cannot be typeset, e.g. a special form
 * called with fewer arguments than it needs.
 */
public class LatexRenderException extends RuntimeException {

	public LatexRenderException(String message) {
		super(message);
	}

	public LatexRenderException(String message, Throwable cause) {
		super(message, cause);
	}
}
