package org.javai.latexify.config;

/**
 * Exception thrown when configuration cannot be read or is invalid.
 */
public class LatexifyConfigException extends RuntimeException {

	public LatexifyConfigException(String message) {
		super(message);
	}

	public LatexifyConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
