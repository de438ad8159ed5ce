package org.javai.latexify.parse;

/**
 * Exception thrown when parsing expression source text fails.
 */
public class ExpressionParseException extends RuntimeException {

	public ExpressionParseException(String message) {
		super(message);
	}

	public ExpressionParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
