package org.javai.latexify.document;

import java.util.Objects;

/**
 * Result of rendering one source expression: either its math-mode markup or the
 * reason it could not be rendered.
 *
 * @param source the expression as given
 * @param latex the delimited markup, or {@code null} on failure
 * @param error the failure message, or {@code null} on success
 */
public record RenderOutcome(String source, String latex, String error) {

	public RenderOutcome {
		Objects.requireNonNull(source, "source must not be null");
		if ((latex == null) == (error == null)) {
			throw new IllegalArgumentException("Exactly one of latex and error must be set");
		}
	}

	public static RenderOutcome success(String source, String latex) {
		return new RenderOutcome(source, latex, null);
	}

	public static RenderOutcome failure(String source, String error) {
		return new RenderOutcome(source, null, error);
	}

	public boolean isSuccess() {
		return latex != null;
	}
}
