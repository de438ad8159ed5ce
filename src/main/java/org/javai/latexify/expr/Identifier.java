package org.javai.latexify.expr;

import java.util.Objects;

/**
 * A variable or function name.
 */
public record Identifier(String name) implements Expression {

	public Identifier {
		Objects.requireNonNull(name, "name must not be null");
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Identifier name must not be empty");
		}
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitIdentifier(this);
	}

	@Override
	public String kind() {
		return "Name";
	}
}
