package org.javai.latexify.expr;

import java.util.List;

/**
 * A set display, {@code {a, b, c}}.
 */
public record SetLiteral(List<Expression> elements) implements Expression {

	public SetLiteral {
		elements = elements != null ? List.copyOf(elements) : List.of();
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitSet(this);
	}

	@Override
	public String kind() {
		return "Set";
	}
}
