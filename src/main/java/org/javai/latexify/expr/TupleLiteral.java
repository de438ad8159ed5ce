package org.javai.latexify.expr;

import java.util.List;

/**
 * A comma separated list of expressions, with or without surrounding parentheses.
 */
public record TupleLiteral(List<Expression> elements) implements Expression {

	public TupleLiteral {
		elements = elements != null ? List.copyOf(elements) : List.of();
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitTuple(this);
	}

	@Override
	public String kind() {
		return "Tuple";
	}
}
