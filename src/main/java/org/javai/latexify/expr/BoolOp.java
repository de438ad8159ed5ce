package org.javai.latexify.expr;

import java.util.List;
import java.util.Objects;

/**
 * A boolean combinator over a chain of at least two operands, e.g. {@code a and b and c}.
 */
public record BoolOp(Operator op, List<Expression> operands) implements Expression {

	public enum Operator {
		AND,
		OR
	}

	public BoolOp {
		Objects.requireNonNull(op, "op must not be null");
		operands = operands != null ? List.copyOf(operands) : List.of();
		if (operands.size() < 2) {
			throw new IllegalArgumentException("Boolean operator needs at least two operands, got " + operands.size());
		}
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitBoolOp(this);
	}

	@Override
	public String kind() {
		return "BoolOp";
	}
}
