package org.javai.latexify.expr;

import java.util.Objects;

/**
 * A prefix operator applied to a single operand.
 */
public record UnaryOp(Operator op, Expression operand) implements Expression {

	public enum Operator {
		PLUS,      // +x
		MINUS,     // -x
		NOT,       // not x
		INVERT     // ~x
	}

	public UnaryOp {
		Objects.requireNonNull(op, "op must not be null");
		Objects.requireNonNull(operand, "operand must not be null");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitUnaryOp(this);
	}

	@Override
	public String kind() {
		return "UnaryOp";
	}
}
