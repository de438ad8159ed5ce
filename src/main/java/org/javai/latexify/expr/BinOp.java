package org.javai.latexify.expr;

import java.util.Objects;

/**
 * An infix operator applied to two operands.
 */
public record BinOp(Operator op, Expression left, Expression right) implements Expression {

	public enum Operator {
		ADD,        // +
		SUB,        // -
		MUL,        // *
		DIV,        // /
		FLOOR_DIV,  // //
		MOD,        // %
		POW,        // **
		LSHIFT,     // <<
		RSHIFT,     // >>
		BIT_OR,     // |
		BIT_XOR,    // ^
		BIT_AND,    // &
		MAT_MUL     // @
	}

	public BinOp {
		Objects.requireNonNull(op, "op must not be null");
		Objects.requireNonNull(left, "left must not be null");
		Objects.requireNonNull(right, "right must not be null");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitBinOp(this);
	}

	@Override
	public String kind() {
		return "BinOp";
	}
}
