package org.javai.latexify.expr;

import java.util.List;
import java.util.Objects;

/**
 * A chained comparison such as {@code a < b <= c}.
 * 
 * {@code ops.get(i)} sits between the previous operand and {@code comparators.get(i)},
 * so both lists always have the same length.
 */
public record Compare(Expression left, List<Operator> ops, List<Expression> comparators) implements Expression {

	public enum Operator {
		EQ,        // ==
		NOT_EQ,    // !=
		LT,        // <
		LT_E,      // <=
		GT,        // >
		GT_E,      // >=
		IS,        // is
		IS_NOT,    // is not
		IN,        // in
		NOT_IN     // not in
	}

	public Compare {
		Objects.requireNonNull(left, "left must not be null");
		ops = ops != null ? List.copyOf(ops) : List.of();
		comparators = comparators != null ? List.copyOf(comparators) : List.of();
		if (ops.isEmpty()) {
			throw new IllegalArgumentException("Comparison needs at least one operator");
		}
		if (ops.size() != comparators.size()) {
			throw new IllegalArgumentException("Comparison has " + ops.size() + " operators but "
					+ comparators.size() + " comparators");
		}
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitCompare(this);
	}

	@Override
	public String kind() {
		return "Compare";
	}
}
