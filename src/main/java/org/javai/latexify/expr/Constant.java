package org.javai.latexify.expr;

import java.math.BigInteger;

/**
 * A literal value.
 * 
 * The value is one of:
 * - {@link BigInteger} for integer literals
 * - {@link Double} for floating point literals
 * - {@link String} for string literals
 * - {@link Boolean} for {@code True} and {@code False}
 * - {@code null} for {@code None}
 * 
 * Only the first three kinds have a typeset form.
 */
public record Constant(Object value) implements Expression {

	public Constant {
		if (value != null && !(value instanceof BigInteger || value instanceof Double
				|| value instanceof String || value instanceof Boolean)) {
			throw new IllegalArgumentException("Unsupported constant type: " + value.getClass().getName());
		}
	}

	public static Constant ofInteger(long value) {
		return new Constant(BigInteger.valueOf(value));
	}

	public static Constant ofInteger(BigInteger value) {
		return new Constant(value);
	}

	public static Constant ofFloat(double value) {
		return new Constant(value);
	}

	public static Constant ofString(String value) {
		return new Constant(value);
	}

	public static Constant ofBoolean(boolean value) {
		return new Constant(value);
	}

	public static Constant none() {
		return new Constant(null);
	}

	public boolean isNumeric() {
		return value instanceof BigInteger || value instanceof Double;
	}

	public boolean isString() {
		return value instanceof String;
	}

	/**
	 * The name of the value's type as the expression language spells it.
	 */
	public String typeName() {
		if (value instanceof BigInteger) {
			return "int";
		}
		if (value instanceof Double) {
			return "float";
		}
		if (value instanceof String) {
			return "str";
		}
		if (value instanceof Boolean) {
			return "bool";
		}
		return "NoneType";
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitConstant(this);
	}

	@Override
	public String kind() {
		return "Constant";
	}
}
