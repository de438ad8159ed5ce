package org.javai.latexify.expr;

import java.util.List;
import java.util.Objects;

/**
 * A function application. The callee is always a plain identifier.
 */
public record Call(Identifier callee, List<Expression> args) implements Expression {

	public Call {
		Objects.requireNonNull(callee, "callee must not be null");
		args = args != null ? List.copyOf(args) : List.of();
	}

	public static Call of(String name, Expression... args) {
		return new Call(new Identifier(name), List.of(args));
	}

	public String name() {
		return callee.name();
	}

	/**
	 * Returns a copy of this call with a different function name and the same arguments.
	 */
	public Call withName(String name) {
		return new Call(new Identifier(name), args);
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitCall(this);
	}

	@Override
	public String kind() {
		return "Call";
	}
}
