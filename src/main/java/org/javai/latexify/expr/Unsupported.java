package org.javai.latexify.expr;

import java.util.List;
import java.util.Objects;

/**
 * Syntax that parses but has no typeset form: lists, dicts, attribute access,
 * subscripts and conditional expressions.
 * 
 * The node keeps its children so the tree stays complete for other visitors;
 * renderers typically emit a placeholder naming {@link #kind()}.
 */
public record Unsupported(String kind, List<Expression> children) implements Expression {

	public Unsupported {
		Objects.requireNonNull(kind, "kind must not be null");
		children = children != null ? List.copyOf(children) : List.of();
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitUnsupported(this);
	}
}
