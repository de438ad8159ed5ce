package org.javai.latexify.expr;

/**
 * A node of a parsed expression tree.
 * 
 * The set of node kinds is closed: every variant is a record in this package and
 * operations over the tree are written as {@link ExpressionVisitor} implementations,
 * so adding a variant forces every visitor to handle it.
 * 
 * Trees are immutable and acyclic. A tree is built once per source string by the
 * parser and handed to a renderer.
 */
public sealed interface Expression
		permits Constant, Identifier, Call, UnaryOp, BinOp, BoolOp, Compare, SetLiteral, TupleLiteral, Unsupported {

	/**
	 * Accepts a visitor and dispatches to the visitor method for this node kind.
	 * 
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	<R> R accept(ExpressionVisitor<R> visitor);

	/**
	 * The name of this node kind, used in diagnostics and placeholders.
	 */
	String kind();
}
