package org.javai.latexify.expr;

/**
 * Visitor interface for traversing expression trees.
 * 
 * One method per {@link Expression} variant. Implementations are expected to recurse
 * into children themselves by calling {@link Expression#accept(ExpressionVisitor)}.
 * 
 * @param <R> the return type of the visitor operations
 */
public interface ExpressionVisitor<R> {

	R visitConstant(Constant constant);

	R visitIdentifier(Identifier identifier);

	R visitCall(Call call);

	R visitUnaryOp(UnaryOp unaryOp);

	R visitBinOp(BinOp binOp);

	R visitBoolOp(BoolOp boolOp);

	R visitCompare(Compare compare);

	R visitSet(SetLiteral set);

	R visitTuple(TupleLiteral tuple);

	/**
	 * Visits syntax the parser accepted but that has no typeset form.
	 */
	R visitUnsupported(Unsupported unsupported);
}
