package org.javai.latexify.render;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.javai.latexify.expr.BinOp;
import org.javai.latexify.expr.BoolOp;
import org.javai.latexify.expr.Call;
import org.javai.latexify.expr.Compare;
import org.javai.latexify.expr.Constant;
import org.javai.latexify.expr.Expression;
import org.javai.latexify.expr.ExpressionVisitor;
import org.javai.latexify.expr.Identifier;
import org.javai.latexify.expr.SetLiteral;
import org.javai.latexify.expr.TupleLiteral;
import org.javai.latexify.expr.UnaryOp;
import org.javai.latexify.expr.Unsupported;
import org.javai.latexify.symbol.SymbolTable;

/**
 * Visitor that generates LaTeX math-mode markup from an expression tree.
 *
 * Every node kind has a typeset form. Syntax without one (lists, attribute access,
 * {@code True}, ...) becomes an inline {@code ?Kind?} placeholder instead of an error,
 * so one odd sub-expression never costs the whole formula.
 *
 * A handful of function names are typeset specially rather than as {@code f(x, y)}:
 * <ul>
 *   <li>{@code integral}, {@code sum}, {@code product}: big operator with optional
 *       lower bound, upper bound and trailing variable</li>
 *   <li>{@code d}: derivative, marked with a prime</li>
 *   <li>{@code abs}, {@code floor}, {@code ceil}: delimiter pairs</li>
 *   <li>{@code root}, {@code sqrt}, {@code cbrt}: radicals</li>
 * </ul>
 * Their argument counts are checked and a {@link LatexRenderException} is thrown when a
 * required argument is missing.
 *
 * The visitor keeps no state between nodes and never modifies the tree, so rendering
 * the same tree twice gives the same markup.
 */
public class LatexNodeVisitor implements ExpressionVisitor<String> {

	private final SymbolTable symbols;

	public LatexNodeVisitor() {
		this(SymbolTable.defaults());
	}

	public LatexNodeVisitor(SymbolTable symbols) {
		if (symbols == null) {
			throw new IllegalArgumentException("Symbol table cannot be null");
		}
		this.symbols = symbols;
	}

	/**
	 * Generate LaTeX markup from an expression tree using the default symbol table.
	 */
	public static String generate(Expression expression) {
		return expression.accept(new LatexNodeVisitor());
	}

	public String render(Expression expression) {
		return expression.accept(this);
	}

	@Override
	public String visitConstant(Constant constant) {
		Object value = constant.value();
		if (value instanceof String text) {
			return "\\text{" + text + "}";
		}
		if (value instanceof BigInteger integer) {
			return integer.toString().strip();
		}
		if (value instanceof Double number) {
			return PythonNumberFormat.format(number).strip();
		}
		return placeholder(constant.typeName());
	}

	/**
	 * Names are split at the first underscore. When the part before it is in the symbol
	 * table, the symbol replaces it and the rest becomes a subscript; otherwise the name
	 * is kept as written.
	 */
	@Override
	public String visitIdentifier(Identifier identifier) {
		String name = identifier.name();
		int underscore = name.indexOf('_');
		String head = underscore < 0 ? name : name.substring(0, underscore);

		Optional<String> symbol = symbols.lookup(head);
		if (symbol.isEmpty()) {
			return name;
		}
		StringBuilder sb = new StringBuilder(symbol.get());
		if (underscore >= 0) {
			sb.append("_{").append(name.substring(underscore + 1)).append('}');
		}
		return sb.toString();
	}

	@Override
	public String visitCall(Call call) {
		return switch (call.name()) {
			case "integral" -> visitIterated("\\int", call);
			case "sum" -> visitIterated("\\sum", call);
			case "product" -> visitIterated("\\prod", call);
			case "d" -> visitDerivative(call);
			case "abs" -> visitDelimited("\\left|{}", "\\right|{}", call);
			case "floor" -> visitDelimited("\\lfloor{}", "\\rfloor{}", call);
			case "ceil" -> visitDelimited("\\lceil{}", "\\rceil{}", call);
			case "root" -> visitRoot(call);
			case "sqrt" -> visitRadical("", call);
			case "cbrt" -> visitRadical("3", call);
			default -> visitFunction(call);
		};
	}

	@Override
	public String visitUnaryOp(UnaryOp unaryOp) {
		return switch (unaryOp.op()) {
			case PLUS -> "+" + render(unaryOp.operand());
			case MINUS -> "-" + render(unaryOp.operand());
			case NOT -> "\\neg{}" + render(unaryOp.operand());
			case INVERT -> visitInvert(unaryOp.operand());
		};
	}

	@Override
	public String visitBinOp(BinOp binOp) {
		String left = render(binOp.left());
		String right = render(binOp.right());
		return switch (binOp.op()) {
			case ADD -> left + " + " + right;
			case SUB -> left + " - " + right;
			case MUL -> left + "\\cdot{}" + right;
			// Floor division is typeset as an ordinary fraction.
			case DIV, FLOOR_DIV -> "\\dfrac{" + left + "}{" + right + "}";
			case MOD -> left + "\\text{{ mod }}" + right;
			case POW -> left + "^{" + right + "}";
			case LSHIFT -> left + "\\lll{}" + right;
			case RSHIFT -> left + "\\ggg{}" + right;
			case BIT_OR -> left + "\\lor{}" + right;
			case BIT_XOR -> left + "\\oplus{}" + right;
			case BIT_AND -> left + "\\land{}" + right;
			case MAT_MUL -> left + " \\cdot{}" + right;
		};
	}

	/**
	 * All operands of the chain are rendered, with the connective between each adjacent pair.
	 */
	@Override
	public String visitBoolOp(BoolOp boolOp) {
		String connective = switch (boolOp.op()) {
			case AND -> "\\land{}";
			case OR -> "\\lor{}";
		};
		return join(boolOp.operands(), connective);
	}

	@Override
	public String visitCompare(Compare compare) {
		StringBuilder sb = new StringBuilder(render(compare.left()));
		for (int i = 0; i < compare.ops().size(); i++) {
			sb.append(comparisonSymbol(compare.ops().get(i)));
			sb.append(render(compare.comparators().get(i)));
		}
		return sb.toString();
	}

	@Override
	public String visitSet(SetLiteral set) {
		return "\\left\\{" + join(set.elements(), ",") + "\\right\\}";
	}

	@Override
	public String visitTuple(TupleLiteral tuple) {
		return join(tuple.elements(), ",\\;{}");
	}

	@Override
	public String visitUnsupported(Unsupported unsupported) {
		return placeholder(unsupported.kind());
	}

	protected String comparisonSymbol(Compare.Operator op) {
		return switch (op) {
			case EQ, IS -> "=";
			case NOT_EQ, IS_NOT -> "\\neq{}";
			case LT -> "<";
			case LT_E -> "\\leqslant{}";
			case GT -> ">";
			case GT_E -> "\\geqslant{}";
			case IN -> "\\in{}";
			case NOT_IN -> "\\notin{}";
		};
	}

	/**
	 * {@code integral(body, lower, upper, variable)}: bounds and variable are optional and
	 * independent of each other.
	 */
	protected String visitIterated(String operator, Call call) {
		List<Expression> args = requireArguments(call, 1);
		StringBuilder sb = new StringBuilder(operator);
		if (args.size() > 2) {
			sb.append("^{").append(render(args.get(2)).strip()).append('}');
		}
		if (args.size() > 1) {
			sb.append("_{").append(render(args.get(1)).strip()).append('}');
		}
		sb.append('{').append(render(args.get(0)));
		if (args.size() > 3) {
			sb.append("\\;{}").append(render(args.get(3)).strip());
		}
		sb.append('}');
		return sb.toString();
	}

	/**
	 * {@code d(f(x))} renders {@code f'(x)}; a name or number gets a trailing prime and
	 * anything else is parenthesized first. The renamed call is a new node, the tree
	 * itself is left as it was.
	 */
	protected String visitDerivative(Call call) {
		Expression target = requireArguments(call, 1).get(0);
		if (target instanceof Call function) {
			return render(function.withName(function.name() + "'"));
		}
		if (target instanceof Identifier || target instanceof Constant) {
			return render(target) + "'";
		}
		return "\\left({}" + render(target) + "\\right){}'";
	}

	protected String visitDelimited(String open, String close, Call call) {
		Expression argument = requireArguments(call, 1).get(0);
		return open + render(argument) + close;
	}

	/**
	 * {@code root(n, x)}: the first argument is the index, the last the radicand.
	 */
	protected String visitRoot(Call call) {
		List<Expression> args = requireArguments(call, 2);
		return radical(render(args.get(0)), args.get(args.size() - 1));
	}

	protected String visitRadical(String index, Call call) {
		List<Expression> args = requireArguments(call, 1);
		return radical(index, args.get(args.size() - 1));
	}

	protected String visitFunction(Call call) {
		return call.name() + "(" + join(call.args(), ", ") + ")";
	}

	/**
	 * Only a bare name can be overlined. The raw name is used, without symbol
	 * substitution or subscripts.
	 */
	protected String visitInvert(Expression operand) {
		if (operand instanceof Identifier identifier) {
			return "\\overline{" + identifier.name() + "}";
		}
		throw new LatexRenderException("Bitwise inversion is only supported on a name, got " + operand.kind());
	}

	private String radical(String index, Expression radicand) {
		return "\\sqrt[" + index + "]{" + render(radicand) + "}";
	}

	private String join(List<Expression> expressions, String separator) {
		return expressions.stream()
				.map(this::render)
				.collect(Collectors.joining(separator));
	}

	private static List<Expression> requireArguments(Call call, int minimum) {
		List<Expression> args = call.args();
		if (args.size() < minimum) {
			throw new LatexRenderException("'" + call.name() + "' needs at least " + minimum
					+ (minimum == 1 ? " argument" : " arguments") + ", got " + args.size());
		}
		return args;
	}

	private static String placeholder(String kind) {
		return "?" + kind + "?";
	}
}
