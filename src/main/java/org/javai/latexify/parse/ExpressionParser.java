package org.javai.latexify.parse;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.javai.latexify.expr.BinOp;
import org.javai.latexify.expr.BoolOp;
import org.javai.latexify.expr.Call;
import org.javai.latexify.expr.Compare;
import org.javai.latexify.expr.Constant;
import org.javai.latexify.expr.Expression;
import org.javai.latexify.expr.Identifier;
import org.javai.latexify.expr.SetLiteral;
import org.javai.latexify.expr.TupleLiteral;
import org.javai.latexify.expr.UnaryOp;
import org.javai.latexify.expr.Unsupported;

/**
 * Recursive descent parser for a single expression.
 *
 * Grammar levels, loosest binding first:
 * <pre>
 * tuple      := test (',' test)* [',']
 * test       := or ['if' or 'else' test]
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | comparison
 * comparison := bitor (compop bitor)*
 * bitor      := xor ('|' xor)*
 * xor        := bitand ('^' bitand)*
 * bitand     := shift ('&' shift)*
 * shift      := arith (('&lt;&lt;' | '&gt;&gt;') arith)*
 * arith      := term (('+' | '-') term)*
 * term       := factor (('*' | '/' | '//' | '%' | '@') factor)*
 * factor     := ('+' | '-' | '~') factor | power
 * power      := primary ['**' factor]
 * primary    := atom (call | '.' NAME | '[' tuple ']')*
 * </pre>
 *
 * Nesting is limited to {@value #MAX_NESTING} levels of parentheses, calls, unary
 * operators and powers, and the resulting tree to {@value #MAX_DEPTH} levels including
 * left-associative operator chains. Deeper input is rejected with an
 * {@link ExpressionParseException} rather than exhausting the stack while parsing or
 * rendering.
 *
 * Chains of {@code and}/{@code or} become a single {@link BoolOp} holding every operand,
 * and comparison chains a single {@link Compare}. Lists, dicts, attribute access,
 * subscripts and conditional expressions parse to {@link Unsupported} nodes.
 *
 * Example usage:
 *
 * <pre>
 * Expression tree = ExpressionParser.parse("integral(x**2, 0, 1, dx)");
 * </pre>
 */
public class ExpressionParser {

	private static final Set<String> KEYWORDS = Set.of(
			"and", "or", "not", "in", "is", "if", "else", "lambda", "True", "False", "None");

	static final int MAX_NESTING = 200;
	static final int MAX_DEPTH = 1000;

	private final List<ExpressionToken> tokens;
	private int current = 0;
	private int nesting = 0;
	private int depth = 0;

	/**
	 * Creates a parser over the given tokens, which must end with an EOF token.
	 *
	 * @param tokens the tokens to parse
	 */
	public ExpressionParser(List<ExpressionToken> tokens) {
		if (tokens == null || tokens.isEmpty()
				|| !tokens.get(tokens.size() - 1).isType(ExpressionToken.TokenType.EOF)) {
			throw new IllegalArgumentException("Token list must end with an EOF token");
		}
		this.tokens = tokens;
	}

	/**
	 * Tokenizes and parses the given source text.
	 *
	 * @throws ExpressionParseException if the source is not a single valid expression
	 */
	public static Expression parse(String source) {
		ExpressionTokenizer tokenizer = new ExpressionTokenizer(source);
		return new ExpressionParser(tokenizer.tokenize()).parse();
	}

	/**
	 * Parses the tokens into one expression tree.
	 *
	 * @return the root of the tree
	 * @throws ExpressionParseException if syntax errors are encountered or input remains
	 */
	public Expression parse() {
		if (check(ExpressionToken.TokenType.EOF)) {
			throw new ExpressionParseException("Empty expression");
		}
		Expression expression = parseTuple();
		if (!check(ExpressionToken.TokenType.EOF)) {
			throw error("Unexpected " + peek());
		}
		return expression;
	}

	private Expression parseTuple() {
		Expression first = parseTest();
		if (!check(ExpressionToken.TokenType.COMMA)) {
			return first;
		}
		List<Expression> elements = new ArrayList<>();
		elements.add(first);
		while (match(ExpressionToken.TokenType.COMMA)) {
			if (!canStartExpression()) {
				break; // trailing comma
			}
			elements.add(parseTest());
		}
		return new TupleLiteral(elements);
	}

	private Expression parseTest() {
		if (peek().isIdentifier("lambda")) {
			throw error("Lambda expressions are not supported");
		}
		descend();
		try {
			Expression body = parseOr();
			if (matchKeyword("if")) {
				Expression condition = parseOr();
				if (!matchKeyword("else")) {
					throw error("Expected 'else' in conditional expression");
				}
				Expression orElse = parseTest();
				return new Unsupported("IfExp", List.of(condition, body, orElse));
			}
			return body;
		} finally {
			ascend();
		}
	}

	private Expression parseOr() {
		List<Expression> operands = new ArrayList<>();
		operands.add(parseAnd());
		while (matchKeyword("or")) {
			operands.add(parseAnd());
		}
		return operands.size() == 1 ? operands.get(0) : new BoolOp(BoolOp.Operator.OR, operands);
	}

	private Expression parseAnd() {
		List<Expression> operands = new ArrayList<>();
		operands.add(parseNot());
		while (matchKeyword("and")) {
			operands.add(parseNot());
		}
		return operands.size() == 1 ? operands.get(0) : new BoolOp(BoolOp.Operator.AND, operands);
	}

	private Expression parseNot() {
		if (matchKeyword("not")) {
			descend();
			try {
				return new UnaryOp(UnaryOp.Operator.NOT, parseNot());
			} finally {
				ascend();
			}
		}
		return parseComparison();
	}

	private Expression parseComparison() {
		Expression left = parseBitOr();
		List<Compare.Operator> ops = new ArrayList<>();
		List<Expression> comparators = new ArrayList<>();
		Compare.Operator op;
		while ((op = matchComparisonOperator()) != null) {
			ops.add(op);
			comparators.add(parseBitOr());
		}
		return ops.isEmpty() ? left : new Compare(left, ops, comparators);
	}

	private Compare.Operator matchComparisonOperator() {
		ExpressionToken token = peek();
		if (token.isType(ExpressionToken.TokenType.OPERATOR)) {
			Compare.Operator op = switch (token.value()) {
				case "==" -> Compare.Operator.EQ;
				case "!=" -> Compare.Operator.NOT_EQ;
				case "<" -> Compare.Operator.LT;
				case "<=" -> Compare.Operator.LT_E;
				case ">" -> Compare.Operator.GT;
				case ">=" -> Compare.Operator.GT_E;
				default -> null;
			};
			if (op != null) {
				advance();
			}
			return op;
		}
		if (matchKeyword("in")) {
			return Compare.Operator.IN;
		}
		if (token.isIdentifier("not") && peekNext().isIdentifier("in")) {
			advance();
			advance();
			return Compare.Operator.NOT_IN;
		}
		if (matchKeyword("is")) {
			return matchKeyword("not") ? Compare.Operator.IS_NOT : Compare.Operator.IS;
		}
		return null;
	}

	private Expression parseBitOr() {
		Expression left = parseBitXor();
		int links = 0;
		try {
			while (matchOperator("|")) {
				links += lengthen();
				left = new BinOp(BinOp.Operator.BIT_OR, left, parseBitXor());
			}
			return left;
		} finally {
			depth -= links;
		}
	}

	private Expression parseBitXor() {
		Expression left = parseBitAnd();
		int links = 0;
		try {
			while (matchOperator("^")) {
				links += lengthen();
				left = new BinOp(BinOp.Operator.BIT_XOR, left, parseBitAnd());
			}
			return left;
		} finally {
			depth -= links;
		}
	}

	private Expression parseBitAnd() {
		Expression left = parseShift();
		int links = 0;
		try {
			while (matchOperator("&")) {
				links += lengthen();
				left = new BinOp(BinOp.Operator.BIT_AND, left, parseShift());
			}
			return left;
		} finally {
			depth -= links;
		}
	}

	private Expression parseShift() {
		Expression left = parseArith();
		int links = 0;
		try {
			while (true) {
				if (matchOperator("<<")) {
					links += lengthen();
					left = new BinOp(BinOp.Operator.LSHIFT, left, parseArith());
				} else if (matchOperator(">>")) {
					links += lengthen();
					left = new BinOp(BinOp.Operator.RSHIFT, left, parseArith());
				} else {
					return left;
				}
			}
		} finally {
			depth -= links;
		}
	}

	private Expression parseArith() {
		Expression left = parseTerm();
		int links = 0;
		try {
			while (true) {
				if (matchOperator("+")) {
					links += lengthen();
					left = new BinOp(BinOp.Operator.ADD, left, parseTerm());
				} else if (matchOperator("-")) {
					links += lengthen();
					left = new BinOp(BinOp.Operator.SUB, left, parseTerm());
				} else {
					return left;
				}
			}
		} finally {
			depth -= links;
		}
	}

	private Expression parseTerm() {
		Expression left = parseFactor();
		int links = 0;
		try {
			while (peek().isType(ExpressionToken.TokenType.OPERATOR)) {
				BinOp.Operator op = switch (peek().value()) {
					case "*" -> BinOp.Operator.MUL;
					case "/" -> BinOp.Operator.DIV;
					case "//" -> BinOp.Operator.FLOOR_DIV;
					case "%" -> BinOp.Operator.MOD;
					case "@" -> BinOp.Operator.MAT_MUL;
					default -> null;
				};
				if (op == null) {
					break;
				}
				advance();
				links += lengthen();
				left = new BinOp(op, left, parseFactor());
			}
			return left;
		} finally {
			depth -= links;
		}
	}

	private Expression parseFactor() {
		UnaryOp.Operator op;
		if (matchOperator("+")) {
			op = UnaryOp.Operator.PLUS;
		} else if (matchOperator("-")) {
			op = UnaryOp.Operator.MINUS;
		} else if (matchOperator("~")) {
			op = UnaryOp.Operator.INVERT;
		} else {
			return parsePower();
		}
		descend();
		try {
			return new UnaryOp(op, parseFactor());
		} finally {
			ascend();
		}
	}

	private Expression parsePower() {
		Expression base = parsePrimary();
		if (matchOperator("**")) {
			// Right associative, and a unary sign may follow: 2 ** -x ** 2 == 2 ** (-(x ** 2))
			descend();
			try {
				return new BinOp(BinOp.Operator.POW, base, parseFactor());
			} finally {
				ascend();
			}
		}
		return base;
	}

	private Expression parsePrimary() {
		Expression expression = parseAtom();
		int links = 0;
		try {
			while (true) {
				if (check(ExpressionToken.TokenType.LPAREN)) {
					if (!(expression instanceof Identifier callee)) {
						throw error("Only named functions can be called, not " + expression.kind());
					}
					advance();
					expression = new Call(callee, parseArguments());
				} else if (match(ExpressionToken.TokenType.DOT)) {
					expect(ExpressionToken.TokenType.IDENTIFIER, "Expected attribute name after '.'");
					links += lengthen();
					expression = new Unsupported("Attribute", List.of(expression));
				} else if (match(ExpressionToken.TokenType.LBRACKET)) {
					links += lengthen();
					Expression index = parseTuple();
					expect(ExpressionToken.TokenType.RBRACKET, "Expected ']' after subscript");
					expression = new Unsupported("Subscript", List.of(expression, index));
				} else {
					return expression;
				}
			}
		} finally {
			depth -= links;
		}
	}

	private List<Expression> parseArguments() {
		List<Expression> args = new ArrayList<>();
		while (!check(ExpressionToken.TokenType.RPAREN)) {
			if (peek().isType(ExpressionToken.TokenType.IDENTIFIER) && peekNext().isOperator("=")) {
				throw error("Keyword arguments are not supported");
			}
			args.add(parseTest());
			if (!match(ExpressionToken.TokenType.COMMA)) {
				break;
			}
		}
		expect(ExpressionToken.TokenType.RPAREN, "Expected ')' after arguments");
		return args;
	}

	private Expression parseAtom() {
		ExpressionToken token = peek();
		return switch (token.type()) {
			case INTEGER -> Constant.ofInteger(new BigInteger(advance().value()));
			case FLOAT -> Constant.ofFloat(Double.parseDouble(advance().value()));
			case STRING -> {
				StringBuilder sb = new StringBuilder();
				while (check(ExpressionToken.TokenType.STRING)) {
					sb.append(advance().value());
				}
				yield Constant.ofString(sb.toString());
			}
			case IDENTIFIER -> parseName();
			case LPAREN -> {
				advance();
				if (match(ExpressionToken.TokenType.RPAREN)) {
					yield new TupleLiteral(List.of());
				}
				Expression inner = parseTuple();
				expect(ExpressionToken.TokenType.RPAREN, "Expected ')'");
				yield inner;
			}
			case LBRACKET -> {
				advance();
				yield new Unsupported("List", parseElements(ExpressionToken.TokenType.RBRACKET));
			}
			case LBRACE -> {
				advance();
				yield parseBraces();
			}
			default -> throw error("Unexpected " + token);
		};
	}

	private Expression parseName() {
		ExpressionToken token = advance();
		return switch (token.value()) {
			case "True" -> Constant.ofBoolean(true);
			case "False" -> Constant.ofBoolean(false);
			case "None" -> Constant.none();
			default -> {
				if (KEYWORDS.contains(token.value())) {
					throw new ExpressionParseException("Unexpected keyword '" + token.value()
							+ "' at position " + token.position());
				}
				yield new Identifier(token.value());
			}
		};
	}

	private Expression parseBraces() {
		if (match(ExpressionToken.TokenType.RBRACE)) {
			return new Unsupported("Dict", List.of());
		}
		Expression first = parseTest();
		if (!match(ExpressionToken.TokenType.COLON)) {
			List<Expression> elements = new ArrayList<>();
			elements.add(first);
			if (match(ExpressionToken.TokenType.COMMA)) {
				elements.addAll(parseElements(ExpressionToken.TokenType.RBRACE));
			} else {
				expect(ExpressionToken.TokenType.RBRACE, "Expected '}' after set elements");
			}
			return new SetLiteral(elements);
		}

		List<Expression> entries = new ArrayList<>();
		entries.add(first);
		entries.add(parseTest());
		while (match(ExpressionToken.TokenType.COMMA)) {
			if (check(ExpressionToken.TokenType.RBRACE)) {
				break;
			}
			entries.add(parseTest());
			expect(ExpressionToken.TokenType.COLON, "Expected ':' in dict entry");
			entries.add(parseTest());
		}
		expect(ExpressionToken.TokenType.RBRACE, "Expected '}' after dict entries");
		return new Unsupported("Dict", entries);
	}

	/**
	 * Parses comma separated elements up to and including the closing token.
	 */
	private List<Expression> parseElements(ExpressionToken.TokenType closing) {
		List<Expression> elements = new ArrayList<>();
		while (!check(closing)) {
			elements.add(parseTest());
			if (!match(ExpressionToken.TokenType.COMMA)) {
				break;
			}
		}
		expect(closing, "Expected " + closing);
		return elements;
	}

	private boolean canStartExpression() {
		ExpressionToken token = peek();
		return switch (token.type()) {
			case INTEGER, FLOAT, STRING, LPAREN, LBRACKET, LBRACE -> true;
			case IDENTIFIER -> !KEYWORDS.contains(token.value()) || token.isIdentifier("not")
					|| token.isIdentifier("True") || token.isIdentifier("False") || token.isIdentifier("None");
			case OPERATOR -> token.isOperator("+") || token.isOperator("-") || token.isOperator("~");
			default -> false;
		};
	}

	/**
	 * Enters one level of recursive nesting.
	 */
	private void descend() {
		nesting++;
		depth++;
		if (nesting > MAX_NESTING || depth > MAX_DEPTH) {
			throw error("Expression is nested too deeply");
		}
	}

	private void ascend() {
		nesting--;
		depth--;
	}

	/**
	 * Adds one link to a left-associative chain, which deepens the tree without
	 * recursing in the parser. The caller gives the link back when the chain ends.
	 *
	 * @return always 1, the number of levels added
	 */
	private int lengthen() {
		depth++;
		if (depth > MAX_DEPTH) {
			throw error("Expression is nested too deeply");
		}
		return 1;
	}

	private boolean matchKeyword(String keyword) {
		if (peek().isIdentifier(keyword)) {
			advance();
			return true;
		}
		return false;
	}

	private boolean matchOperator(String operator) {
		if (peek().isOperator(operator)) {
			advance();
			return true;
		}
		return false;
	}

	private boolean match(ExpressionToken.TokenType type) {
		if (check(type)) {
			advance();
			return true;
		}
		return false;
	}

	private void expect(ExpressionToken.TokenType type, String message) {
		if (!check(type)) {
			throw error(message + ", found " + peek());
		}
		advance();
	}

	private boolean check(ExpressionToken.TokenType type) {
		return peek().isType(type);
	}

	private ExpressionToken peek() {
		return tokens.get(current);
	}

	private ExpressionToken peekNext() {
		return current + 1 < tokens.size() ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
	}

	private ExpressionToken advance() {
		ExpressionToken token = tokens.get(current);
		if (!token.isType(ExpressionToken.TokenType.EOF)) {
			current++;
		}
		return token;
	}

	private ExpressionParseException error(String message) {
		return new ExpressionParseException(message + " at position " + peek().position());
	}
}
