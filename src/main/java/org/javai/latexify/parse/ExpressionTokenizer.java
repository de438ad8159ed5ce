package org.javai.latexify.parse;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the expression language.
 * Converts input string into a stream of tokens.
 */
public class ExpressionTokenizer {

	private static final List<String> TWO_CHAR_OPERATORS = List.of("**", "//", "<<", ">>", "<=", ">=", "==", "!=");
	private static final String ONE_CHAR_OPERATORS = "+-*/%@|^&~<>=";

	private final String input;
	private int pos = 0;

	public ExpressionTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws ExpressionParseException if invalid syntax is encountered
	 */
	public List<ExpressionToken> tokenize() {
		List<ExpressionToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new ExpressionToken(ExpressionToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private ExpressionToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(' -> single(ExpressionToken.TokenType.LPAREN, start);
			case ')' -> single(ExpressionToken.TokenType.RPAREN, start);
			case '[' -> single(ExpressionToken.TokenType.LBRACKET, start);
			case ']' -> single(ExpressionToken.TokenType.RBRACKET, start);
			case '{' -> single(ExpressionToken.TokenType.LBRACE, start);
			case '}' -> single(ExpressionToken.TokenType.RBRACE, start);
			case ',' -> single(ExpressionToken.TokenType.COMMA, start);
			case ':' -> single(ExpressionToken.TokenType.COLON, start);
			case '\'', '"' -> scanString();
			default -> {
				if (isDigit(c) || (c == '.' && isDigit(peekNext()))) {
					yield scanNumber();
				} else if (c == '.') {
					yield single(ExpressionToken.TokenType.DOT, start);
				} else if (isIdentifierStart(c)) {
					yield scanIdentifier();
				} else if (ONE_CHAR_OPERATORS.indexOf(c) >= 0 || c == '!') {
					yield scanOperator();
				} else {
					throw new ExpressionParseException("Unexpected character: '" + c + "' at position " + pos);
				}
			}
		};
	}

	private ExpressionToken single(ExpressionToken.TokenType type, int start) {
		char c = advance();
		return new ExpressionToken(type, String.valueOf(c), start);
	}

	private ExpressionToken scanOperator() {
		int start = pos;
		if (pos + 1 < input.length()) {
			String pair = input.substring(pos, pos + 2);
			if (TWO_CHAR_OPERATORS.contains(pair)) {
				pos += 2;
				return new ExpressionToken(ExpressionToken.TokenType.OPERATOR, pair, start);
			}
		}
		char c = advance();
		if (c == '!') {
			throw new ExpressionParseException("Unexpected character: '!' at position " + start);
		}
		return new ExpressionToken(ExpressionToken.TokenType.OPERATOR, String.valueOf(c), start);
	}

	private ExpressionToken scanString() {
		int start = pos;
		char quote = advance(); // consume opening quote

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != quote) {
			char c = advance();
			if (c == '\n') {
				throw new ExpressionParseException("Unterminated string at position " + start);
			}
			if (c == '\\' && !isAtEnd()) {
				char next = advance();
				switch (next) {
					case 'n' -> sb.append('\n');
					case 't' -> sb.append('\t');
					case 'r' -> sb.append('\r');
					case '\'', '"', '\\' -> sb.append(next);
					// Unknown escapes keep their backslash.
					default -> sb.append('\\').append(next);
				}
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			throw new ExpressionParseException("Unterminated string at position " + start);
		}

		advance(); // consume closing quote
		return new ExpressionToken(ExpressionToken.TokenType.STRING, sb.toString(), start);
	}

	private ExpressionToken scanNumber() {
		int start = pos;

		if (peek() == '0' && isRadixPrefix(peekNext())) {
			return scanRadixInteger(start);
		}

		boolean isFloat = false;
		scanDigits();

		if (peek() == '.') {
			isFloat = true;
			advance(); // consume '.'
			scanDigits();
		}

		if (peek() == 'e' || peek() == 'E') {
			int mark = pos;
			advance();
			if (peek() == '+' || peek() == '-') {
				advance();
			}
			if (isDigit(peek())) {
				isFloat = true;
				scanDigits();
			} else {
				pos = mark;
			}
		}

		if (peek() == 'j' || peek() == 'J') {
			throw new ExpressionParseException("Imaginary literals are not supported at position " + start);
		}
		if (isIdentifierStart(peek())) {
			throw new ExpressionParseException("Invalid number literal at position " + start);
		}

		String value = input.substring(start, pos).replace("_", "");
		return new ExpressionToken(isFloat ? ExpressionToken.TokenType.FLOAT : ExpressionToken.TokenType.INTEGER,
				value, start);
	}

	private ExpressionToken scanRadixInteger(int start) {
		advance(); // consume '0'
		char prefix = Character.toLowerCase(advance());
		int radix = switch (prefix) {
			case 'x' -> 16;
			case 'o' -> 8;
			default -> 2;
		};

		int digitsStart = pos;
		while (!isAtEnd() && (Character.digit(peek(), radix) >= 0 || peek() == '_')) {
			advance();
		}
		String digits = input.substring(digitsStart, pos).replace("_", "");
		if (digits.isEmpty() || isIdentifierChar(peek())) {
			throw new ExpressionParseException("Invalid number literal at position " + start);
		}
		String value = new BigInteger(digits, radix).toString();
		return new ExpressionToken(ExpressionToken.TokenType.INTEGER, value, start);
	}

	private ExpressionToken scanIdentifier() {
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		if (peek() == '\'' || peek() == '"') {
			throw new ExpressionParseException("String prefixes are not supported at position " + start);
		}
		return new ExpressionToken(ExpressionToken.TokenType.IDENTIFIER, value, start);
	}

	private void scanDigits() {
		while (!isAtEnd() && (isDigit(peek()) || (peek() == '_' && isDigit(peekNext())))) {
			advance();
		}
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isRadixPrefix(char c) {
		return c == 'x' || c == 'X' || c == 'o' || c == 'O' || c == 'b' || c == 'B';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
