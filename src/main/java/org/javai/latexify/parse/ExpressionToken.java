package org.javai.latexify.parse;

/**
 * Represents a token of the expression language.
 * 
 * @param type the token type
 * @param value the token value; decimal digits for integers, unescaped text for strings
 * @param position the character position in the input string
 */
public record ExpressionToken(TokenType type, String value, int position) {

	public enum TokenType {
		IDENTIFIER,    // names and keywords
		INTEGER,       // 42, 0x2a, 1_000
		FLOAT,         // 3.5, .5, 1e-3
		STRING,        // 'quoted' or "quoted"
		OPERATOR,      // + - * / // % ** << >> & | ^ ~ @ < > <= >= == != =
		LPAREN,        // (
		RPAREN,        // )
		LBRACKET,      // [
		RBRACKET,      // ]
		LBRACE,        // {
		RBRACE,        // }
		COMMA,         // ,
		COLON,         // :
		DOT,           // .
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING('" + value + "')";
			case IDENTIFIER, INTEGER, FLOAT, OPERATOR -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isIdentifier(String expected) {
		return type == TokenType.IDENTIFIER && value.equals(expected);
	}

	public boolean isOperator(String expected) {
		return type == TokenType.OPERATOR && value.equals(expected);
	}
}
