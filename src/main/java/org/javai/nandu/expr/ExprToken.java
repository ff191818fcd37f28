package org.javai.nandu.expr;

/**
 * Represents a token of the boolean function expression language.
 *
 * @param type the token type
 * @param value the token text
 * @param position the character offset in the input string
 */
public record ExprToken(TokenType type, String value, int position) {

	public enum TokenType {
		FUNCTION_IDENTIFIER,    // identifier immediately followed by '('
		VARIABLE_IDENTIFIER,    // any other identifier
		LPAREN,                 // (
		RPAREN,                 // )
		DELIMITER,              // ,
		EOF                     // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case FUNCTION_IDENTIFIER, VARIABLE_IDENTIFIER -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	/**
	 * Human readable form used in error messages.
	 */
	public String describe() {
		return switch (type) {
			case FUNCTION_IDENTIFIER -> "function '" + value + "'";
			case VARIABLE_IDENTIFIER -> "variable '" + value + "'";
			case LPAREN -> "'('";
			case RPAREN -> "')'";
			case DELIMITER -> "','";
			case EOF -> "end of input";
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}
}
