package org.javai.nandu.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for boolean function expressions such as {@code And(a, Or(b, c))}.
 * <p>
 * A run of identifier characters is a function identifier when a '(' follows it
 * directly, and a variable identifier otherwise. Whitespace between tokens is skipped.
 */
public class ExprTokenizer {

	private final String input;
	private int pos = 0;

	public ExprTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws ExprLexException if a character cannot begin a token
	 */
	public List<ExprToken> tokenize() {
		List<ExprToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new ExprToken(ExprToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private ExprToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(' -> {
				advance();
				yield new ExprToken(ExprToken.TokenType.LPAREN, "(", start);
			}
			case ')' -> {
				advance();
				yield new ExprToken(ExprToken.TokenType.RPAREN, ")", start);
			}
			case ',' -> {
				advance();
				yield new ExprToken(ExprToken.TokenType.DELIMITER, ",", start);
			}
			default -> {
				if (isIdentifierChar(c)) {
					yield scanIdentifier();
				}
				throw new ExprLexException(input.codePointAt(pos), pos);
			}
		};
	}

	private ExprToken scanIdentifier() {
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		// no whitespace allowed between a function name and its '('
		ExprToken.TokenType type = peek() == '('
				? ExprToken.TokenType.FUNCTION_IDENTIFIER
				: ExprToken.TokenType.VARIABLE_IDENTIFIER;
		return new ExprToken(type, value, start);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
	}

	private boolean isIdentifierChar(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
	}
}
