package org.javai.nandu.expr;

import java.util.ArrayList;
import java.util.List;
import org.javai.nandu.expr.ExprParseException.Reason;
import org.javai.nandu.expr.ExprToken.TokenType;

/**
 * Recursive descent parser for boolean function expressions, one token of lookahead.
 *
 * <pre>
 * F       ::= FuncIdent "(" ArgList ")"
 * ArgList ::= Arg ("," Arg)*
 * Arg     ::= VarIdent | F
 * </pre>
 *
 * Exactly one top-level call is accepted; anything after it is an error.
 *
 * Example usage:
 *
 * <pre>
 * List&lt;ExprToken&gt; tokens = new ExprTokenizer("And(a, b)").tokenize();
 * ExprNode root = new ExprParser(tokens).parse();
 * </pre>
 */
public class ExprParser {

	public static final int UNLIMITED_DEPTH = Integer.MAX_VALUE;

	private final List<ExprToken> tokens;
	private final int maxDepth;
	private int current = 0;
	private int depth = 0;

	/**
	 * Creates a parser over a token list. A missing trailing EOF token is tolerated.
	 *
	 * @param tokens the tokens to parse
	 */
	public ExprParser(List<ExprToken> tokens) {
		this(tokens, UNLIMITED_DEPTH);
	}

	/**
	 * Creates a parser that refuses calls nested more than {@code maxDepth} deep.
	 * The limit is checked on the way down, before the parser recurses further.
	 *
	 * @param tokens the tokens to parse
	 * @param maxDepth the deepest call nesting accepted, at least 1
	 */
	public ExprParser(List<ExprToken> tokens, int maxDepth) {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be at least 1, was " + maxDepth);
		}
		this.tokens = tokens != null ? tokens : List.of();
		this.maxDepth = maxDepth;
	}

	/**
	 * Convenience for tokenizing and parsing in one step.
	 */
	public static ExprNode parseExpression(String input) {
		return parseExpression(input, UNLIMITED_DEPTH);
	}

	public static ExprNode parseExpression(String input, int maxDepth) {
		return new ExprParser(new ExprTokenizer(input).tokenize(), maxDepth).parse();
	}

	/**
	 * Parses the tokens into a single call node.
	 *
	 * @return the root node
	 * @throws ExprParseException if the tokens violate the grammar
	 * @throws ExprNestingException if calls nest deeper than the parser's limit
	 */
	public ExprNode parse() {
		ExprNode root = parseCall();
		if (!isAtEnd()) {
			throw new ExprParseException(Reason.TRAILING_TOKENS, "end of input", peek());
		}
		return root;
	}

	private ExprNode parseCall() {
		ExprToken name = peek();
		if (!name.isType(TokenType.FUNCTION_IDENTIFIER)) {
			throw unexpected(Reason.UNEXPECTED_TOKEN, "function identifier");
		}
		advance();
		if (++depth > maxDepth) {
			throw new ExprNestingException(maxDepth, name.position());
		}

		if (!check(TokenType.LPAREN)) {
			throw unexpected(Reason.MISSING_LEFT_PAREN, "'(' after function '" + name.value() + "'");
		}
		advance();

		if (check(TokenType.RPAREN)) {
			throw new ExprParseException(Reason.EMPTY_ARGUMENT_LIST,
					"at least one argument for '" + name.value() + "'", peek());
		}

		List<ExprNode> args = new ArrayList<>();
		args.add(parseArg());
		while (!check(TokenType.RPAREN)) {
			switch (peek().type()) {
				case DELIMITER -> {
					advance();
					args.add(parseArg());
				}
				case VARIABLE_IDENTIFIER, FUNCTION_IDENTIFIER ->
						throw unexpected(Reason.MISSING_DELIMITER, "',' between arguments");
				default -> throw unexpected(Reason.MISSING_RIGHT_PAREN,
						"')' to close '" + name.value() + "('");
			}
		}
		advance(); // consume ')'
		depth--;

		return ExprNode.call(name.value(), args);
	}

	private ExprNode parseArg() {
		ExprToken token = peek();
		return switch (token.type()) {
			case VARIABLE_IDENTIFIER -> {
				advance();
				yield ExprNode.variable(token.value());
			}
			case FUNCTION_IDENTIFIER -> parseCall();
			default -> throw unexpected(Reason.UNEXPECTED_TOKEN, "variable or function call");
		};
	}

	// Any expectation that runs into the end of input is reported as such.
	private ExprParseException unexpected(Reason reason, String expected) {
		ExprToken found = peek();
		if (found.isType(TokenType.EOF)) {
			return new ExprParseException(Reason.UNEXPECTED_END, expected, found);
		}
		return new ExprParseException(reason, expected, found);
	}

	private ExprToken peek() {
		if (current < tokens.size()) {
			return tokens.get(current);
		}
		if (tokens.isEmpty()) {
			return new ExprToken(TokenType.EOF, "", 0);
		}
		ExprToken last = tokens.get(tokens.size() - 1);
		return new ExprToken(TokenType.EOF, "", last.position() + last.value().length());
	}

	private void advance() {
		if (!isAtEnd()) {
			current++;
		}
	}

	private boolean check(TokenType type) {
		return peek().isType(type);
	}

	private boolean isAtEnd() {
		return peek().isType(TokenType.EOF);
	}
}
