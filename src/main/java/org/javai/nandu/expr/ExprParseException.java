package org.javai.nandu.expr;

import org.javai.nandu.NanduException;

/**
 * Exception thrown when a token sequence violates the expression grammar.
 */
public class ExprParseException extends NanduException {

	public enum Reason {
		MISSING_LEFT_PAREN,
		MISSING_RIGHT_PAREN,
		MISSING_DELIMITER,
		EMPTY_ARGUMENT_LIST,
		UNEXPECTED_END,
		TRAILING_TOKENS,
		UNEXPECTED_TOKEN
	}

	private final Reason reason;
	private final String expected;
	private final String found;
	private final int position;

	public ExprParseException(Reason reason, String expected, ExprToken found) {
		super(message(reason, expected, found));
		this.reason = reason;
		this.expected = expected;
		this.found = found.describe();
		this.position = found.position();
	}

	public Reason reason() {
		return reason;
	}

	public String expected() {
		return expected;
	}

	public String found() {
		return found;
	}

	public int position() {
		return position;
	}

	private static String message(Reason reason, String expected, ExprToken found) {
		return switch (reason) {
			case UNEXPECTED_END -> "Unexpected end of input at position " + found.position()
					+ ": expected " + expected;
			case TRAILING_TOKENS -> "Unexpected " + found.describe() + " at position " + found.position()
					+ " after a complete expression";
			case EMPTY_ARGUMENT_LIST -> "Empty argument list at position " + found.position()
					+ ": expected " + expected;
			default -> "Expected " + expected + " at position " + found.position()
					+ ", found " + found.describe();
		};
	}
}
