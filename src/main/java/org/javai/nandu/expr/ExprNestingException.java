package org.javai.nandu.expr;

import org.javai.nandu.NanduException;

/**
 * Thrown when calls nest deeper than a parser's depth limit.
 */
public class ExprNestingException extends NanduException {

	private final int limit;
	private final int position;

	public ExprNestingException(int limit, int position) {
		super("Call at position " + position + " nests deeper than " + limit + " calls");
		this.limit = limit;
		this.position = position;
	}

	public int limit() {
		return limit;
	}

	public int position() {
		return position;
	}
}
