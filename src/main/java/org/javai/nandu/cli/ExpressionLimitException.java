package org.javai.nandu.cli;

import org.javai.nandu.NanduException;

/**
 * Thrown when an input would exceed the configured nesting or output size limits.
 */
public class ExpressionLimitException extends NanduException {

	public ExpressionLimitException(String message) {
		super(message);
	}

	public ExpressionLimitException(String message, Throwable cause) {
		super(message, cause);
	}
}
