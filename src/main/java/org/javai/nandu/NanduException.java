package org.javai.nandu;

/**
 * Root of every error raised while translating an expression.
 * <p>
 * Each pipeline stage fails fast with its own subtype; callers that only need to
 * report the failure can catch this type and show {@link #getMessage()}.
 */
public abstract class NanduException extends RuntimeException {

	protected NanduException(String message) {
		super(message);
	}

	protected NanduException(String message, Throwable cause) {
		super(message, cause);
	}
}
