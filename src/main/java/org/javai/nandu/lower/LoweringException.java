package org.javai.nandu.lower;

import org.javai.nandu.NanduException;

/**
 * Base type for failures while rewriting a tree into primitive-only form.
 */
public abstract class LoweringException extends NanduException {

	protected LoweringException(String message) {
		super(message);
	}
}
