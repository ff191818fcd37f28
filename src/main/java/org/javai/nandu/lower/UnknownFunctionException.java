package org.javai.nandu.lower;

/**
 * Thrown when a call names a function the gate library does not define.
 */
public class UnknownFunctionException extends LoweringException {

	private final String function;

	public UnknownFunctionException(String function) {
		super("Unknown function '" + function + "'");
		this.function = function;
	}

	public String function() {
		return function;
	}
}
