package org.javai.nandu.lower;

/**
 * Thrown when a known function is called with the wrong number of arguments.
 */
public class ArityMismatchException extends LoweringException {

	private final String function;
	private final int expected;
	private final int actual;

	public ArityMismatchException(String function, int expected, int actual) {
		super("Function '" + function + "' expects " + expected + " argument" + (expected == 1 ? "" : "s")
				+ " but was given " + actual);
		this.function = function;
		this.expected = expected;
		this.actual = actual;
	}

	public String function() {
		return function;
	}

	public int expected() {
		return expected;
	}

	public int actual() {
		return actual;
	}
}
