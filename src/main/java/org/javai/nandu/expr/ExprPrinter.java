package org.javai.nandu.expr;

import java.util.List;

/**
 * Visitor that renders an {@link ExprNode} tree back to the expression grammar,
 * e.g. {@code Nand(Nand(a, b), Nand(a, b))}. Output is always a single line and
 * can be read back by {@link ExprParser}.
 */
public class ExprPrinter implements ExprNodeVisitor<Void> {

	private static final String DELIMITER = ", ";

	private final StringBuilder output = new StringBuilder();

	@Override
	public Void visitCall(String function, List<ExprNode> args) {
		output.append(function).append('(');
		for (int i = 0; i < args.size(); i++) {
			if (i > 0) {
				output.append(DELIMITER);
			}
			args.get(i).accept(this);
		}
		output.append(')');
		return null;
	}

	@Override
	public Void visitVariable(String name) {
		output.append(name);
		return null;
	}

	/**
	 * Returns the rendered output as a string.
	 */
	public String toString() {
		return output.toString();
	}

	/**
	 * Static convenience method to render a node.
	 */
	public static String print(ExprNode node) {
		ExprPrinter printer = new ExprPrinter();
		node.accept(printer);
		return printer.toString();
	}
}
