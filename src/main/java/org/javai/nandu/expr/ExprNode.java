package org.javai.nandu.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Represents a node in the parsed expression tree.
 *
 * A node is either:
 * - A variable - a named leaf, has a variable name but no function and no args
 * - A call - a function name applied to one or more argument nodes
 *
 * Nodes are immutable values; equality is structural.
 */
public record ExprNode(String function, List<ExprNode> args, String variable) {

	public ExprNode {
		if ((function == null) == (variable == null)) {
			throw new IllegalArgumentException("A node is either a call or a variable");
		}
		if (function != null) {
			if (function.isEmpty()) {
				throw new IllegalArgumentException("Function name must not be empty");
			}
			if (args == null || args.isEmpty()) {
				throw new IllegalArgumentException("Call '" + function + "' must have at least one argument");
			}
			args = List.copyOf(args);
		} else {
			if (variable.isEmpty()) {
				throw new IllegalArgumentException("Variable name must not be empty");
			}
			args = List.of();
		}
	}

	/**
	 * Creates a call node.
	 */
	public static ExprNode call(String function, List<ExprNode> args) {
		return new ExprNode(function, args, null);
	}

	/**
	 * Creates a call node from varargs.
	 */
	public static ExprNode call(String function, ExprNode... args) {
		return call(function, List.of(args));
	}

	/**
	 * Creates a variable leaf.
	 */
	public static ExprNode variable(String name) {
		return new ExprNode(null, List.of(), name);
	}

	public boolean isVariable() {
		return variable != null;
	}

	public boolean isCall(String name) {
		return Objects.equals(function, name);
	}

	/**
	 * Returns a structurally equal tree that shares no node instance with this one.
	 */
	public ExprNode deepCopy() {
		if (isVariable()) {
			return new ExprNode(null, List.of(), variable);
		}
		List<ExprNode> copies = new ArrayList<>(args.size());
		for (ExprNode arg : args) {
			copies.add(arg.deepCopy());
		}
		return new ExprNode(function, copies, null);
	}

	/**
	 * Accepts a visitor and dispatches to the appropriate visitor method.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	public <R> R accept(ExprNodeVisitor<R> visitor) {
		if (isVariable()) {
			return visitor.visitVariable(variable);
		} else {
			return visitor.visitCall(function, args);
		}
	}

	@Override
	public String toString() {
		return ExprPrinter.print(this);
	}
}
