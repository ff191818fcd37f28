package org.javai.nandu.expr;

import java.util.List;

/**
 * Visitor interface for traversing {@link ExprNode} trees.
 *
 * @param <R> the return type of the visitor operations
 */
public interface ExprNodeVisitor<R> {

	/**
	 * Visits a call node.
	 *
	 * @param function the function name
	 * @param args the argument nodes, never empty
	 * @return the result of visiting this node
	 */
	R visitCall(String function, List<ExprNode> args);

	/**
	 * Visits a variable leaf.
	 *
	 * @param name the variable name
	 * @return the result of visiting this node
	 */
	R visitVariable(String name);
}
