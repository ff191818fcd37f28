package org.javai.nandu.expr;

import java.util.function.Predicate;

/**
 * Utility class for common traversals of {@link ExprNode} trees.
 */
public final class ExprNodeWalker {

	private ExprNodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Walks a tree in pre-order (node before children), visiting each node.
	 *
	 * @param <R> the return type of the visitor
	 * @param node the root node to start traversal from
	 * @param visitor the visitor to apply to each node
	 * @return the result of visiting the root node
	 */
	public static <R> R walkPreOrder(ExprNode node, ExprNodeVisitor<R> visitor) {
		if (node == null) {
			return null;
		}

		R result = node.accept(visitor);

		for (ExprNode child : node.args()) {
			walkPreOrder(child, visitor);
		}

		return result;
	}

	/**
	 * Returns true when every node of the tree satisfies the predicate.
	 */
	public static boolean allMatch(ExprNode node, Predicate<ExprNode> predicate) {
		if (!predicate.test(node)) {
			return false;
		}
		for (ExprNode child : node.args()) {
			if (!allMatch(child, predicate)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Number of nodes in the tree, leaves included.
	 */
	public static long size(ExprNode node) {
		long size = 1;
		for (ExprNode child : node.args()) {
			size += size(child);
		}
		return size;
	}

	/**
	 * Call nesting depth: 0 for a variable, 1 for a call over variables only.
	 */
	public static int depth(ExprNode node) {
		int deepest = 0;
		for (ExprNode child : node.args()) {
			deepest = Math.max(deepest, depth(child));
		}
		return node.isVariable() ? 0 : deepest + 1;
	}
}
