package org.javai.nandu.lower;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.nandu.expr.ExprNode;
import org.javai.nandu.expr.ExprNodeVisitor;
import org.javai.nandu.expr.ExprNodeWalker;
import org.javai.nandu.gate.GateLibrary;
import org.javai.nandu.gate.GateTemplate;

/**
 * Rewrites an expression tree so that every call uses the library's primitive.
 * <p>
 * Lowering is bottom-up: arguments are lowered first, then the call is replaced by
 * its gate template with each placeholder substituted by a private copy of the
 * matching lowered argument. Templates are primitive-only once the library is
 * built, so a substituted template is never lowered again. Output size grows with
 * every duplicated placeholder; no sharing is introduced.
 * <p>
 * Instances hold no mutable state and may be shared between threads.
 */
public class NandLowering implements ExprNodeVisitor<ExprNode> {

	private final GateLibrary library;

	public NandLowering(GateLibrary library) {
		this.library = Objects.requireNonNull(library, "library must not be null");
	}

	/**
	 * Lowers a tree to primitive-only form.
	 *
	 * @param node the parsed tree
	 * @return a new tree whose calls all use the primitive
	 * @throws UnknownFunctionException if a call names an undefined function
	 * @throws ArityMismatchException if a call has the wrong number of arguments
	 */
	public ExprNode lower(ExprNode node) {
		Objects.requireNonNull(node, "node must not be null");
		return node.accept(this);
	}

	/**
	 * Checks whether a tree is already in primitive-only form, i.e. every call is the
	 * primitive applied to exactly as many arguments as the primitive takes.
	 */
	public boolean isLowered(ExprNode node) {
		GateTemplate primitive = library.primitiveGate();
		return ExprNodeWalker.allMatch(node, n -> n.isVariable()
				|| (n.isCall(primitive.name()) && n.args().size() == primitive.arity()));
	}

	/**
	 * Number of nodes {@link #lower(ExprNode)} would produce for this tree, computed
	 * without building it. Saturates at {@link Long#MAX_VALUE}.
	 *
	 * @throws UnknownFunctionException if a call names an undefined function
	 * @throws ArityMismatchException if a call has the wrong number of arguments
	 */
	public long loweredSize(ExprNode node) {
		if (node.isVariable()) {
			return 1;
		}
		List<Long> argSizes = new ArrayList<>(node.args().size());
		for (ExprNode arg : node.args()) {
			argSizes.add(loweredSize(arg));
		}
		GateTemplate gate = library.requireGate(node.function());
		if (gate.arity() != argSizes.size()) {
			throw new ArityMismatchException(node.function(), gate.arity(), argSizes.size());
		}
		return templateSize(gate.template(), argSizes);
	}

	private static long templateSize(ExprNode template, List<Long> argSizes) {
		if (template.isVariable()) {
			return argSizes.get(GateTemplate.placeholderIndex(template.variable()));
		}
		long size = 1;
		for (ExprNode child : template.args()) {
			size = saturatedAdd(size, templateSize(child, argSizes));
		}
		return size;
	}

	private static long saturatedAdd(long a, long b) {
		long sum = a + b;
		return sum < 0 ? Long.MAX_VALUE : sum;
	}

	@Override
	public ExprNode visitVariable(String name) {
		return ExprNode.variable(name);
	}

	@Override
	public ExprNode visitCall(String function, List<ExprNode> args) {
		List<ExprNode> lowered = new ArrayList<>(args.size());
		for (ExprNode arg : args) {
			lowered.add(arg.accept(this));
		}

		GateTemplate gate = library.requireGate(function);
		if (gate.arity() != lowered.size()) {
			throw new ArityMismatchException(function, gate.arity(), lowered.size());
		}
		if (library.isPrimitive(function)) {
			return ExprNode.call(function, lowered);
		}
		return gate.instantiate(lowered);
	}
}
