package org.javai.nandu.gate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.nandu.expr.ExprNode;
import org.javai.nandu.expr.ExprNodeVisitor;

/**
 * A built-in gate: its name, its fixed arity and its equivalent expression over
 * positional placeholders {@code param0}, {@code param1}, ...
 *
 * @param name the function name, case-sensitive
 * @param arity the exact number of arguments the gate takes
 * @param template the equivalent expression; leaves are placeholders only
 */
public record GateTemplate(String name, int arity, ExprNode template) {

	public static final String PLACEHOLDER_PREFIX = "param";

	public GateTemplate {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Gate is missing a name");
		}
		if (arity < 1) {
			throw new IllegalArgumentException("Gate '" + name + "' must take at least one argument");
		}
		Objects.requireNonNull(template, "template must not be null");
		if (template.isVariable()) {
			throw new IllegalArgumentException("Template of gate '" + name + "' must be a call");
		}
	}

	/**
	 * Name of the placeholder for the argument at {@code index}.
	 */
	public static String placeholder(int index) {
		return PLACEHOLDER_PREFIX + index;
	}

	/**
	 * Argument index a placeholder name stands for, or -1 when the name is not a placeholder.
	 */
	public static int placeholderIndex(String name) {
		if (name == null || name.length() <= PLACEHOLDER_PREFIX.length() || !name.startsWith(PLACEHOLDER_PREFIX)) {
			return -1;
		}
		String digits = name.substring(PLACEHOLDER_PREFIX.length());
		for (int i = 0; i < digits.length(); i++) {
			if (!Character.isDigit(digits.charAt(i))) {
				return -1;
			}
		}
		if (digits.length() > 1 && digits.charAt(0) == '0') {
			return -1;
		}
		try {
			return Integer.parseInt(digits);
		} catch (NumberFormatException e) {
			return -1;
		}
	}

	/**
	 * Substitutes the arguments for the placeholders of the template. Every placeholder
	 * occurrence receives its own deep copy of the argument, so the result never shares
	 * nodes with {@code args} or with itself.
	 *
	 * @param args one argument per placeholder, in positional order
	 * @return the instantiated tree
	 */
	public ExprNode instantiate(List<ExprNode> args) {
		if (args == null || args.size() != arity) {
			throw new IllegalArgumentException("Gate '" + name + "' needs " + arity + " arguments, got "
					+ (args == null ? 0 : args.size()));
		}
		return template.accept(new Substitution(args));
	}

	private static final class Substitution implements ExprNodeVisitor<ExprNode> {

		private final List<ExprNode> args;

		Substitution(List<ExprNode> args) {
			this.args = args;
		}

		@Override
		public ExprNode visitCall(String function, List<ExprNode> children) {
			List<ExprNode> substituted = new ArrayList<>(children.size());
			for (ExprNode child : children) {
				substituted.add(child.accept(this));
			}
			return ExprNode.call(function, substituted);
		}

		@Override
		public ExprNode visitVariable(String name) {
			int index = placeholderIndex(name);
			if (index < 0 || index >= args.size()) {
				throw new IllegalStateException("Template leaf '" + name + "' is not a bound placeholder");
			}
			return args.get(index).deepCopy();
		}
	}
}
