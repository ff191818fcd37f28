package org.javai.nandu.gate;

import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.javai.nandu.expr.ExprNode;
import org.javai.nandu.expr.ExprNodeVisitor;
import org.javai.nandu.expr.ExprNodeWalker;
import org.javai.nandu.expr.ExprParser;
import org.javai.nandu.lower.LoweringException;
import org.javai.nandu.lower.NandLowering;
import org.javai.nandu.lower.UnknownFunctionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only lookup from function name to {@link GateTemplate}.
 * <p>
 * Every template held by a built library is expressed over the primitive and
 * placeholders only. Templates may be defined in terms of other gates of the same
 * library; the {@link Builder} expands them to primitive-only form once, at build
 * time, and checks each entry for internal consistency. A built library is immutable.
 */
public final class GateLibrary {

	private static final Logger logger = LoggerFactory.getLogger(GateLibrary.class);

	public static final String BUILT_IN_RESOURCE = "META-INF/nandu-gates.yml";

	private final String primitive;
	private final Map<String, GateTemplate> gates;

	private GateLibrary(String primitive, Map<String, GateTemplate> gates) {
		this.primitive = primitive;
		this.gates = Map.copyOf(gates);
	}

	/**
	 * The library bundled with this project, loaded from {@value #BUILT_IN_RESOURCE}.
	 */
	public static GateLibrary builtIn() {
		return BuiltInHolder.INSTANCE;
	}

	/**
	 * Start a library whose target alphabet is the given primitive.
	 */
	public static Builder builder(String primitive) {
		return new Builder(primitive);
	}

	public String primitive() {
		return primitive;
	}

	public boolean isPrimitive(String name) {
		return primitive.equals(name);
	}

	public GateTemplate primitiveGate() {
		return gates.get(primitive);
	}

	/**
	 * Retrieve a gate by name.
	 */
	public Optional<GateTemplate> gateFor(String name) {
		return Optional.ofNullable(gates.get(name));
	}

	/**
	 * Retrieve a gate by name or fail with {@link UnknownFunctionException}.
	 */
	public GateTemplate requireGate(String name) {
		return gateFor(name).orElseThrow(() -> new UnknownFunctionException(name));
	}

	/**
	 * All gate names, sorted.
	 */
	public Set<String> names() {
		return new TreeSet<>(gates.keySet());
	}

	private static final class BuiltInHolder {

		private static final GateLibrary INSTANCE = load();

		private static GateLibrary load() {
			ClassLoader loader = GateLibrary.class.getClassLoader();
			try (InputStream is = loader.getResourceAsStream(BUILT_IN_RESOURCE)) {
				if (is == null) {
					throw new IllegalStateException("Resource not found: " + BUILT_IN_RESOURCE);
				}
				return new GateLibraryParser().parse(is);
			} catch (IllegalStateException e) {
				throw e;
			} catch (Exception e) {
				throw new IllegalStateException("Failed to load gate library from resource: " + BUILT_IN_RESOURCE, e);
			}
		}
	}

	/**
	 * Collects gate definitions and builds a checked, fully expanded library.
	 */
	public static final class Builder {

		private final String primitive;
		private final Map<String, GateTemplate> definitions = new LinkedHashMap<>();

		private Builder(String primitive) {
			if (primitive == null || primitive.isBlank()) {
				throw new IllegalArgumentException("Primitive name must not be blank");
			}
			this.primitive = primitive;
		}

		/**
		 * Define a gate from template text in expression syntax,
		 * e.g. {@code Nand(param0, param0)}.
		 */
		public Builder define(String name, int arity, String templateSource) {
			Objects.requireNonNull(templateSource, "templateSource must not be null");
			return define(new GateTemplate(name, arity, ExprParser.parseExpression(templateSource)));
		}

		public Builder define(GateTemplate gate) {
			Objects.requireNonNull(gate, "gate must not be null");
			if (definitions.containsKey(gate.name())) {
				throw new IllegalArgumentException("Gate '" + gate.name() + "' is defined more than once");
			}
			definitions.put(gate.name(), gate);
			return this;
		}

		/**
		 * Check every definition and expand templates to primitive-only form.
		 *
		 * @throws IllegalStateException if a definition is inconsistent or the
		 * definitions refer to each other in a cycle
		 */
		public GateLibrary build() {
			GateTemplate primitiveGate = definitions.get(primitive);
			if (primitiveGate == null) {
				throw new IllegalStateException("No gate defined for primitive '" + primitive + "'");
			}
			ExprNode identity = ExprNode.call(primitive,
					ExprNode.variable(GateTemplate.placeholder(0)), ExprNode.variable(GateTemplate.placeholder(1)));
			if (primitiveGate.arity() != 2 || !primitiveGate.template().equals(identity)) {
				throw new IllegalStateException("Primitive '" + primitive + "' must be defined as " + identity);
			}

			Map<String, GateTemplate> resolved = new LinkedHashMap<>();
			resolved.put(primitive, primitiveGate);
			logger.debug("Registered primitive gate '{}'", primitive);
			for (String name : definitions.keySet()) {
				resolve(name, resolved, new ArrayDeque<>());
			}
			return new GateLibrary(primitive, resolved);
		}

		private void resolve(String name, Map<String, GateTemplate> resolved, Deque<String> resolving) {
			if (resolved.containsKey(name)) {
				return;
			}
			if (resolving.contains(name)) {
				List<String> cycle = new ArrayList<>(resolving);
				Collections.reverse(cycle);
				cycle.add(name);
				throw new IllegalStateException("Gate definitions are cyclic: " + String.join(" -> ", cycle));
			}
			GateTemplate gate = definitions.get(name);
			checkPlaceholders(gate);

			resolving.push(name);
			for (String dependency : referencedGates(gate.template())) {
				if (!definitions.containsKey(dependency)) {
					throw new IllegalStateException(
							"Template of gate '" + name + "' refers to undefined gate '" + dependency + "'");
				}
				resolve(dependency, resolved, resolving);
			}
			resolving.pop();

			ExprNode expanded;
			try {
				expanded = new NandLowering(new GateLibrary(primitive, resolved)).lower(gate.template());
			} catch (LoweringException e) {
				throw new IllegalStateException("Template of gate '" + name + "' is invalid: " + e.getMessage(), e);
			}
			if (!expanded.equals(gate.template())) {
				logger.debug("Expanded staged template of gate '{}' to {} nodes",
						name, ExprNodeWalker.size(expanded));
			}
			GateTemplate expandedGate = new GateTemplate(name, gate.arity(), expanded);
			checkPlaceholders(expandedGate);
			resolved.put(name, expandedGate);
			logger.debug("Registered gate '{}' with arity {}", name, gate.arity());
		}

		private Set<String> referencedGates(ExprNode template) {
			Set<String> names = new LinkedHashSet<>();
			ExprNodeWalker.walkPreOrder(template, new ExprNodeVisitor<Void>() {
				@Override
				public Void visitCall(String function, List<ExprNode> args) {
					if (!primitive.equals(function)) {
						names.add(function);
					}
					return null;
				}

				@Override
				public Void visitVariable(String variable) {
					return null;
				}
			});
			return names;
		}

		// The leaves of a template are exactly param0..param(arity - 1).
		private static void checkPlaceholders(GateTemplate gate) {
			Set<Integer> seen = new TreeSet<>();
			ExprNodeWalker.walkPreOrder(gate.template(), new ExprNodeVisitor<Void>() {
				@Override
				public Void visitCall(String function, List<ExprNode> args) {
					return null;
				}

				@Override
				public Void visitVariable(String variable) {
					int index = GateTemplate.placeholderIndex(variable);
					if (index < 0) {
						throw new IllegalStateException(
								"Template of gate '" + gate.name() + "' uses '" + variable + "' which is not a placeholder");
					}
					if (index >= gate.arity()) {
						throw new IllegalStateException("Template of gate '" + gate.name() + "' uses '" + variable
								+ "' but the gate takes " + gate.arity() + " arguments");
					}
					seen.add(index);
					return null;
				}
			});
			if (seen.size() != gate.arity()) {
				throw new IllegalStateException("Template of gate '" + gate.name() + "' uses " + seen.size()
						+ " of its " + gate.arity() + " parameters");
			}
		}
	}
}
