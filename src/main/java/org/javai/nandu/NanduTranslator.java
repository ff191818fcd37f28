package org.javai.nandu;

import java.util.Objects;
import org.javai.nandu.expr.ExprNode;
import org.javai.nandu.expr.ExprParser;
import org.javai.nandu.expr.ExprPrinter;
import org.javai.nandu.gate.GateLibrary;
import org.javai.nandu.lower.NandLowering;

/**
 * Translates a boolean function expression into an equivalent expression that only
 * uses the gate library's primitive.
 * <p>
 * Example usage:
 *
 * <pre>
 * NanduTranslator translator = NanduTranslator.withBuiltInGates();
 * translator.translate("And(a, b)");   // "Nand(Nand(a, b), Nand(a, b))"
 * </pre>
 *
 * Each stage fails fast with its own {@link NanduException} subtype. Translators are
 * immutable and may be shared between threads.
 */
public final class NanduTranslator {

	private final NandLowering lowering;

	public NanduTranslator(GateLibrary library) {
		this.lowering = new NandLowering(Objects.requireNonNull(library, "library must not be null"));
	}

	public static NanduTranslator withBuiltInGates() {
		return new NanduTranslator(GateLibrary.builtIn());
	}

	/**
	 * Tokenize and parse an expression.
	 */
	public ExprNode parse(String input) {
		return ExprParser.parseExpression(input);
	}

	/**
	 * Tokenize and parse an expression, refusing calls nested deeper than {@code maxDepth}.
	 */
	public ExprNode parse(String input, int maxDepth) {
		return ExprParser.parseExpression(input, maxDepth);
	}

	/**
	 * Lower a parsed tree to primitive-only form.
	 */
	public ExprNode lower(ExprNode tree) {
		return lowering.lower(tree);
	}

	/**
	 * Size of the tree {@link #lower(ExprNode)} would return.
	 */
	public long loweredSize(ExprNode tree) {
		return lowering.loweredSize(tree);
	}

	public String render(ExprNode tree) {
		return ExprPrinter.print(tree);
	}

	/**
	 * Run the whole pipeline.
	 *
	 * @param input the expression text
	 * @return the primitive-only expression on a single line
	 * @throws NanduException if the input cannot be translated
	 */
	public String translate(String input) {
		return render(lower(parse(input)));
	}
}
