package org.javai.nandu.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.javai.nandu.NanduException;
import org.javai.nandu.NanduTranslator;
import org.javai.nandu.expr.ExprNestingException;
import org.javai.nandu.expr.ExprNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line front end. The expression is the first argument, or all of standard
 * input when no argument is given; an argument wins over piped input.
 * <p>
 * Prints the translation and returns 0, or prints {@code Error: <message>} to the
 * error stream and returns 1.
 */
public class NanduCli {

	private static final Logger logger = LoggerFactory.getLogger(NanduCli.class);

	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURE = 1;

	private final NanduTranslator translator;
	private final NanduCliConfig config;

	public NanduCli(NanduTranslator translator, NanduCliConfig config) {
		this.translator = Objects.requireNonNull(translator, "translator must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	public int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
		String input;
		try {
			input = args != null && args.length > 0 ? args[0] : readAll(in);
		} catch (IOException e) {
			logger.debug("Reading standard input failed", e);
			err.println("Error: failed to read input: " + e.getMessage());
			return EXIT_FAILURE;
		}
		logger.debug("Translating {} characters of input", input.length());

		try {
			String output = translate(input);
			logger.debug("Produced {} characters of output", output.length());
			out.println(output);
			return EXIT_OK;
		} catch (NanduException e) {
			logger.debug("Translation failed", e);
			err.println("Error: " + e.getMessage());
			return EXIT_FAILURE;
		}
	}

	private String translate(String input) {
		ExprNode tree;
		try {
			tree = translator.parse(input, config.maxNestingDepth());
		} catch (ExprNestingException e) {
			logger.warn("Refusing input nested deeper than {} calls (call at position {})",
					e.limit(), e.position());
			throw new ExpressionLimitException("Expression nests deeper than the limit of " + e.limit()
					+ " calls at position " + e.position(), e);
		}

		long size = translator.loweredSize(tree);
		if (size > config.maxOutputNodes()) {
			logger.warn("Refusing input whose translation has {} nodes (limit {})", size, config.maxOutputNodes());
			throw new ExpressionLimitException("Translation would have " + size + " nodes; the limit is "
					+ config.maxOutputNodes());
		}

		return translator.render(translator.lower(tree));
	}

	private static String readAll(InputStream in) throws IOException {
		BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		StringBuilder input = new StringBuilder();
		String line;
		while ((line = reader.readLine()) != null) {
			input.append(line).append('\n');
		}
		return input.toString();
	}
}
