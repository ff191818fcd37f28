package org.javai.nandu.cli;

import org.javai.nandu.NanduTranslator;

/**
 * Entry point: {@code nandu 'And(a, b)'} or {@code echo 'And(a, b)' | nandu}.
 */
public final class Main {

	private Main() {
	}

	public static void main(String[] args) {
		NanduCli cli = new NanduCli(NanduTranslator.withBuiltInGates(), NanduCliConfig.load());
		System.exit(cli.run(args, System.in, System.out, System.err));
	}
}
