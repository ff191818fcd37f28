package org.javai.nandu.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.nandu.expr.ExprNode.call;
import static org.javai.nandu.expr.ExprNode.variable;

import org.apache.logging.log4j.Level;
import org.javai.nandu.expr.ExprNode;
import org.javai.nandu.expr.ExprParser;
import org.javai.nandu.lower.NandLowering;
import org.javai.nandu.lower.UnknownFunctionException;
import org.javai.nandu.testsupport.LogCapture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GateLibraryTest {

	private static GateLibrary.Builder withPrimitive() {
		return GateLibrary.builder("Nand").define("Nand", 2, "Nand(param0, param1)");
	}

	@Nested
	@DisplayName("Built-in library")
	class BuiltIn {

		private final GateLibrary library = GateLibrary.builtIn();

		@Test
		void definesTheFixedGates() {
			assertThat(library.primitive()).isEqualTo("Nand");
			assertThat(library.names()).containsExactly("And", "Nand", "Not", "Or", "Xor");
		}

		@Test
		void recordsArities() {
			assertThat(library.requireGate("Not").arity()).isEqualTo(1);
			assertThat(library.requireGate("And").arity()).isEqualTo(2);
			assertThat(library.requireGate("Or").arity()).isEqualTo(2);
			assertThat(library.requireGate("Xor").arity()).isEqualTo(2);
			assertThat(library.requireGate("Nand").arity()).isEqualTo(2);
		}

		@Test
		void templatesMatchTheirDefinitions() {
			assertThat(library.requireGate("Not").template())
					.isEqualTo(ExprParser.parseExpression("Nand(param0, param0)"));
			assertThat(library.requireGate("And").template())
					.isEqualTo(ExprParser.parseExpression("Nand(Nand(param0, param1), Nand(param0, param1))"));
			assertThat(library.requireGate("Or").template())
					.isEqualTo(ExprParser.parseExpression("Nand(Nand(param0, param0), Nand(param1, param1))"));
		}

		@Test
		void xorIsExpandedToNandOnly() {
			assertThat(library.requireGate("Xor").template().toString()).isEqualTo(
					"Nand(Nand(Nand(param0, param1), Nand(Nand(param0, param0), Nand(param1, param1))), "
							+ "Nand(Nand(param0, param1), Nand(Nand(param0, param0), Nand(param1, param1))))");
		}

		@Test
		void everyTemplateIsPrimitiveOnly() {
			NandLowering lowering = new NandLowering(library);

			for (String name : library.names()) {
				assertThat(lowering.isLowered(library.requireGate(name).template())).as(name).isTrue();
			}
		}

		@Test
		void lookupIsCaseSensitive() {
			assertThat(library.gateFor("and")).isEmpty();
			assertThatThrownBy(() -> library.requireGate("NAND"))
					.isInstanceOfSatisfying(UnknownFunctionException.class,
							e -> assertThat(e.function()).isEqualTo("NAND"));
		}

		@Test
		void builtInIsLoadedOnce() {
			assertThat(GateLibrary.builtIn()).isSameAs(library);
		}
	}

	@Nested
	@DisplayName("Consistency checks")
	class Consistency {

		@Test
		void primitiveMustBeDefined() {
			assertThatThrownBy(() -> GateLibrary.builder("Nand").define("Not", 1, "Nand(param0, param0)").build())
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("No gate defined for primitive 'Nand'");
		}

		@Test
		void primitiveMustBeTheIdentity() {
			assertThatThrownBy(() -> GateLibrary.builder("Nand").define("Nand", 2, "Nand(param1, param0)").build())
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("must be defined as Nand(param0, param1)");
		}

		@Test
		void placeholderBeyondArityIsRejected() {
			GateLibrary.Builder builder = withPrimitive().define("Not", 1, "Nand(param0, param1)");

			assertThatThrownBy(builder::build)
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("'param1' but the gate takes 1 arguments");
		}

		@Test
		void unusedParameterIsRejected() {
			GateLibrary.Builder builder = withPrimitive().define("Left", 2, "Nand(param0, param0)");

			assertThatThrownBy(builder::build)
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("uses 1 of its 2 parameters");
		}

		@Test
		void freeVariableIsRejected() {
			GateLibrary.Builder builder = withPrimitive().define("Half", 1, "Nand(param0, x)");

			assertThatThrownBy(builder::build)
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("'x' which is not a placeholder");
		}

		@Test
		void cyclicDefinitionsAreRejected() {
			GateLibrary.Builder builder = withPrimitive()
					.define("Ping", 1, "Pong(param0)")
					.define("Pong", 1, "Ping(param0)");

			assertThatThrownBy(builder::build)
					.isInstanceOf(IllegalStateException.class)
					.hasMessage("Gate definitions are cyclic: Ping -> Pong -> Ping");
		}

		@Test
		void selfReferenceIsRejected() {
			GateLibrary.Builder builder = withPrimitive().define("Loop", 1, "Nand(Loop(param0), param0)");

			assertThatThrownBy(builder::build)
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("cyclic");
		}

		@Test
		void referenceToUndefinedGateIsRejected() {
			GateLibrary.Builder builder = withPrimitive().define("Nor", 2, "Not(Or(param0, param1))");

			assertThatThrownBy(builder::build)
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("refers to undefined gate 'Not'");
		}

		@Test
		void stagedTemplateWithWrongArityIsRejected() {
			GateLibrary.Builder builder = withPrimitive()
					.define("Not", 1, "Nand(param0, param0)")
					.define("Bad", 2, "Not(param0, param1)");

			assertThatThrownBy(builder::build)
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("Template of gate 'Bad' is invalid");
		}

		@Test
		void duplicateNamesAreRejected() {
			assertThatThrownBy(() -> withPrimitive().define("Nand", 2, "Nand(param0, param1)"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("defined more than once");
		}

		@Test
		void templateMustBeACall() {
			assertThatThrownBy(() -> new GateTemplate("Id", 1, variable("param0")))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Test
	void stagedDefinitionsMayAppearInAnyOrder() {
		GateLibrary library = withPrimitive()
				.define("Nor", 2, "Not(Or(param0, param1))")
				.define("Or", 2, "Nand(Not(param0), Not(param1))")
				.define("Not", 1, "Nand(param0, param0)")
				.build();

		ExprNode or = ExprParser.parseExpression("Nand(Nand(param0, param0), Nand(param1, param1))");
		assertThat(library.requireGate("Or").template()).isEqualTo(or);
		assertThat(library.requireGate("Nor").template()).isEqualTo(call("Nand", or, or));
	}

	@Test
	void stagedExpansionIsLogged() {
		try (LogCapture log = LogCapture.capture(GateLibrary.class, Level.DEBUG)) {
			withPrimitive()
					.define("Not", 1, "Nand(param0, param0)")
					.define("Buffer", 1, "Not(Not(param0))")
					.build();

			assertThat(log.messages())
					.contains("Expanded staged template of gate 'Buffer' to 7 nodes")
					.contains("Registered gate 'Not' with arity 1")
					.noneMatch(message -> message.contains("Expanded staged template of gate 'Not'"));
		}
	}
}
