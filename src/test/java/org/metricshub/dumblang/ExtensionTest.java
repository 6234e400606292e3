package org.metricshub.dumblang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Map;
import org.junit.Test;
import org.metricshub.dumblang.ext.AbstractExtension;
import org.metricshub.dumblang.ext.BuiltinTable;
import org.metricshub.dumblang.ext.ExtensionFunction;
import org.metricshub.dumblang.ext.annotations.DslFunction;
import org.metricshub.dumblang.jrt.IllegalDslArgumentException;

/**
 * Tests the integration of a custom extension implementation with the
 * interpreter.
 */
public class ExtensionTest {

	@Test
	public void testExtensionInvocation() throws Exception {
		DslTestSupport
				.dslTest("extension invocation")
				.script("main() { return shout(\"hey\"); }")
				.withExtensions(new TestExtension())
				.expectResult("HEY!")
				.runAndAssert();
	}

	@Test
	public void testResultsAreConverted() throws Exception {
		DslTestSupport
				.dslTest("int result")
				.script("main() { return answer() / 4; }")
				.withExtensions(new TestExtension())
				.expectResult(10.0)
				.runAndAssert();
		DslTestSupport
				.dslTest("list result")
				.script("main() { r = range(3); r[0] = 7; return r; }")
				.withExtensions(new TestExtension())
				.expectResult(Arrays.asList(7.0, 1.0, 2.0))
				.runAndAssert();
	}

	@Test
	public void testOptionalArgument() throws Exception {
		DslTestSupport
				.dslTest("optional argument")
				.script("main() { return greet() + \", \" + greet(\"bob\"); }")
				.withExtensions(new TestExtension())
				.expectResult("hello world, hello bob")
				.runAndAssert();
	}

	@Test
	public void testExtensionUsesSettings() throws Exception {
		DslTestSupport
				.dslTest("extension output")
				.script("main() { emit(5); print(6); }")
				.withExtensions(new TestExtension())
				.expectLines("ext: 5.0", "DSL> 6.0")
				.runAndAssert();
	}

	@Test
	public void testArgumentValidation() throws Exception {
		DslTestSupport
				.dslTest("missing argument")
				.script("main() { shout(); }")
				.withExtensions(new TestExtension())
				.expectThrow(IllegalDslArgumentException.class)
				.runAndAssert();
		DslTestSupport
				.dslTest("unexpected argument")
				.script("main() { answer(1); }")
				.withExtensions(new TestExtension())
				.expectThrow(IllegalDslArgumentException.class)
				.runAndAssert();
		DslTestSupport
				.dslTest("argument type")
				.script("main() { shout(1); }")
				.withExtensions(new TestExtension())
				.expectThrow(IllegalDslArgumentException.class)
				.runAndAssert();
	}

	@Test
	public void testBuiltinFailuresCarryTheLineOfTheCall() {
		DumbLang dumbLang = new DumbLang(new TestExtension());
		IllegalDslArgumentException type = assertThrows(
				IllegalDslArgumentException.class,
				() -> dumbLang.evaluate("main() {\n  x = 1;\n  shout(x);\n}"));
		assertEquals(3, type.getLineNumber());
		assertTrue(type.getCause() instanceof IllegalDslArgumentException);
		assertEquals(type.getCause().getMessage(), type.getMessage());

		IllegalDslArgumentException domain = assertThrows(
				IllegalDslArgumentException.class,
				() -> dumbLang.evaluate("main() {\n\n  return sqrt((-1));\n}"));
		assertEquals(3, domain.getLineNumber());
		assertEquals("math domain error: sqrt(-1.0)", domain.getMessage());
	}

	@Test
	public void testMetadata() {
		Map<String, ExtensionFunction> functions = new TestExtension().getExtensionFunctions();
		assertEquals(5, functions.size());
		ExtensionFunction greet = functions.get("greet");
		assertEquals("greet", greet.getKeyword());
		assertEquals(1, greet.getArity());
		assertTrue(greet.isArgumentOptional());
		assertEquals(TestExtension.class, greet.getDeclaringType());
		assertEquals(0, functions.get("answer").getArity());
		assertFalse(functions.get("shout").isArgumentOptional());
	}

	@Test
	public void testExtensionReplacesCoreBuiltin() throws Exception {
		DslTestSupport
				.dslTest("replaced print")
				.script("main() { print(\"x\"); }")
				.withExtensions(new QuietExtension())
				.expect("")
				.runAndAssert();
		BuiltinTable table = new DumbLang(new QuietExtension()).getBuiltins();
		assertTrue(table.names().containsAll(Arrays.asList("print", "inpstr", "inpnum", "sqrt")));
	}

	@Test
	public void testInvalidDeclarations() {
		assertThrows(IllegalStateException.class, () -> new TwoParameterExtension().getExtensionFunctions());
		assertThrows(IllegalStateException.class, () -> new BadNameExtension().getExtensionFunctions());
		assertThrows(IllegalStateException.class, () -> new UninitializedExtension().call());
	}

	/** Replaces print with a function that writes nothing. */
	public static class QuietExtension extends AbstractExtension {
		@Override
		public String getExtensionName() {
			return "Quiet";
		}

		@DslFunction(value = "print", argumentOptional = true)
		public Object print(Object value) {
			return null;
		}
	}

	static class TwoParameterExtension extends AbstractExtension {
		@Override
		public String getExtensionName() {
			return "TwoParameters";
		}

		@DslFunction("two")
		public Object two(Object first, Object second) {
			return first;
		}
	}

	static class BadNameExtension extends AbstractExtension {
		@Override
		public String getExtensionName() {
			return "BadName";
		}

		@DslFunction("name1")
		public Object name() {
			return null;
		}
	}

	static class UninitializedExtension extends AbstractExtension {
		@Override
		public String getExtensionName() {
			return "Uninitialized";
		}

		Object call() {
			return getSettings();
		}
	}
}
