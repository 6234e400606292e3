package org.metricshub.dumblang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.metricshub.dumblang.DslTestSupport.TestResult;
import org.metricshub.dumblang.ext.Builtin;
import org.metricshub.dumblang.frontend.ast.ParserException;
import org.metricshub.dumblang.jrt.DslRuntimeException;
import org.metricshub.dumblang.jrt.IllegalDslArgumentException;
import org.metricshub.dumblang.jrt.UndefinedNameException;
import org.metricshub.dumblang.util.DslSettings;

public class DumbLangTest {

	@Test
	public void testFloorDivision() throws Exception {
		DslTestSupport.dslTest("7 / 2").script("main() { return 7 / 2; }").expectResult(3.0).runAndAssert();
		DslTestSupport.dslTest("-7 / 2").script("main() { return (-7) / 2; }").expectResult(-4.0).runAndAssert();
	}

	@Test
	public void testPowerIsRightAssociative() throws Exception {
		DslTestSupport.dslTest("2 ^ 3 ^ 2").script("main() { return 2 ^ 3 ^ 2; }").expectResult(512.0).runAndAssert();
	}

	@Test
	public void testPrecedence() throws Exception {
		DslTestSupport.dslTest("1 + 2 * 3").script("main() { return 1 + 2 * 3; }").expectResult(7.0).runAndAssert();
		DslTestSupport.dslTest("2 * 3 ^ 2").script("main() { return 2 * 3 ^ 2; }").expectResult(18.0).runAndAssert();
		DslTestSupport.dslTest("10 - 4 - 3").script("main() { return 10 - 4 - 3; }").expectResult(3.0).runAndAssert();
		DslTestSupport
				.dslTest("parentheses")
				.script("main() { return (1 + 2) * 3; }")
				.expectResult(9.0)
				.runAndAssert();
	}

	@Test
	public void testComparisonsInArithmetic() throws Exception {
		DslTestSupport
				.dslTest("i + 1 < 3 adds the comparison")
				.script("main() { i = 0; w = i + 1 < 3; return w; }")
				.expectResult(1.0)
				.runAndAssert();
		DslTestSupport.dslTest("(1 < 2) == 1").script("main() { return (1 < 2) == 1; }").expectResult(true).runAndAssert();
		DslTestSupport.dslTest("x == 1 + 1").script("main() { x = 1; return x == 1 + 1; }").expectResult(2.0).runAndAssert();
		DslTestSupport.dslTest("1 / 0.1").script("main() { return 1 / 0.1; }").expectResult(9.0).runAndAssert();
	}

	@Test
	public void testUnarySign() throws Exception {
		DslTestSupport.dslTest("(-3 + 5)").script("main() { return (-3 + 5); }").expectResult(-8.0).runAndAssert();
		DslTestSupport.dslTest("(-2 + 3)").script("main() { return (-2 + 3); }").expectResult(-5.0).runAndAssert();
		DslTestSupport.dslTest("(-2) + 3").script("main() { return (-2) + 3; }").expectResult(1.0).runAndAssert();
		DslTestSupport.dslTest("(+4)").script("main() { x = 4; return (+x); }").expectResult(4.0).runAndAssert();
		DslTestSupport
				.dslTest("unary outside parentheses")
				.script("main() { return -3; }")
				.expectThrow(ParserException.class)
				.runAndAssert();
	}

	@Test
	public void testArrayAliasing() throws Exception {
		DslTestSupport
				.dslTest("array aliasing")
				.script("main() { a = [1, 2, 3]; b = a; b[0] = 9; return a[0]; }")
				.expectResult(9.0)
				.runAndAssert();
	}

	@Test
	public void testEarlyReturnFromNestedLoop() throws Exception {
		DslTestSupport
				.dslTest("return nested in while in if")
				.script(
						"main() {\n"
								+ "  i = 0;\n"
								+ "  if (1) {\n"
								+ "    while (1) {\n"
								+ "      i = i + 1;\n"
								+ "      if (i == 5) { return i; } else { }\n"
								+ "    }\n"
								+ "  } else { }\n"
								+ "  print(\"unreachable\");\n"
								+ "}\n")
				.expect("")
				.expectResult(5.0)
				.runAndAssert();
	}

	@Test
	public void testTruthiness() throws Exception {
		DslTestSupport
				.dslTest("comparison is truthy")
				.script("main() { if (1 < 2) { print(\"y\"); } else { print(\"n\"); } }")
				.expect("DSL> y\n")
				.runAndAssert();
		DslTestSupport
				.dslTest("zero is falsy")
				.script("main() { if (0) { print(\"y\"); } else { print(\"n\"); } }")
				.expectLines("DSL> n")
				.runAndAssert();
		DslTestSupport
				.dslTest("empty string is falsy")
				.script("main() { if (\"\") { print(\"y\"); } else { print(\"n\"); } if (\"a\") { print(\"y\"); } else { print(\"n\"); } }")
				.expectLines("DSL> n", "DSL> y")
				.runAndAssert();
	}

	@Test
	public void testUndefinedVariable() throws Exception {
		TestResult result = DslTestSupport
				.dslTest("undefined variable")
				.script("main() {\n  return nope;\n}")
				.expectThrow(UndefinedNameException.class)
				.run();
		result.assertExpected();
		UndefinedNameException e = (UndefinedNameException) result.thrownException();
		assertEquals("nope", e.getName());
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testUndefinedFunction() throws Exception {
		DslTestSupport
				.dslTest("undefined function")
				.script("main() { nope(); }")
				.expectThrow(UndefinedNameException.class)
				.runAndAssert();
	}

	@Test
	public void testEndToEnd() throws Exception {
		DslTestSupport
				.dslTest("countdown")
				.script("main(){ x = 3; y = x + 4; while (y > 0) { y = y - 1; } return y; }")
				.expectResult(0.0)
				.runAndAssert();
	}

	@Test
	public void testSharedStoreClobbersRecursion() throws Exception {
		String fact = "fact(n) { if (n < 2) { return 1; } else { return fact(n - 1) * n; } }\n"
				+ "main() { return fact(3); }";
		DslTestSupport.dslTest("shared store").script(fact).expectResult(1.0).runAndAssert();
		DslTestSupport.dslTest("activation frames").script(fact).frames().expectResult(6.0).runAndAssert();
	}

	@Test
	public void testNoReturnGivesNone() throws Exception {
		assertNull(new DumbLang().evaluate("main() { x = 1; }"));
		assertNull(new DumbLang().evaluate("main() { return; }"));
	}

	@Test
	public void testEntryValue() throws Exception {
		DslTestSupport.dslTest("named parameter").script("main(n) { return n * 2; }").entry(21).expectResult(42.0).runAndAssert();
		DslTestSupport.dslTest("env").script("main() { return env; }").entry("abc").expectResult("abc").runAndAssert();
		DslTestSupport.dslTest("default").script("main() { return env; }").expectResult(0.0).runAndAssert();
	}

	@Test
	public void testPrintDisplay() throws Exception {
		DslTestSupport
				.dslTest("display of values")
				.script(
						"main() { print(3); print(2.5); print(\"txt\"); print(1 == 1); print([1, \"a\", [2]]); print(); print(10 ^ 20); }")
				.expectLines("DSL> 3.0", "DSL> 2.5", "DSL> txt", "DSL> True", "DSL> [1.0, 'a', [2.0]]", "DSL> None", "DSL> 1e+20")
				.runAndAssert();
	}

	@Test
	public void testStringsAndArrays() throws Exception {
		DslTestSupport.dslTest("concatenation").script("main() { return \"ab\" + \"cd\"; }").expectResult("abcd").runAndAssert();
		DslTestSupport.dslTest("string index").script("main() { s = \"hello\"; return s[1]; }").expectResult("e").runAndAssert();
		DslTestSupport.dslTest("negative index").script("main() { a = [1, 2, 3]; return a[(-1)]; }").expectResult(3.0).runAndAssert();
		DslTestSupport
				.dslTest("nested index")
				.script("main() { a = [[1, 2], [3, 4]]; a[1][0] = 7; return a[1]; }")
				.expectResult(Arrays.asList(7.0, 4.0))
				.runAndAssert();
		DslTestSupport
				.dslTest("array concatenation")
				.script("main() { a = [1]; b = a + [2]; b[0] = 5; return a + b; }")
				.expectResult(Arrays.asList(1.0, 5.0, 2.0))
				.runAndAssert();
	}

	@Test
	public void testRuntimeFailures() throws Exception {
		DslTestSupport
				.dslTest("division by zero")
				.script("main() { return 1 / 0; }")
				.expectThrow(DslRuntimeException.class)
				.runAndAssert();
		DslTestSupport
				.dslTest("index out of range")
				.script("main() { a = [1]; return a[3]; }")
				.expectThrow(DslRuntimeException.class)
				.runAndAssert();
		DslTestSupport
				.dslTest("operand types")
				.script("main() { return 1 + \"a\"; }")
				.expectThrow(IllegalDslArgumentException.class)
				.runAndAssert();
		DslTestSupport
				.dslTest("string element assignment")
				.script("main() { s = \"abc\"; s[0] = \"x\"; }")
				.expectThrow(IllegalDslArgumentException.class)
				.runAndAssert();
		DslTestSupport
				.dslTest("arity")
				.script("f(x) { return x; } main() { return f(); }")
				.expectThrow(IllegalDslArgumentException.class)
				.runAndAssert();
		DslTestSupport
				.dslTest("assignment to a literal")
				.script("main() { 1 = 2; }")
				.expectThrow(DslRuntimeException.class)
				.runAndAssert();
	}

	@Test
	public void testCallDepthLimit() throws Exception {
		DslSettings settings = new DslSettings();
		settings.setMaxCallDepth(50);
		DumbLang dumbLang = new DumbLang(settings);
		try {
			dumbLang.evaluate("loop() { return loop(); } main() { return loop(); }");
		} catch (DslRuntimeException e) {
			assertTrue(e.getMessage().contains("Maximum call depth of 50"));
			return;
		}
		throw new AssertionError("Expected the call depth limit to stop the recursion");
	}

	@Test
	public void testInput() throws Exception {
		DslTestSupport
				.dslTest("input with prompts")
				.script("main() { name = inpstr(); n = inpnum(); print(name); return n * 2; }")
				.stdin("bob\n 21 \n")
				.expectLines("DSL<(str)", "DSL<(num)", "DSL> bob")
				.expectResult(42.0)
				.runAndAssert();
		DslTestSupport
				.dslTest("input without prompts")
				.script("main() { return inpstr(); }")
				.stdin("line")
				.noPrompt()
				.expect("")
				.expectResult("line")
				.runAndAssert();
		DslTestSupport
				.dslTest("number parse failure is a host failure")
				.script("main() { return inpnum(); }")
				.stdin("abc\n")
				.expectThrow(NumberFormatException.class)
				.runAndAssert();
		DslTestSupport
				.dslTest("end of input")
				.script("main() { return inpstr(); }")
				.stdin("")
				.expectThrow(UncheckedIOException.class)
				.runAndAssert();
	}

	@Test
	public void testSqrt() throws Exception {
		DslTestSupport.dslTest("sqrt").script("main() { return sqrt(16); }").expectResult(4.0).runAndAssert();
		DslTestSupport
				.dslTest("sqrt of negative")
				.script("main() { return sqrt((-1)); }")
				.expectThrow(IllegalDslArgumentException.class)
				.runAndAssert();
	}

	@Test
	public void testHostBuiltins() throws Exception {
		List<Object> calls = new ArrayList<Object>();
		DslTestSupport
				.dslTest("host builtins")
				.script("main() { record(\"a\"); return twice(21); }")
				.withBuiltin("record", args -> {
					calls.add(args[0]);
					return null;
				})
				.withBuiltin("twice", args -> ((Double) args[0]) * 2)
				.expectResult(42.0)
				.runAndAssert();
		assertEquals(Collections.singletonList("a"), calls);
	}

	@Test
	public void testHostBuiltinReturningJavaValues() throws Exception {
		Map<String, Builtin> builtins = Collections
				.<String, Builtin>singletonMap("values", args -> Arrays.<Object>asList(1, 'c', 2L));
		DumbLang dumbLang = new DumbLang();
		assertEquals(3.0, dumbLang.evaluate("main() { v = values(); return v[0] + v[2]; }", 0, builtins));
		assertEquals("cd", dumbLang.evaluate("main() { v = values(); return v[1] + \"d\"; }", 0, builtins));
	}

	@Test
	public void testUserFunctionShadowsBuiltin() throws Exception {
		DslTestSupport
				.dslTest("shadowed print")
				.script("print(x) { return x + 1; } main() { return print(1); }")
				.expect("")
				.expectResult(2.0)
				.runAndAssert();
	}

	@Test
	public void testParserErrors() throws Exception {
		DslTestSupport.dslTest("missing main").script("f() { }").expectThrow(ParserException.class).runAndAssert();
		DslTestSupport
				.dslTest("missing else")
				.script("main() { if (1) { } }")
				.expectThrow(ParserException.class)
				.runAndAssert();
		DslTestSupport
				.dslTest("missing semicolon")
				.script("main() { x = 1 }")
				.expectThrow(ParserException.class)
				.runAndAssert();
	}

	@Test
	public void testLastAstAndEvaluator() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		DslSettings settings = new DslSettings();
		settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8));
		DumbLang dumbLang = new DumbLang(settings);
		assertNull(dumbLang.getLastAst());
		dumbLang.evaluate("main() { x = 2; }");
		assertNotNull(dumbLang.getLastAst());
		assertEquals(2.0, dumbLang.getLastEvaluator().getStores().get("main").getVariables().get("x"));
		assertSame(settings, dumbLang.getSettings());
		assertTrue(dumbLang.getBuiltins().contains("print"));
	}
}
