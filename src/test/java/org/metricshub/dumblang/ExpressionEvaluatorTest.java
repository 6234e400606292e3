package org.metricshub.dumblang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.Test;
import org.metricshub.dumblang.frontend.ast.ParserException;
import org.metricshub.dumblang.util.DslSettings;

public class ExpressionEvaluatorTest {

	@Test
	public void testArithmetic() throws Exception {
		assertEquals(7.0, ExpressionEvaluator.eval("1 + 2 * 3"));
		assertEquals(3.0, ExpressionEvaluator.eval("7 / 2"));
		assertEquals(512.0, ExpressionEvaluator.eval("2 ^ 3 ^ 2"));
		assertEquals(Boolean.TRUE, ExpressionEvaluator.eval("1 < 2"));
		assertEquals("ab", ExpressionEvaluator.eval("\"a\" + \"b\""));
	}

	@Test
	public void testEnvironment() throws Exception {
		DslSettings settings = new DslSettings();
		assertEquals(6.0, ExpressionEvaluator.eval("env[1] * 3", Arrays.asList(1, 2), settings));
		assertEquals(0.0, ExpressionEvaluator.eval("env"));
	}

	@Test
	public void testBuiltins() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		DslSettings settings = new DslSettings();
		settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8));
		assertEquals(3.0, ExpressionEvaluator.eval("sqrt(9)", null, settings));
		ExpressionEvaluator.eval("print(env)", "shown", settings);
		assertEquals("DSL> shown\n", out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
	}

	@Test
	public void testInvalidExpressions() {
		assertThrows(ParserException.class, () -> ExpressionEvaluator.eval("1 +"));
		assertThrows(ParserException.class, () -> ExpressionEvaluator.eval("1; 2"));
	}
}
