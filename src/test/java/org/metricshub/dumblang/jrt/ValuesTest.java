package org.metricshub.dumblang.jrt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import org.junit.Test;

public class ValuesTest {

	@Test
	public void testFormatNumber() {
		assertEquals("3.0", Values.formatNumber(3));
		assertEquals("-2.5", Values.formatNumber(-2.5));
		assertEquals("0.1", Values.formatNumber(0.1));
		assertEquals("100.0", Values.formatNumber(100));
		assertEquals("0.0001", Values.formatNumber(0.0001));
		assertEquals("1e-05", Values.formatNumber(0.00001));
		assertEquals("1000000000000000.0", Values.formatNumber(1e15));
		assertEquals("1e+16", Values.formatNumber(1e16));
		assertEquals("1.5e+300", Values.formatNumber(1.5e300));
		assertEquals("0.0", Values.formatNumber(0.0));
		assertEquals("-0.0", Values.formatNumber(-0.0));
		assertEquals("nan", Values.formatNumber(Double.NaN));
		assertEquals("inf", Values.formatNumber(Double.POSITIVE_INFINITY));
		assertEquals("-inf", Values.formatNumber(Double.NEGATIVE_INFINITY));
	}

	@Test
	public void testDisplay() {
		assertEquals("None", Values.toDisplayString(null));
		assertEquals("True", Values.toDisplayString(Boolean.TRUE));
		assertEquals("text", Values.toDisplayString("text"));
		assertEquals("'text'", Values.toRepr("text"));
		assertEquals("[1.0, 'a', [], None, False]", Values.toDisplayString(Arrays.asList(1, "a", new ArrayList<Object>(), null, false)));
	}

	@Test
	public void testQuote() {
		assertEquals("'plain'", Values.quote("plain"));
		assertEquals("\"it's\"", Values.quote("it's"));
		assertEquals("'a\\'b\"c'", Values.quote("a'b\"c"));
		assertEquals("'tab\\there'", Values.quote("tab\there"));
		assertEquals("'back\\\\slash'", Values.quote("back\\slash"));
	}

	@Test
	public void testNormalize() {
		assertEquals(Double.valueOf(3), Values.normalize(3));
		assertEquals(Double.valueOf(2), Values.normalize(2L));
		assertEquals("c", Values.normalize('c'));
		List<Object> list = new ArrayList<Object>();
		assertSame(list, Values.normalize(list));
		assertEquals(Arrays.asList("a", "b"), Values.normalize(new LinkedHashSet<String>(Arrays.asList("a", "b"))));
		assertEquals(Arrays.asList("x", 1), Values.normalize(new Object[] { "x", 1 }));
	}

	@Test
	public void testTruthiness() {
		assertFalse(Values.toBoolean(null));
		assertFalse(Values.toBoolean(0.0));
		assertTrue(Values.toBoolean(-1.0));
		assertFalse(Values.toBoolean(""));
		assertTrue(Values.toBoolean("0"));
		assertFalse(Values.toBoolean(Collections.emptyList()));
		assertTrue(Values.toBoolean(Collections.singletonList(0.0)));
		assertFalse(Values.toBoolean(Boolean.FALSE));
	}

	@Test
	public void testArithmetic() {
		assertEquals(5.0, Values.add(2.0, 3.0, 1));
		assertEquals("ab", Values.add("a", "b", 1));
		assertEquals(Arrays.asList(1.0, 2.0), Values.add(Arrays.asList(1.0), Arrays.asList(2.0), 1));
		assertEquals(3.0, Values.floorDivide(7.0, 2.0, 1));
		assertEquals(-4.0, Values.floorDivide(-7.0, 2.0, 1));
		assertEquals(512.0, Values.power(2.0, 9.0, 1));
		assertEquals(-1.0, Values.subtract(2.0, 3.0, 1));
		assertEquals(6.0, Values.multiply(2.0, 3.0, 1));

		IllegalDslArgumentException mismatch = assertThrows(
				IllegalDslArgumentException.class,
				() -> Values.add("a", 1.0, 7));
		assertEquals(7, mismatch.getLineNumber());
		assertEquals("Unsupported operand types for '+': string and number", mismatch.getMessage());
		assertThrows(IllegalDslArgumentException.class, () -> Values.multiply("a", 2.0, 1));
		assertThrows(IllegalDslArgumentException.class, () -> Values.subtract(null, 2.0, 1));
		assertThrows(IllegalDslArgumentException.class, () -> Values.add(Boolean.TRUE, "a", 1));
		DslRuntimeException zero = assertThrows(DslRuntimeException.class, () -> Values.floorDivide(1.0, 0.0, 4));
		assertEquals(4, zero.getLineNumber());
	}

	@Test
	public void testFloorDivisionUsesTheExactRemainder() {
		assertEquals(9.0, Values.floorDivide(1.0, 0.1, 1));
		assertEquals(-10.0, Values.floorDivide(-1.0, 0.1, 1));
		assertEquals(2.0, Values.floorDivide(7.0, 3.0, 1));
		assertEquals(-3.0, Values.floorDivide(7.0, -3.0, 1));
		assertEquals(2.0, Values.floorDivide(0.9, 0.3, 1));
		assertEquals(0.0, Values.floorDivide(1.0, 3.0, 1));
		assertEquals(-0.0, Values.floorDivide(-0.0, 3.0, 1));
	}

	@Test
	public void testBooleansCountAsNumbers() {
		assertEquals(1.0, Values.add(0.0, Boolean.TRUE, 1));
		assertEquals(2.0, Values.add(Boolean.TRUE, Boolean.TRUE, 1));
		assertEquals(-1.0, Values.subtract(Boolean.FALSE, 1.0, 1));
		assertEquals(3.0, Values.multiply(Boolean.TRUE, 3.0, 1));
		assertEquals(Boolean.TRUE, Values.lessThan(Boolean.FALSE, 1.0, 1));
		assertTrue(Values.isEqual(Boolean.TRUE, 1.0));
		assertTrue(Values.isEqual(0.0, Boolean.FALSE));
		assertFalse(Values.isEqual(Boolean.TRUE, 2.0));
		assertFalse(Values.isEqual(Boolean.TRUE, "1"));
		assertEquals(1, Values.toIndex(Boolean.TRUE, 3, 1));
	}

	@Test
	public void testComparisons() {
		assertEquals(Boolean.TRUE, Values.lessThan(1.0, 2.0, 1));
		assertEquals(Boolean.FALSE, Values.greaterThan(1.0, 2.0, 1));
		assertEquals(Boolean.TRUE, Values.lessThan("abc", "abd", 1));
		assertEquals(Boolean.FALSE, Values.lessThan(Double.NaN, 2.0, 1));
		assertEquals(Boolean.FALSE, Values.greaterThan(Double.NaN, 2.0, 1));
		assertThrows(IllegalDslArgumentException.class, () -> Values.lessThan("a", 1.0, 1));

		assertTrue(Values.isEqual(1.0, 1));
		assertTrue(Values.isEqual(null, null));
		assertFalse(Values.isEqual(null, 0.0));
		assertFalse(Values.isEqual("1", 1.0));
		assertTrue(Values.isEqual(Arrays.asList(1, "a"), Arrays.asList(1.0, "a")));
		assertFalse(Values.isEqual(Arrays.asList(1.0), Arrays.asList(1.0, 2.0)));
	}

	@Test
	public void testToIndex() {
		assertEquals(1, Values.toIndex(1.9, 3, 1));
		assertEquals(2, Values.toIndex(-1.0, 3, 1));
		assertThrows(DslRuntimeException.class, () -> Values.toIndex(3.0, 3, 1));
		assertThrows(DslRuntimeException.class, () -> Values.toIndex(-4.0, 3, 1));
		assertThrows(DslRuntimeException.class, () -> Values.toIndex(Double.NaN, 3, 1));
		assertThrows(IllegalDslArgumentException.class, () -> Values.toIndex("0", 3, 1));
	}

	@Test
	public void testTypeName() {
		assertEquals("none", Values.typeName(null));
		assertEquals("number", Values.typeName(1.0));
		assertEquals("string", Values.typeName(""));
		assertEquals("boolean", Values.typeName(Boolean.TRUE));
		assertEquals("array", Values.typeName(Collections.emptyList()));
	}
}
