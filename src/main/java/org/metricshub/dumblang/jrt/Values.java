package org.metricshub.dumblang.jrt;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DumbLang
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Static helpers implementing the DumbLang value semantics: conversion of host
 * values, truthiness, operators and the textual display of values.
 * <p>
 * Runtime values are limited to:
 * <ul>
 * <li><strong>Double</strong> - every number
 * <li><strong>String</strong> - text
 * <li><strong>Boolean</strong> - the result of a comparison, which counts
 * as 1 or 0 wherever a number is expected
 * <li><strong>List</strong> - arrays, mutable and shared by reference
 * <li><strong>null</strong> - no value
 * </ul>
 * Display follows the conventions of Python's {@code str()} so that a program
 * prints the same text when evaluated and when rendered as Python.
 */
public final class Values {

	private Values() {}

	/**
	 * Converts a value handed over by the host (entry value, builtin result)
	 * into a runtime value. Numbers become {@link Double}, characters become
	 * one-character strings and Java arrays or collections become mutable
	 * lists. Collections that already are lists are kept by reference.
	 *
	 * @param o host value
	 * @return the equivalent runtime value
	 */
	@SuppressWarnings("unchecked")
	public static Object normalize(Object o) {
		if (o == null || o instanceof Double || o instanceof String || o instanceof Boolean) {
			return o;
		}
		if (o instanceof Number) {
			return Double.valueOf(((Number) o).doubleValue());
		}
		if (o instanceof Character) {
			return o.toString();
		}
		if (o instanceof List) {
			return o;
		}
		if (o instanceof Collection) {
			return new ArrayList<Object>((Collection<Object>) o);
		}
		if (o instanceof Object[]) {
			return new ArrayList<Object>(Arrays.asList((Object[]) o));
		}
		return o;
	}

	/**
	 * Truthiness of a runtime value.
	 *
	 * @param o value to test
	 * @return <ul>
	 *         <li><strong>null</strong> - false
	 *         <li><strong>Boolean</strong> - its value
	 *         <li><strong>Number</strong> - o.doubleValue() != 0
	 *         <li><strong>String</strong> - o.length() &gt; 0
	 *         <li><strong>List</strong> - !o.isEmpty()
	 *         </ul>
	 *         Any other host object is true.
	 */
	public static boolean toBoolean(Object o) {
		if (o == null) {
			return false;
		}
		if (o instanceof Boolean) {
			return ((Boolean) o).booleanValue();
		}
		if (o instanceof Number) {
			return ((Number) o).doubleValue() != 0;
		}
		if (o instanceof String) {
			return !((String) o).isEmpty();
		}
		if (o instanceof List) {
			return !((List<?>) o).isEmpty();
		}
		return true;
	}

	/**
	 * Returns the numeric value of {@code o}, refusing anything that is not a
	 * number or a boolean. {@code true} is 1 and {@code false} is 0.
	 *
	 * @param o value to convert
	 * @param line source line, for the diagnostic
	 * @param what description of the operand, for the diagnostic
	 * @return the double value
	 * @throws IllegalDslArgumentException when {@code o} is not a number
	 */
	public static double toDouble(Object o, int line, String what) {
		if (isNumeric(o)) {
			return numberValue(o);
		}
		throw new IllegalDslArgumentException(line, what + " must be a number, not " + typeName(o));
	}

	/**
	 * Resolves an index against a sequence of the given length. The index is
	 * truncated toward zero and a negative index counts from the end.
	 *
	 * @param index the index value
	 * @param length length of the indexed sequence
	 * @param line source line, for the diagnostic
	 * @return a valid position in {@code [0, length)}
	 * @throws DslRuntimeException when the index is out of range
	 */
	public static int toIndex(Object index, int length, int line) {
		double d = toDouble(index, line, "Index");
		if (Double.isNaN(d) || Double.isInfinite(d)) {
			throw new DslRuntimeException(line, "Index " + toDisplayString(index) + " is not a finite number");
		}
		long position = (long) d;
		if (position < 0) {
			position += length;
		}
		if (position < 0 || position >= length) {
			throw new DslRuntimeException(
					line,
					"Index " + toDisplayString(index) + " out of range for length " + length);
		}
		return (int) position;
	}

	/**
	 * {@code +}: numbers are added, strings concatenated and arrays
	 * concatenated into a new array.
	 */
	public static Object add(Object left, Object right, int line) {
		if (isNumeric(left) && isNumeric(right)) {
			return numberValue(left) + numberValue(right);
		}
		if (left instanceof String && right instanceof String) {
			return (String) left + (String) right;
		}
		if (left instanceof List && right instanceof List) {
			List<Object> result = new ArrayList<Object>((List<?>) left);
			result.addAll((List<?>) right);
			return result;
		}
		throw operandMismatch("+", left, right, line);
	}

	public static Object subtract(Object left, Object right, int line) {
		return toDouble(left, line, "Left operand of '-'") - toDouble(right, line, "Right operand of '-'");
	}

	public static Object multiply(Object left, Object right, int line) {
		return toDouble(left, line, "Left operand of '*'") * toDouble(right, line, "Right operand of '*'");
	}

	/**
	 * {@code /} is floor division: {@code 7 / 2} is {@code 3} and
	 * {@code -7 / 2} is {@code -4}.
	 * <p>
	 * The quotient is derived from the exact remainder rather than from
	 * {@code dividend / divisor}, whose rounding can cross an integer:
	 * {@code 1 / 0.1} is {@code 9}, like Python's {@code 1.0 // 0.1}.
	 */
	public static Object floorDivide(Object left, Object right, int line) {
		double dividend = toDouble(left, line, "Left operand of '/'");
		double divisor = toDouble(right, line, "Right operand of '/'");
		if (divisor == 0) {
			throw new DslRuntimeException(line, "Division by zero");
		}
		double mod = dividend % divisor;
		double div = (dividend - mod) / divisor;
		if (mod != 0 && (divisor < 0) != (mod < 0)) {
			div -= 1.0;
		}
		if (div == 0) {
			return Math.copySign(0.0, dividend / divisor);
		}
		double floor = Math.floor(div);
		if (div - floor > 0.5) {
			floor += 1.0;
		}
		return floor;
	}

	public static Object power(Object left, Object right, int line) {
		return Math.pow(toDouble(left, line, "Base of '^'"), toDouble(right, line, "Exponent of '^'"));
	}

	/**
	 * Ordering comparison of two numbers (booleans included) or two strings.
	 *
	 * @return a negative number, zero or a positive number
	 */
	public static int compare(String operator, Object left, Object right, int line) {
		if (isNumeric(left) && isNumeric(right)) {
			return Double.compare(numberValue(left), numberValue(right));
		}
		if (left instanceof String && right instanceof String) {
			return ((String) left).compareTo((String) right);
		}
		throw operandMismatch(operator, left, right, line);
	}

	public static Object lessThan(Object left, Object right, int line) {
		if (isNaN(left) || isNaN(right)) {
			return Boolean.FALSE;
		}
		return Boolean.valueOf(compare("<", left, right, line) < 0);
	}

	public static Object greaterThan(Object left, Object right, int line) {
		if (isNaN(left) || isNaN(right)) {
			return Boolean.FALSE;
		}
		return Boolean.valueOf(compare(">", left, right, line) > 0);
	}

	/**
	 * Value equality across all runtime types. Arrays are equal when their
	 * elements are pairwise equal, and {@code (1 < 2) == 1} holds.
	 */
	public static boolean isEqual(Object left, Object right) {
		if (left == null || right == null) {
			return left == right;
		}
		if (isNumeric(left) && isNumeric(right)) {
			return numberValue(left) == numberValue(right);
		}
		if (left instanceof List && right instanceof List) {
			List<?> l = (List<?>) left;
			List<?> r = (List<?>) right;
			if (l.size() != r.size()) {
				return false;
			}
			for (int i = 0; i < l.size(); i++) {
				if (!isEqual(normalize(l.get(i)), normalize(r.get(i)))) {
					return false;
				}
			}
			return true;
		}
		return left.equals(right);
	}

	private static boolean isNumeric(Object o) {
		return o instanceof Number || o instanceof Boolean;
	}

	private static double numberValue(Object o) {
		if (o instanceof Boolean) {
			return ((Boolean) o).booleanValue() ? 1.0 : 0.0;
		}
		return ((Number) o).doubleValue();
	}

	private static boolean isNaN(Object o) {
		return o instanceof Number && Double.isNaN(((Number) o).doubleValue());
	}

	private static IllegalDslArgumentException operandMismatch(String operator, Object left, Object right, int line) {
		return new IllegalDslArgumentException(
				line,
				"Unsupported operand types for '" + operator + "': " + typeName(left) + " and " + typeName(right));
	}

	/**
	 * @param o runtime value
	 * @return the DumbLang name of the value's type
	 */
	public static String typeName(Object o) {
		if (o == null) {
			return "none";
		}
		if (o instanceof Number) {
			return "number";
		}
		if (o instanceof String) {
			return "string";
		}
		if (o instanceof Boolean) {
			return "boolean";
		}
		if (o instanceof List) {
			return "array";
		}
		return o.getClass().getSimpleName();
	}

	/**
	 * Text written by {@code print} for a value: strings as-is, everything else
	 * as {@link #toRepr(Object)}.
	 *
	 * @param o value to display
	 * @return its display text
	 */
	public static String toDisplayString(Object o) {
		if (o instanceof String) {
			return (String) o;
		}
		return toRepr(o);
	}

	/**
	 * Literal-like text of a value, the way it appears inside an array:
	 * strings quoted, numbers always with a fractional part or an exponent,
	 * {@code True}/{@code False}/{@code None}.
	 *
	 * @param o value to represent
	 * @return its representation
	 */
	public static String toRepr(Object o) {
		if (o == null) {
			return "None";
		}
		if (o instanceof Boolean) {
			return ((Boolean) o).booleanValue() ? "True" : "False";
		}
		if (o instanceof Number) {
			return formatNumber(((Number) o).doubleValue());
		}
		if (o instanceof String) {
			return quote((String) o);
		}
		if (o instanceof List) {
			StringBuilder sb = new StringBuilder("[");
			boolean first = true;
			for (Object element : (List<?>) o) {
				if (!first) {
					sb.append(", ");
				}
				first = false;
				sb.append(toRepr(normalize(element)));
			}
			return sb.append(']').toString();
		}
		return o.toString();
	}

	/**
	 * Formats a number the way Python's {@code repr(float)} does: the shortest
	 * digits that round-trip, plain notation for decimal exponents in
	 * {@code [-4, 16)}, scientific notation otherwise.
	 *
	 * @param d number to format
	 * @return its text
	 */
	public static String formatNumber(double d) {
		if (Double.isNaN(d)) {
			return "nan";
		}
		if (Double.isInfinite(d)) {
			return d > 0 ? "inf" : "-inf";
		}
		if (d == 0) {
			return (1 / d < 0) ? "-0.0" : "0.0";
		}
		BigDecimal decimal = new BigDecimal(Double.toString(d)).stripTrailingZeros();
		int exponent = decimal.precision() - decimal.scale() - 1;
		if (exponent < -4 || exponent >= 16) {
			String digits = decimal.unscaledValue().abs().toString();
			StringBuilder sb = new StringBuilder();
			if (d < 0) {
				sb.append('-');
			}
			sb.append(digits.charAt(0));
			if (digits.length() > 1) {
				sb.append('.').append(digits, 1, digits.length());
			}
			sb.append('e').append(exponent < 0 ? '-' : '+');
			int absExponent = Math.abs(exponent);
			if (absExponent < 10) {
				sb.append('0');
			}
			return sb.append(absExponent).toString();
		}
		String plain = decimal.toPlainString();
		if (plain.indexOf('.') < 0) {
			plain += ".0";
		}
		return plain;
	}

	/**
	 * Quotes a string the way Python's {@code repr(str)} does for printable
	 * text: single quotes, unless the text contains a single quote and no
	 * double quote.
	 *
	 * @param s string to quote
	 * @return the quoted string
	 */
	public static String quote(String s) {
		char quote = (s.indexOf('\'') >= 0 && s.indexOf('"') < 0) ? '"' : '\'';
		StringBuilder sb = new StringBuilder();
		sb.append(quote);
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c == '\\') {
				sb.append("\\\\");
			} else if (c == quote) {
				sb.append('\\').append(c);
			} else if (c == '\t') {
				sb.append("\\t");
			} else if (c == '\r') {
				sb.append("\\r");
			} else if (c == '\n') {
				sb.append("\\n");
			} else {
				sb.append(c);
			}
		}
		return sb.append(quote).toString();
	}
}
