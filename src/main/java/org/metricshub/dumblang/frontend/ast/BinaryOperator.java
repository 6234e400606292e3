package org.metricshub.dumblang.frontend.ast;

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

import java.util.HashMap;
import java.util.Map;

/**
 * Binary operators of the language, with their binding power.
 * <p>
 * Assignment is an ordinary binary operator. It shares the lowest binding
 * power with {@code +} and {@code -} and, like {@code ^}, associates to the
 * right: {@code y = y - 1} assigns {@code y - 1} to {@code y}.
 */
public enum BinaryOperator {
	ASSIGN("=", 1, true),
	ADD("+", 1, false),
	SUBTRACT("-", 1, false),
	LESS_THAN("<", 5, false),
	GREATER_THAN(">", 5, false),
	EQUALS("==", 5, false),
	MULTIPLY("*", 10, false),
	DIVIDE("/", 10, false),
	POWER("^", 30, true);

	private static final Map<String, BinaryOperator> BY_SYMBOL = new HashMap<String, BinaryOperator>();

	static {
		for (BinaryOperator op : values()) {
			BY_SYMBOL.put(op.symbol, op);
		}
	}

	private final String symbol;
	private final int precedence;
	private final boolean rightAssociative;

	BinaryOperator(String symbol, int precedence, boolean rightAssociative) {
		this.symbol = symbol;
		this.precedence = precedence;
		this.rightAssociative = rightAssociative;
	}

	public String getSymbol() {
		return symbol;
	}

	public int getPrecedence() {
		return precedence;
	}

	public boolean isRightAssociative() {
		return rightAssociative;
	}

	/**
	 * @param symbol operator text as scanned
	 * @return the matching operator, or {@code null} when the symbol has no
	 *         binding power
	 */
	public static BinaryOperator fromSymbol(String symbol) {
		return BY_SYMBOL.get(symbol);
	}
}
