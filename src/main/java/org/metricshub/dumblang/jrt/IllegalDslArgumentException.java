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

/**
 * Thrown when an operator or function receives an operand of the wrong type,
 * or a function is called with the wrong number of arguments.
 * <p>
 * This is deliberately an {@link IllegalArgumentException}: type mismatches are
 * host-level failures, not DumbLang diagnostics.
 */
public class IllegalDslArgumentException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	public IllegalDslArgumentException(String msg) {
		this(-1, msg);
	}

	public IllegalDslArgumentException(int lineno, String msg) {
		super(msg);
		this.lineNumber = lineno;
	}

	/**
	 * Places a failure raised without a line, typically by a builtin, at the
	 * line of the call.
	 *
	 * @param lineno line of the call
	 * @param cause the failure raised by the builtin
	 */
	public IllegalDslArgumentException(int lineno, IllegalDslArgumentException cause) {
		super(cause.getMessage(), cause);
		this.lineNumber = lineno;
	}

	/**
	 * @return the offending line number or {@code -1} if unknown
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
