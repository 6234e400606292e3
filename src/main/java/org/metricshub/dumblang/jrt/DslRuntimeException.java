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
 * Failure of a DumbLang program while it runs: an index out of range, a
 * division by zero, an assignment to an expression that is neither a
 * variable nor an array element, a call nested deeper than the configured
 * maximum, or an undefined name ({@link UndefinedNameException}). The line is
 * the one of the expression being evaluated.
 * <p>
 * Type mismatches are reported as {@link IllegalDslArgumentException}
 * instead.
 */
public class DslRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	/**
	 * @param lineno line of the expression that failed
	 * @param msg description of the failure
	 */
	public DslRuntimeException(int lineno, String msg) {
		super(msg);
		this.lineNumber = lineno;
	}

	/**
	 * @return line of the expression that failed
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
