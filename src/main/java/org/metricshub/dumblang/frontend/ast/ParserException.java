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

/**
 * Thrown when the program text cannot be scanned or parsed: an unterminated
 * string, an unexpected token, a missing or duplicated function definition.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final int lineNumber;

	/**
	 * <p>
	 * Constructor for ParserException.
	 * </p>
	 *
	 * @param msg description of the problem
	 * @param sourceDescription where the program came from
	 * @param lineNumber 1-based line of the offending token
	 */
	public ParserException(String msg, String sourceDescription, int lineNumber) {
		super(msg);
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
	}

	/**
	 * @return description of the source the error was found in
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * @return the offending line number
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
