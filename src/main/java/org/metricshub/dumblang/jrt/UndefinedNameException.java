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
 * Thrown when a called function is absent from the function table, or a
 * variable is read before anything was written to it in its store.
 */
public class UndefinedNameException extends DslRuntimeException {

	private static final long serialVersionUID = 1L;

	private final String name;

	/**
	 * @param lineno line of the reference
	 * @param name the unresolved function or variable name
	 * @param msg description of the failure
	 */
	public UndefinedNameException(int lineno, String name, String msg) {
		super(lineno, msg);
		this.name = name;
	}

	/**
	 * @return the name that could not be resolved
	 */
	public String getName() {
		return name;
	}
}
