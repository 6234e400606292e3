package org.metricshub.dumblang.backend;

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
 * Interpret a parsed DumbLang program within this JVM.
 */
public interface DslInterpreter {
	/**
	 * Run the program's {@code main} function to completion.
	 *
	 * @param entryValue value bound to the parameter of {@code main}
	 * @return the value returned by {@code main}, {@code null} when none
	 * @throws org.metricshub.dumblang.jrt.DslRuntimeException when the program fails
	 * @throws org.metricshub.dumblang.jrt.IllegalDslArgumentException on operand type or arity mismatch
	 */
	Object execute(Object entryValue);
}
