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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.dumblang.ext.Builtin;
import org.metricshub.dumblang.ext.BuiltinTable;
import org.metricshub.dumblang.frontend.ast.FunctionDefAst;
import org.metricshub.dumblang.frontend.ast.ProgramAst;
import org.metricshub.dumblang.util.DslLogger;
import org.slf4j.Logger;

/**
 * Every function a program may call: its own definitions and the builtins of
 * the host. A user function shadows a builtin of the same name.
 * <p>
 * The table is built once per run and never changes afterwards.
 */
public final class FunctionTable {

	private static final Logger LOG = DslLogger.getLogger(FunctionTable.class);

	private final Map<String, FunctionDefAst> userFunctions;
	private final BuiltinTable builtins;

	public FunctionTable(ProgramAst program, BuiltinTable builtins) {
		this.builtins = builtins == null ? BuiltinTable.empty() : builtins;
		Map<String, FunctionDefAst> functions = new LinkedHashMap<String, FunctionDefAst>();
		for (FunctionDefAst function : program.getFunctions()) {
			if (this.builtins.contains(function.getName())) {
				LOG.warn(
						"Function {} defined at line {} shadows the builtin of the same name",
						function.getName(),
						function.getLineNo());
			}
			functions.put(function.getName(), function);
		}
		this.userFunctions = Collections.unmodifiableMap(functions);
		LOG.debug("Function table: {} user function(s), {} builtin(s)", userFunctions.size(), this.builtins.size());
	}

	/**
	 * @param name function name
	 * @return the user definition of that name, or {@code null}
	 */
	public FunctionDefAst getUserFunction(String name) {
		return userFunctions.get(name);
	}

	/**
	 * @param name function name
	 * @return the builtin of that name, or {@code null} when there is none or
	 *         a user function shadows it
	 */
	public Builtin getBuiltin(String name) {
		if (userFunctions.containsKey(name)) {
			return null;
		}
		return builtins.get(name);
	}

	public boolean isDefined(String name) {
		return userFunctions.containsKey(name) || builtins.contains(name);
	}

	public Map<String, FunctionDefAst> getUserFunctions() {
		return userFunctions;
	}
}
