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
import org.metricshub.dumblang.jrt.UndefinedNameException;
import org.metricshub.dumblang.jrt.Values;

/**
 * The variables of a function: a mapping of names to runtime values. Blocks
 * do not introduce scopes, so a store holds every variable its function ever
 * wrote.
 */
public class VariableStore {

	private final String owner;
	private final Map<String, Object> variables = new LinkedHashMap<String, Object>();

	/**
	 * @param owner name of the function owning this store
	 */
	public VariableStore(String owner) {
		this.owner = owner;
	}

	public String getOwner() {
		return owner;
	}

	/**
	 * @param name variable name
	 * @param line line of the reference, for the diagnostic
	 * @return the value last written under {@code name}
	 * @throws UndefinedNameException when nothing was written under that name
	 */
	public Object read(String name, int line) {
		if (!variables.containsKey(name)) {
			throw new UndefinedNameException(line, name, "Variable " + name + " is not defined in " + owner);
		}
		return variables.get(name);
	}

	public void write(String name, Object value) {
		variables.put(name, value);
	}

	public boolean isDefined(String name) {
		return variables.containsKey(name);
	}

	/**
	 * @return read-only view of the variables, in order of first write
	 */
	public Map<String, Object> getVariables() {
		return Collections.unmodifiableMap(variables);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		boolean first = true;
		for (Map.Entry<String, Object> entry : variables.entrySet()) {
			if (!first) {
				sb.append(", ");
			}
			first = false;
			sb.append(Values.quote(entry.getKey())).append(": ").append(Values.toRepr(entry.getValue()));
		}
		return sb.append('}').toString();
	}
}
