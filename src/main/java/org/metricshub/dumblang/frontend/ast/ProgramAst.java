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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of a parsed program: the function definitions in source order.
 */
public final class ProgramAst extends AstNode {

	/** Name of the function a program starts with. */
	public static final String MAIN = "main";

	private final List<FunctionDefAst> functions;

	public ProgramAst(int lineNo, List<FunctionDefAst> functions) {
		super(lineNo);
		this.functions = Collections.unmodifiableList(new ArrayList<FunctionDefAst>(functions));
	}

	public List<FunctionDefAst> getFunctions() {
		return functions;
	}

	/**
	 * @param name function name
	 * @return the definition of that function, or {@code null}
	 */
	public FunctionDefAst getFunction(String name) {
		for (FunctionDefAst function : functions) {
			if (function.getName().equals(name)) {
				return function;
			}
		}
		return null;
	}

	@Override
	protected List<? extends AstNode> children() {
		return functions;
	}
}
