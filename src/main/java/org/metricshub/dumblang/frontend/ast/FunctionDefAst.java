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

import java.util.Collections;
import java.util.List;

/**
 * A function definition: a name, at most one parameter and a body.
 */
public final class FunctionDefAst extends AstNode {

	private final String name;
	private final String param;
	private final BlockAst body;

	/**
	 * @param lineNo line of the function name
	 * @param name function name
	 * @param param parameter name, {@code null} when the function takes none
	 * @param body function body
	 */
	public FunctionDefAst(int lineNo, String name, String param, BlockAst body) {
		super(lineNo);
		this.name = name;
		this.param = param;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the parameter name, or {@code null}
	 */
	public String getParam() {
		return param;
	}

	public boolean hasParam() {
		return param != null;
	}

	public BlockAst getBody() {
		return body;
	}

	@Override
	protected List<? extends AstNode> children() {
		return Collections.singletonList(body);
	}

	@Override
	public String toString() {
		return "FunctionDefAst " + name + "(" + (param == null ? "" : param) + ") (line " + getLineNo() + ")";
	}
}
