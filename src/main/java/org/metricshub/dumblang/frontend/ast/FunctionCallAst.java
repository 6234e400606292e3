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
 * A call of a builtin or user function with at most one argument.
 */
public final class FunctionCallAst extends ExpressionAst {

	private final String name;
	private final ExpressionAst argument;

	/**
	 * @param lineNo line of the function name
	 * @param name called function
	 * @param argument the argument, {@code null} for a call without one
	 */
	public FunctionCallAst(int lineNo, String name, ExpressionAst argument) {
		super(lineNo);
		this.name = name;
		this.argument = argument;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the argument expression, or {@code null}
	 */
	public ExpressionAst getArgument() {
		return argument;
	}

	public boolean hasArgument() {
		return argument != null;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitFunctionCall(this);
	}

	@Override
	protected List<? extends AstNode> children() {
		return argument == null ? Collections.<AstNode>emptyList() : Collections.singletonList(argument);
	}

	@Override
	public String toString() {
		return "FunctionCallAst " + name + " (line " + getLineNo() + ")";
	}
}
