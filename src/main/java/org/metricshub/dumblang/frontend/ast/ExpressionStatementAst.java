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
 * An expression evaluated for its effect, terminated by {@code ;}.
 */
public final class ExpressionStatementAst extends StatementAst {

	private final ExpressionAst expression;

	public ExpressionStatementAst(int lineNo, ExpressionAst expression) {
		super(lineNo);
		this.expression = expression;
	}

	public ExpressionAst getExpression() {
		return expression;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitExpressionStatement(this);
	}

	@Override
	protected List<? extends AstNode> children() {
		return Collections.singletonList(expression);
	}
}
