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

import java.util.Arrays;
import java.util.List;

/**
 * {@code while (condition) { body }}.
 */
public final class WhileStatementAst extends StatementAst {

	private final ExpressionAst condition;
	private final BlockAst body;

	public WhileStatementAst(int lineNo, ExpressionAst condition, BlockAst body) {
		super(lineNo);
		this.condition = condition;
		this.body = body;
	}

	public ExpressionAst getCondition() {
		return condition;
	}

	public BlockAst getBody() {
		return body;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitWhile(this);
	}

	@Override
	protected List<? extends AstNode> children() {
		return Arrays.asList(condition, body);
	}
}
