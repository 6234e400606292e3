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
 * {@code if (condition) { then } else { otherwise }}. The else block is
 * mandatory.
 */
public final class IfStatementAst extends StatementAst {

	private final ExpressionAst condition;
	private final BlockAst thenBlock;
	private final BlockAst elseBlock;

	public IfStatementAst(int lineNo, ExpressionAst condition, BlockAst thenBlock, BlockAst elseBlock) {
		super(lineNo);
		this.condition = condition;
		this.thenBlock = thenBlock;
		this.elseBlock = elseBlock;
	}

	public ExpressionAst getCondition() {
		return condition;
	}

	public BlockAst getThenBlock() {
		return thenBlock;
	}

	public BlockAst getElseBlock() {
		return elseBlock;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitIf(this);
	}

	@Override
	protected List<? extends AstNode> children() {
		return Arrays.asList(condition, thenBlock, elseBlock);
	}
}
