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
 * {@code left op right}, covering arithmetic, comparison and assignment.
 */
public final class BinaryExpressionAst extends ExpressionAst {

	private final ExpressionAst left;
	private final BinaryOperator operator;
	private final ExpressionAst right;

	public BinaryExpressionAst(int lineNo, ExpressionAst left, BinaryOperator operator, ExpressionAst right) {
		super(lineNo);
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public ExpressionAst getLeft() {
		return left;
	}

	public BinaryOperator getOperator() {
		return operator;
	}

	public ExpressionAst getRight() {
		return right;
	}

	public boolean isAssignment() {
		return operator == BinaryOperator.ASSIGN;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitBinaryExpression(this);
	}

	@Override
	protected List<? extends AstNode> children() {
		return Arrays.asList(left, right);
	}

	@Override
	public String toString() {
		return "BinaryExpressionAst " + operator.getSymbol() + " (line " + getLineNo() + ")";
	}
}
