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
 * {@code array[index]}. Read when evaluated, written when it is the left side
 * of an assignment.
 */
public final class ArrayReferenceAst extends ExpressionAst {

	private final ExpressionAst array;
	private final ExpressionAst index;

	public ArrayReferenceAst(int lineNo, ExpressionAst array, ExpressionAst index) {
		super(lineNo);
		this.array = array;
		this.index = index;
	}

	public ExpressionAst getArray() {
		return array;
	}

	public ExpressionAst getIndex() {
		return index;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitArrayReference(this);
	}

	@Override
	protected List<? extends AstNode> children() {
		return Arrays.asList(array, index);
	}
}
