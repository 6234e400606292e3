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

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

/**
 * Base class of all nodes of a DumbLang abstract syntax tree. Nodes are
 * immutable once built by the parser and remember the line they were parsed
 * from.
 */
public abstract class AstNode {

	private final int lineNo;

	protected AstNode(int lineNo) {
		this.lineNo = lineNo;
	}

	/**
	 * @return the 1-based source line of this node
	 */
	public final int getLineNo() {
		return lineNo;
	}

	/**
	 * @return the direct children of this node, in source order
	 */
	protected List<? extends AstNode> children() {
		return Collections.emptyList();
	}

	/**
	 * Dump a meaningful text representation of this
	 * abstract syntax tree node to the output (print)
	 * stream, one node per line, children indented one
	 * space deeper than their parent.
	 *
	 * @param ps The print stream to dump the text
	 *        representation.
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append(' ');
		}
		ps.println(spaces + toString());
		for (AstNode child : children()) {
			if (child != null) {
				child.dump(ps, lvl + 1);
			}
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + " (line " + lineNo + ")";
	}
}
