package org.metricshub.dumblang;

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

import java.io.IOException;
import java.util.Collections;
import org.metricshub.dumblang.backend.Evaluator;
import org.metricshub.dumblang.frontend.DslParser;
import org.metricshub.dumblang.frontend.ast.BlockAst;
import org.metricshub.dumblang.frontend.ast.ExpressionAst;
import org.metricshub.dumblang.frontend.ast.FunctionDefAst;
import org.metricshub.dumblang.frontend.ast.ProgramAst;
import org.metricshub.dumblang.frontend.ast.ReturnStatementAst;
import org.metricshub.dumblang.frontend.ast.StatementAst;
import org.metricshub.dumblang.util.DslSettings;
import org.metricshub.dumblang.util.ScriptSource;

/**
 * Utility class to evaluate standalone DumbLang expressions.
 * <p>
 * The expression runs as the body of a {@code main(env)} function, so it may
 * refer to the entry value as {@code env} and call the core builtins.
 */
public final class ExpressionEvaluator {

	private ExpressionEvaluator() {}

	public static Object eval(String expression) throws IOException {
		return eval(expression, DslSettings.DEFAULT_ENTRY_VALUE, new DslSettings());
	}

	public static Object eval(String expression, Object env, DslSettings settings) throws IOException {
		ExpressionAst ast = new DslParser()
				.parseExpression(ScriptSource.inline(expression));
		return eval(ast, env, settings);
	}

	public static Object eval(ExpressionAst expression, Object env, DslSettings settings) {
		int line = expression.getLineNo();
		BlockAst body = new BlockAst(
				line,
				Collections.<StatementAst>singletonList(new ReturnStatementAst(line, expression)));
		ProgramAst program = new ProgramAst(
				line,
				Collections.singletonList(new FunctionDefAst(line, ProgramAst.MAIN, Evaluator.DEFAULT_ENTRY_NAME, body)));
		DumbLang dumbLang = new DumbLang(settings);
		return dumbLang.execute(program, env, null);
	}
}
