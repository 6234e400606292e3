package org.metricshub.dumblang.backend;

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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.dumblang.ext.CoreExtension;
import org.metricshub.dumblang.frontend.ast.ArrayLiteralAst;
import org.metricshub.dumblang.frontend.ast.ArrayReferenceAst;
import org.metricshub.dumblang.frontend.ast.BinaryExpressionAst;
import org.metricshub.dumblang.frontend.ast.BlockAst;
import org.metricshub.dumblang.frontend.ast.ExpressionAst;
import org.metricshub.dumblang.frontend.ast.ExpressionStatementAst;
import org.metricshub.dumblang.frontend.ast.ExpressionVisitor;
import org.metricshub.dumblang.frontend.ast.FunctionCallAst;
import org.metricshub.dumblang.frontend.ast.FunctionDefAst;
import org.metricshub.dumblang.frontend.ast.IdAst;
import org.metricshub.dumblang.frontend.ast.IfStatementAst;
import org.metricshub.dumblang.frontend.ast.NumberAst;
import org.metricshub.dumblang.frontend.ast.ProgramAst;
import org.metricshub.dumblang.frontend.ast.ReturnStatementAst;
import org.metricshub.dumblang.frontend.ast.StatementAst;
import org.metricshub.dumblang.frontend.ast.StatementVisitor;
import org.metricshub.dumblang.frontend.ast.StringAst;
import org.metricshub.dumblang.frontend.ast.WhileStatementAst;
import org.metricshub.dumblang.jrt.Values;
import org.metricshub.dumblang.util.DslSettings;

/**
 * Renders a parsed program as an equivalent, runnable Python 3 module.
 * <p>
 * The module starts with a prelude defining the core builtins ({@code print},
 * {@code inpstr}, {@code inpnum}, {@code sqrt}) so that the rendered program
 * prints and prompts exactly like the evaluator does. It ends by calling
 * {@code main} with the configured entry value.
 * <p>
 * Rendering is purely syntax-directed: nothing is evaluated. The variables
 * of a function follow the configured {@link StoreMode}:
 * <ul>
 * <li>{@link StoreMode#SHARED}: a module-level dictionary per function,
 * {@code _vars_f['n']}, which every call of {@code f} reads and writes
 * <li>{@link StoreMode#PER_ACTIVATION}: plain Python locals
 * </ul>
 */
public class PythonRenderer implements ExpressionVisitor<String>, StatementVisitor<Void> {

	private static final String INDENT = "    ";

	private static final Set<String> PYTHON_KEYWORDS = Collections
			.unmodifiableSet(
					new HashSet<String>(
							Arrays
									.asList(
											"False",
											"None",
											"True",
											"and",
											"as",
											"assert",
											"async",
											"await",
											"break",
											"class",
											"continue",
											"def",
											"del",
											"elif",
											"else",
											"except",
											"finally",
											"for",
											"from",
											"global",
											"if",
											"import",
											"in",
											"is",
											"lambda",
											"nonlocal",
											"not",
											"or",
											"pass",
											"raise",
											"return",
											"try",
											"while",
											"with",
											"yield")));

	/** Names the prelude and the rendered expressions rely on. */
	private static final Set<String> PRELUDE_NAMES = Collections
			.unmodifiableSet(new HashSet<String>(Arrays.asList("builtins", "math", "int", "float", "input", "str")));

	/** Builtins defined by the prelude, which user functions may redefine. */
	private static final Set<String> PRELUDE_FUNCTIONS = Collections
			.unmodifiableSet(new HashSet<String>(Arrays.asList("print", "inpstr", "inpnum", "sqrt")));

	private static final String STORE_PREFIX = "_vars_";

	/** Parameter of a function rendered with a shared store. */
	private static final String ARGUMENT = "_arg";

	private final DslSettings settings;
	private final boolean sharedStores;

	private final List<String> lines = new ArrayList<String>();
	private final Set<String> functionNames = new HashSet<String>();
	private String currentFunction;
	private int indent;

	/**
	 * @param settings print prefix, prompt switch, store mode and entry value
	 *        used by the rendered module
	 */
	public PythonRenderer(DslSettings settings) {
		this.settings = settings;
		this.sharedStores = settings.getStoreMode() == StoreMode.SHARED;
	}

	/**
	 * Renders the program.
	 *
	 * @param program the parsed program
	 * @return the Python source, terminated by a newline
	 */
	public String render(ProgramAst program) {
		lines.clear();
		functionNames.clear();
		functionNames.addAll(PRELUDE_FUNCTIONS);
		for (FunctionDefAst function : program.getFunctions()) {
			functionNames.add(function.getName());
		}
		indent = 0;

		renderPrelude();
		for (FunctionDefAst function : program.getFunctions()) {
			emit("");
			emit("");
			renderFunction(function);
		}
		emit("");
		emit("");
		emit("if __name__ == \"__main__\":");
		emit(INDENT + functionName(ProgramAst.MAIN) + "(" + literal(Values.normalize(settings.getEntryValue())) + ")");

		StringBuilder sb = new StringBuilder();
		for (String line : lines) {
			sb.append(line).append('\n');
		}
		return sb.toString();
	}

	private void renderPrelude() {
		emit("import builtins");
		emit("import math");
		emit("");
		emit("");
		emit("def print(value=None):");
		emit(INDENT + "builtins.print(" + Values.quote(settings.getPrintPrefix()) + " + str(value))");
		emit("");
		emit("");
		emit("def inpstr():");
		if (settings.isPromptForInput()) {
			emit(INDENT + "builtins.print(" + Values.quote(CoreExtension.STRING_PROMPT) + ")");
		}
		emit(INDENT + "return input()");
		emit("");
		emit("");
		emit("def inpnum():");
		if (settings.isPromptForInput()) {
			emit(INDENT + "builtins.print(" + Values.quote(CoreExtension.NUMBER_PROMPT) + ")");
		}
		emit(INDENT + "return float(input())");
		emit("");
		emit("");
		emit("def sqrt(value):");
		emit(INDENT + "return math.sqrt(value)");
		emit("");
		emit("");
		emit("def _store(seq, index, value):");
		emit(INDENT + "seq[int(index)] = value");
		emit(INDENT + "return value");
		if (sharedStores) {
			emit("");
			emit("");
			emit("def _set(store, name, value):");
			emit(INDENT + "store[name] = value");
			emit(INDENT + "return value");
		}
		emit("");
		emit("");
		emit("def _assign_error(message):");
		emit(INDENT + "raise RuntimeError(message)");
	}

	private void renderFunction(FunctionDefAst function) {
		currentFunction = function.getName();
		String param = function.getParam();
		if (param == null && ProgramAst.MAIN.equals(function.getName())) {
			param = Evaluator.DEFAULT_ENTRY_NAME;
		}
		String header = "def " + functionName(function.getName()) + "(";
		if (!sharedStores) {
			emit(header + (param == null ? "" : variableName(param)) + "):");
			renderBlock(function.getBody());
			return;
		}
		emit(storeName(function.getName()) + " = {}");
		emit("");
		emit("");
		if (param == null) {
			emit(header + "):");
			renderBlock(function.getBody());
			return;
		}
		emit(header + ARGUMENT + "):");
		renderBlock(function.getBody(), variableReference(param) + " = " + ARGUMENT);
	}

	private void renderBlock(BlockAst block) {
		renderBlock(block, null);
	}

	private void renderBlock(BlockAst block, String firstLine) {
		indent++;
		if (firstLine != null) {
			emitIndented(firstLine);
		} else if (block.isEmpty()) {
			emitIndented("pass");
		}
		for (StatementAst statement : block.getStatements()) {
			statement.accept(this);
		}
		indent--;
	}

	private void emit(String line) {
		lines.add(line);
	}

	private void emitIndented(String line) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < indent; i++) {
			sb.append(INDENT);
		}
		lines.add(sb.append(line).toString());
	}

	// names

	private String functionName(String name) {
		if (PYTHON_KEYWORDS.contains(name) || PRELUDE_NAMES.contains(name)) {
			return name + "_";
		}
		return name;
	}

	/**
	 * Variables and functions live in separate namespaces in DumbLang, but
	 * not in Python: a variable named like a function is renamed.
	 */
	private String variableName(String name) {
		if (PYTHON_KEYWORDS.contains(name) || PRELUDE_NAMES.contains(name) || functionNames.contains(name)) {
			return name + "_";
		}
		return name;
	}

	private static String storeName(String function) {
		return STORE_PREFIX + function;
	}

	/**
	 * Python expression reading or writing a variable of the function being
	 * rendered.
	 */
	private String variableReference(String name) {
		if (sharedStores) {
			return storeName(currentFunction) + "[" + Values.quote(name) + "]";
		}
		return variableName(name);
	}

	// statements

	@Override
	public Void visitWhile(WhileStatementAst ast) {
		emitIndented("while " + ast.getCondition().accept(this) + ":");
		renderBlock(ast.getBody());
		return null;
	}

	@Override
	public Void visitIf(IfStatementAst ast) {
		emitIndented("if " + ast.getCondition().accept(this) + ":");
		renderBlock(ast.getThenBlock());
		emitIndented("else:");
		renderBlock(ast.getElseBlock());
		return null;
	}

	@Override
	public Void visitReturn(ReturnStatementAst ast) {
		if (ast.getValue() == null) {
			emitIndented("return");
		} else {
			emitIndented("return " + ast.getValue().accept(this));
		}
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatementAst ast) {
		ExpressionAst expression = ast.getExpression();
		if (!(expression instanceof BinaryExpressionAst) || !((BinaryExpressionAst) expression).isAssignment()) {
			emitIndented(expression.accept(this));
			return null;
		}
		// a = b = value, as a chained Python assignment
		StringBuilder targets = new StringBuilder();
		ExpressionAst value = expression;
		while (value instanceof BinaryExpressionAst && ((BinaryExpressionAst) value).isAssignment()) {
			BinaryExpressionAst assignment = (BinaryExpressionAst) value;
			String target = assignmentTarget(assignment.getLeft());
			if (target == null) {
				emitIndented(assignmentError(assignment));
				return null;
			}
			targets.append(target).append(" = ");
			value = assignment.getRight();
		}
		emitIndented(targets + value.accept(this));
		return null;
	}

	private String assignmentTarget(ExpressionAst target) {
		if (target instanceof IdAst) {
			return variableReference(((IdAst) target).getName());
		}
		if (target instanceof ArrayReferenceAst) {
			return visitArrayReference((ArrayReferenceAst) target);
		}
		return null;
	}

	private String assignmentError(BinaryExpressionAst assignment) {
		return "_assign_error("
				+ Values.quote("line " + assignment.getLineNo() + ": cannot assign to an expression")
				+ ")";
	}

	// expressions

	@Override
	public String visitId(IdAst ast) {
		return variableReference(ast.getName());
	}

	@Override
	public String visitNumber(NumberAst ast) {
		return literal(Double.valueOf(ast.getValue()));
	}

	@Override
	public String visitString(StringAst ast) {
		return Values.quote(ast.getValue());
	}

	@Override
	public String visitArrayLiteral(ArrayLiteralAst ast) {
		StringBuilder sb = new StringBuilder("[");
		for (int i = 0; i < ast.getElements().size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(ast.getElements().get(i).accept(this));
		}
		return sb.append(']').toString();
	}

	@Override
	public String visitBinaryExpression(BinaryExpressionAst ast) {
		if (ast.isAssignment()) {
			ExpressionAst target = ast.getLeft();
			String value = ast.getRight().accept(this);
			if (target instanceof IdAst) {
				String name = ((IdAst) target).getName();
				if (sharedStores) {
					return "_set(" + storeName(currentFunction) + ", " + Values.quote(name) + ", " + value + ")";
				}
				return "(" + variableName(name) + " := " + value + ")";
			}
			if (target instanceof ArrayReferenceAst) {
				ArrayReferenceAst reference = (ArrayReferenceAst) target;
				return "_store("
						+ reference.getArray().accept(this)
						+ ", "
						+ reference.getIndex().accept(this)
						+ ", "
						+ value
						+ ")";
			}
			return assignmentError(ast);
		}
		String operator;
		switch (ast.getOperator()) {
		case DIVIDE:
			operator = "//";
			break;
		case POWER:
			operator = "**";
			break;
		default:
			operator = ast.getOperator().getSymbol();
			break;
		}
		return "(" + ast.getLeft().accept(this) + " " + operator + " " + ast.getRight().accept(this) + ")";
	}

	@Override
	public String visitFunctionCall(FunctionCallAst ast) {
		String argument = ast.hasArgument() ? ast.getArgument().accept(this) : "";
		return functionName(ast.getName()) + "(" + argument + ")";
	}

	@Override
	public String visitArrayReference(ArrayReferenceAst ast) {
		String array = ast.getArray().accept(this);
		ExpressionAst index = ast.getIndex();
		if (index instanceof NumberAst) {
			double value = ((NumberAst) index).getValue();
			if (!Double.isInfinite(value) && !Double.isNaN(value)) {
				return array + "[" + (long) value + "]";
			}
		}
		return array + "[int(" + index.accept(this) + ")]";
	}

	/**
	 * Python literal for a runtime value.
	 */
	static String literal(Object value) {
		if (value instanceof Double) {
			double d = ((Double) value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				return "float(" + Values.quote(Values.formatNumber(d)) + ")";
			}
			return Values.formatNumber(d);
		}
		if (value instanceof List) {
			StringBuilder sb = new StringBuilder("[");
			boolean first = true;
			for (Object element : (List<?>) value) {
				if (!first) {
					sb.append(", ");
				}
				first = false;
				sb.append(literal(Values.normalize(element)));
			}
			return sb.append(']').toString();
		}
		if (value == null || value instanceof Boolean || value instanceof String) {
			return Values.toRepr(value);
		}
		return Values.quote(String.valueOf(value));
	}
}
