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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.dumblang.ext.Builtin;
import org.metricshub.dumblang.ext.BuiltinTable;
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
import org.metricshub.dumblang.jrt.DslRuntimeException;
import org.metricshub.dumblang.jrt.IllegalDslArgumentException;
import org.metricshub.dumblang.jrt.UndefinedNameException;
import org.metricshub.dumblang.jrt.Values;
import org.metricshub.dumblang.util.DslLogger;
import org.metricshub.dumblang.util.DslSettings;
import org.slf4j.Logger;

/**
 * Tree-walking interpreter of DumbLang programs.
 * <p>
 * Each function owns a {@link VariableStore}. With {@link StoreMode#SHARED}
 * (the default) there is a single store per function name, which every
 * activation of that function reads and writes; with
 * {@link StoreMode#PER_ACTIVATION} each call gets a fresh one.
 * <p>
 * A {@code return} does not unwind through exceptions: every statement
 * yields a {@link Completion} which blocks, loops and branches hand back to
 * the enclosing call as soon as it is a return.
 * <p>
 * An Evaluator runs one program at a time and is not thread-safe. Run
 * concurrent programs with separate instances.
 */
public class Evaluator implements DslInterpreter, ExpressionVisitor<Object>, StatementVisitor<Completion> {

	private static final Logger LOG = DslLogger.getLogger(Evaluator.class);

	/** Name the entry value is bound to when {@code main} declares no parameter. */
	public static final String DEFAULT_ENTRY_NAME = "env";

	private final ProgramAst program;
	private final FunctionTable functionTable;
	private final StoreMode storeMode;
	private final int maxCallDepth;

	private final Map<String, VariableStore> stores = new LinkedHashMap<String, VariableStore>();
	private VariableStore currentStore;
	private int callDepth;

	/**
	 * <p>
	 * Constructor for Evaluator.
	 * </p>
	 *
	 * @param program the parsed program
	 * @param builtins host functions the program may call
	 * @param settings store mode and call depth limit
	 */
	public Evaluator(ProgramAst program, BuiltinTable builtins, DslSettings settings) {
		this.program = program;
		this.functionTable = new FunctionTable(program, builtins);
		this.storeMode = settings.getStoreMode();
		this.maxCallDepth = settings.getMaxCallDepth();
	}

	/** {@inheritDoc} */
	@Override
	public Object execute(Object entryValue) {
		FunctionDefAst main = functionTable.getUserFunction(ProgramAst.MAIN);
		if (main == null) {
			throw new UndefinedNameException(program.getLineNo(), ProgramAst.MAIN, "No 'main' function defined");
		}
		stores.clear();
		callDepth = 0;

		VariableStore mainStore = storeFor(main);
		String entryName = main.hasParam() ? main.getParam() : DEFAULT_ENTRY_NAME;
		mainStore.write(entryName, Values.normalize(entryValue));
		LOG.debug("Executing main with {} = {}", entryName, Values.toRepr(mainStore.read(entryName, main.getLineNo())));

		Object result = activate(main, mainStore);
		LOG.debug("main returned {}", Values.toRepr(result));
		return result;
	}

	/**
	 * Variable stores of the last run, keyed by function name. In
	 * {@link StoreMode#PER_ACTIVATION} mode, each function maps to the store of
	 * its latest activation.
	 *
	 * @return read-only view of the stores
	 */
	public Map<String, VariableStore> getStores() {
		return Collections.unmodifiableMap(stores);
	}

	/**
	 * Prints every variable store of the last run, one function per line.
	 *
	 * @param ps where to print
	 */
	public void dumpStores(PrintStream ps) {
		for (VariableStore store : stores.values()) {
			ps.println(store.getOwner() + ": " + store);
		}
	}

	private VariableStore storeFor(FunctionDefAst function) {
		if (storeMode == StoreMode.PER_ACTIVATION) {
			VariableStore fresh = new VariableStore(function.getName());
			stores.put(function.getName(), fresh);
			return fresh;
		}
		VariableStore store = stores.get(function.getName());
		if (store == null) {
			store = new VariableStore(function.getName());
			stores.put(function.getName(), store);
		}
		return store;
	}

	private Object activate(FunctionDefAst function, VariableStore store) {
		if (callDepth >= maxCallDepth) {
			throw new DslRuntimeException(
					function.getLineNo(),
					"Maximum call depth of " + maxCallDepth + " exceeded calling " + function.getName());
		}
		VariableStore callerStore = currentStore;
		currentStore = store;
		callDepth++;
		try {
			return runBlock(function.getBody()).getValue();
		} finally {
			callDepth--;
			currentStore = callerStore;
		}
	}

	private Completion runBlock(BlockAst block) {
		for (StatementAst statement : block.getStatements()) {
			Completion completion = statement.accept(this);
			if (completion.isReturn()) {
				return completion;
			}
		}
		return Completion.NORMAL;
	}

	private Object eval(ExpressionAst expression) {
		return expression.accept(this);
	}

	// statements

	@Override
	public Completion visitWhile(WhileStatementAst ast) {
		while (Values.toBoolean(eval(ast.getCondition()))) {
			Completion completion = runBlock(ast.getBody());
			if (completion.isReturn()) {
				return completion;
			}
		}
		return Completion.NORMAL;
	}

	@Override
	public Completion visitIf(IfStatementAst ast) {
		if (Values.toBoolean(eval(ast.getCondition()))) {
			return runBlock(ast.getThenBlock());
		}
		return runBlock(ast.getElseBlock());
	}

	@Override
	public Completion visitReturn(ReturnStatementAst ast) {
		if (ast.getValue() == null) {
			return Completion.returned(null);
		}
		return Completion.returned(eval(ast.getValue()));
	}

	@Override
	public Completion visitExpressionStatement(ExpressionStatementAst ast) {
		eval(ast.getExpression());
		return Completion.NORMAL;
	}

	// expressions

	@Override
	public Object visitId(IdAst ast) {
		return currentStore.read(ast.getName(), ast.getLineNo());
	}

	@Override
	public Object visitNumber(NumberAst ast) {
		return Double.valueOf(ast.getValue());
	}

	@Override
	public Object visitString(StringAst ast) {
		return ast.getValue();
	}

	@Override
	public Object visitArrayLiteral(ArrayLiteralAst ast) {
		List<Object> array = new ArrayList<Object>(ast.getElements().size());
		for (ExpressionAst element : ast.getElements()) {
			array.add(eval(element));
		}
		return array;
	}

	@Override
	public Object visitBinaryExpression(BinaryExpressionAst ast) {
		if (ast.isAssignment()) {
			return assign(ast);
		}
		int line = ast.getLineNo();
		Object left = eval(ast.getLeft());
		Object right = eval(ast.getRight());
		switch (ast.getOperator()) {
		case ADD:
			return Values.add(left, right, line);
		case SUBTRACT:
			return Values.subtract(left, right, line);
		case MULTIPLY:
			return Values.multiply(left, right, line);
		case DIVIDE:
			return Values.floorDivide(left, right, line);
		case POWER:
			return Values.power(left, right, line);
		case LESS_THAN:
			return Values.lessThan(left, right, line);
		case GREATER_THAN:
			return Values.greaterThan(left, right, line);
		case EQUALS:
			return Boolean.valueOf(Values.isEqual(left, right));
		default:
			throw new IllegalStateException("Unexpected operator: " + ast.getOperator());
		}
	}

	private Object assign(BinaryExpressionAst ast) {
		ExpressionAst target = ast.getLeft();
		if (target instanceof IdAst) {
			Object value = eval(ast.getRight());
			currentStore.write(((IdAst) target).getName(), value);
			return value;
		}
		if (target instanceof ArrayReferenceAst) {
			ArrayReferenceAst reference = (ArrayReferenceAst) target;
			Object container = eval(reference.getArray());
			Object index = eval(reference.getIndex());
			Object value = eval(ast.getRight());
			if (!(container instanceof List)) {
				throw new IllegalDslArgumentException(
						reference.getLineNo(),
						"Cannot assign an element of a " + Values.typeName(container) + ", only arrays are mutable");
			}
			@SuppressWarnings("unchecked")
			List<Object> array = (List<Object>) container;
			array.set(Values.toIndex(index, array.size(), reference.getLineNo()), value);
			return value;
		}
		throw new DslRuntimeException(
				ast.getLineNo(),
				"Cannot assign to " + target.getClass().getSimpleName() + ", only to a variable or an array element");
	}

	@Override
	public Object visitArrayReference(ArrayReferenceAst ast) {
		Object container = eval(ast.getArray());
		Object index = eval(ast.getIndex());
		int line = ast.getLineNo();
		if (container instanceof List) {
			List<?> array = (List<?>) container;
			return Values.normalize(array.get(Values.toIndex(index, array.size(), line)));
		}
		if (container instanceof String) {
			String text = (String) container;
			int position = Values.toIndex(index, text.length(), line);
			return text.substring(position, position + 1);
		}
		throw new IllegalDslArgumentException(line, "Cannot index a " + Values.typeName(container));
	}

	@Override
	public Object visitFunctionCall(FunctionCallAst ast) {
		String name = ast.getName();
		FunctionDefAst function = functionTable.getUserFunction(name);
		if (function != null) {
			return callUserFunction(function, ast);
		}
		Builtin builtin = functionTable.getBuiltin(name);
		if (builtin == null) {
			throw new UndefinedNameException(ast.getLineNo(), name, "Function " + name + " is not defined");
		}
		Object[] arguments = ast.hasArgument() ? new Object[] { eval(ast.getArgument()) } : new Object[0];
		LOG.trace("Calling builtin {} at line {}", name, ast.getLineNo());
		try {
			return Values.normalize(builtin.call(arguments));
		} catch (IllegalDslArgumentException e) {
			if (e.getLineNumber() >= 0) {
				throw e;
			}
			throw new IllegalDslArgumentException(ast.getLineNo(), e);
		}
	}

	private Object callUserFunction(FunctionDefAst function, FunctionCallAst call) {
		if (function.hasParam() != call.hasArgument()) {
			throw new IllegalDslArgumentException(
					call.getLineNo(),
					"Function " + function.getName() + " expects " + (function.hasParam() ? 1 : 0)
							+ " argument(s), not " + (call.hasArgument() ? 1 : 0));
		}
		Object argument = call.hasArgument() ? eval(call.getArgument()) : null;
		LOG.trace("Calling {} at line {}", function.getName(), call.getLineNo());
		VariableStore store = storeFor(function);
		if (function.hasParam()) {
			store.write(function.getParam(), argument);
		}
		return activate(function, store);
	}
}
