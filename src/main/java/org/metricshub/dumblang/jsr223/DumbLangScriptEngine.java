package org.metricshub.dumblang.jsr223;

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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.dumblang.DumbLang;
import org.metricshub.dumblang.ext.Builtin;
import org.metricshub.dumblang.frontend.ast.ParserException;
import org.metricshub.dumblang.frontend.ast.ProgramAst;
import org.metricshub.dumblang.util.DslSettings;
import org.metricshub.dumblang.util.ScriptSource;

/**
 * Simple JSR-223 script engine for DumbLang.
 * <p>
 * The {@code env} attribute is handed to {@code main}, the {@code input}
 * attribute (an {@link InputStream} or a {@link String}) is what
 * {@code inpstr} and {@code inpnum} read, and every attribute holding a
 * {@link Builtin} is callable from the program under its attribute name.
 * What the program prints goes to the writer of the context, and
 * {@code eval} returns the value returned by {@code main}.
 */
public class DumbLangScriptEngine extends AbstractScriptEngine {

	/** Attribute holding the entry value. */
	public static final String ENTRY_ATTRIBUTE = "env";

	/** Attribute holding the program input. */
	public static final String INPUT_ATTRIBUTE = "input";

	private final ScriptEngineFactory factory;

	public DumbLangScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		DslSettings settings = new DslSettings();
		Object inObj = context.getAttribute(INPUT_ATTRIBUTE);
		if (inObj instanceof InputStream) {
			settings.setInput((InputStream) inObj);
		} else if (inObj instanceof String) {
			settings.setInput(new ByteArrayInputStream(((String) inObj).getBytes(StandardCharsets.UTF_8)));
		}
		settings.setPromptForInput(false);
		ByteArrayOutputStream result = new ByteArrayOutputStream();
		settings.setOutputStream(new PrintStream(result, true, StandardCharsets.UTF_8));

		Object entryValue = context.getAttribute(ENTRY_ATTRIBUTE);
		if (entryValue == null) {
			entryValue = DslSettings.DEFAULT_ENTRY_VALUE;
		}
		try {
			DumbLang dumbLang = new DumbLang(settings);
			ProgramAst program = dumbLang.compile(ScriptSource.inline(scriptReader));
			Object value;
			try {
				value = dumbLang.execute(program, entryValue, collectBuiltins(context));
			} finally {
				Writer writer = context.getWriter();
				if (writer != null) {
					writer.write(result.toString(StandardCharsets.UTF_8));
					writer.flush();
				}
			}
			return value;
		} catch (ParserException e) {
			ScriptException se = new ScriptException(e.getMessage(), e.getSourceDescription(), e.getLineNumber());
			se.initCause(e);
			throw se;
		} catch (Exception e) {
			throw new ScriptException(e);
		}
	}

	/**
	 * Builtins found in the global scope, then the engine scope, so that the
	 * engine scope wins.
	 */
	private static Map<String, Builtin> collectBuiltins(ScriptContext context) {
		Map<String, Builtin> builtins = new LinkedHashMap<String, Builtin>();
		addBuiltins(context.getBindings(ScriptContext.GLOBAL_SCOPE), builtins);
		addBuiltins(context.getBindings(ScriptContext.ENGINE_SCOPE), builtins);
		return builtins;
	}

	private static void addBuiltins(Bindings bindings, Map<String, Builtin> builtins) {
		if (bindings == null) {
			return;
		}
		for (Map.Entry<String, Object> entry : bindings.entrySet()) {
			if (entry.getValue() instanceof Builtin) {
				builtins.put(entry.getKey(), (Builtin) entry.getValue());
			}
		}
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}
}
