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

import java.util.Arrays;
import java.util.List;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;

/** ScriptEngineFactory for DumbLang. */
public class DumbLangScriptEngineFactory implements ScriptEngineFactory {

	@Override
	public String getEngineName() {
		return "DumbLang";
	}

	@Override
	public String getEngineVersion() {
		return "1.0.0-SNAPSHOT";
	}

	@Override
	public List<String> getExtensions() {
		return Arrays.asList("dl");
	}

	@Override
	public List<String> getMimeTypes() {
		return Arrays.asList("application/x-dumblang");
	}

	@Override
	public List<String> getNames() {
		return Arrays.asList("dumblang", "DumbLang");
	}

	@Override
	public String getLanguageName() {
		return "dumblang";
	}

	@Override
	public String getLanguageVersion() {
		return "1";
	}

	@Override
	public Object getParameter(String key) {
		if (ScriptEngine.NAME.equals(key) || ScriptEngine.ENGINE.equals(key)) {
			return getEngineName();
		}
		if (ScriptEngine.ENGINE_VERSION.equals(key)) {
			return getEngineVersion();
		}
		if (ScriptEngine.LANGUAGE.equals(key)) {
			return getLanguageName();
		}
		if (ScriptEngine.LANGUAGE_VERSION.equals(key)) {
			return getLanguageVersion();
		}
		return null;
	}

	/**
	 * DumbLang has no methods: the object becomes the argument of a function
	 * call, and further arguments are not supported.
	 */
	@Override
	public String getMethodCallSyntax(String obj, String m, String... args) {
		if (args.length > 0) {
			throw new IllegalArgumentException("DumbLang functions take at most one argument");
		}
		return m + "(" + obj + ")";
	}

	/**
	 * String literals have no escapes, so the text must not contain a double
	 * quote.
	 */
	@Override
	public String getOutputStatement(String toDisplay) {
		if (toDisplay.indexOf('"') >= 0 || toDisplay.indexOf('\n') >= 0) {
			throw new IllegalArgumentException("Cannot quote text containing a double quote or a newline");
		}
		return "print(\"" + toDisplay + "\");";
	}

	@Override
	public String getProgram(String... statements) {
		StringBuilder sb = new StringBuilder();
		sb.append("main() {\n");
		for (String s : statements) {
			sb.append('\t').append(s).append('\n');
		}
		sb.append("}\n");
		return sb.toString();
	}

	@Override
	public ScriptEngine getScriptEngine() {
		return new DumbLangScriptEngine(this);
	}
}
