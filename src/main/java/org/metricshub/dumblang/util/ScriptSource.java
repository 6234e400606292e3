package org.metricshub.dumblang.util;

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
import java.io.Reader;
import java.io.StringReader;

/**
 * Text of a DumbLang program together with the description used for it in
 * syntax errors: a file name, or {@value #DESCRIPTION_INLINE_SCRIPT} for a
 * program handed over by the host.
 */
public class ScriptSource {

	public static final String DESCRIPTION_INLINE_SCRIPT = "<inline-script>";

	private final String description;
	private final Reader reader;

	/**
	 * @param description name of the source in syntax errors
	 * @param reader the program text
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * @param program program text given by the host
	 * @return a source described as {@value #DESCRIPTION_INLINE_SCRIPT}
	 */
	public static ScriptSource inline(String program) {
		return inline(new StringReader(program));
	}

	/**
	 * @param program reader over a program given by the host
	 * @return a source described as {@value #DESCRIPTION_INLINE_SCRIPT}
	 */
	public static ScriptSource inline(Reader program) {
		return new ScriptSource(DESCRIPTION_INLINE_SCRIPT, program);
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * @return reader over the program text, consumed once by the parser
	 * @throws IOException if the program cannot be opened
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	@Override
	public String toString() {
		return getDescription();
	}
}
