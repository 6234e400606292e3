package org.metricshub.dumblang.ext;

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

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.metricshub.dumblang.ext.annotations.DslFunction;
import org.metricshub.dumblang.jrt.IllegalDslArgumentException;
import org.metricshub.dumblang.jrt.Values;
import org.metricshub.dumblang.util.DslSettings;

/**
 * The builtins every DumbLang program can call:
 * <ul>
 * <li><strong>print(value)</strong> - writes the print prefix and the value on a line
 * <li><strong>inpstr()</strong> - reads a line of input
 * <li><strong>inpnum()</strong> - reads a line of input as a number
 * <li><strong>sqrt(value)</strong> - square root of a number
 * </ul>
 * Input is read from and output written to the streams of the
 * {@link DslSettings} the extension was initialized with.
 */
public class CoreExtension extends AbstractExtension {

	/** Prompt written before reading a string. */
	public static final String STRING_PROMPT = "DSL<(str)";

	/** Prompt written before reading a number. */
	public static final String NUMBER_PROMPT = "DSL<(num)";

	private BufferedReader inputReader;

	@Override
	public String getExtensionName() {
		return "Core Extension";
	}

	@Override
	public void init(DslSettings settings) {
		super.init(settings);
		this.inputReader = null;
	}

	@DslFunction(value = "print", argumentOptional = true)
	public Object print(Object value) {
		PrintStream out = getSettings().getOutputStream();
		out.println(getSettings().getPrintPrefix() + Values.toDisplayString(value));
		out.flush();
		return null;
	}

	/**
	 * Reads a line of input.
	 *
	 * @return the line, without its terminator
	 * @throws UncheckedIOException when the input is exhausted or cannot be read
	 */
	@DslFunction("inpstr")
	public String inpstr() {
		prompt(STRING_PROMPT);
		return readLine();
	}

	/**
	 * Reads a line of input and converts it to a number.
	 *
	 * @return the number read
	 * @throws NumberFormatException when the line is not a number
	 */
	@DslFunction("inpnum")
	public Double inpnum() {
		prompt(NUMBER_PROMPT);
		return Double.valueOf(Double.parseDouble(readLine().trim()));
	}

	@DslFunction("sqrt")
	public Double sqrt(Object value) {
		double d = Values.toDouble(value, -1, "Argument of sqrt");
		if (d < 0) {
			throw new IllegalDslArgumentException("math domain error: sqrt(" + Values.toDisplayString(value) + ")");
		}
		return Double.valueOf(Math.sqrt(d));
	}

	private void prompt(String prompt) {
		if (getSettings().isPromptForInput()) {
			PrintStream out = getSettings().getOutputStream();
			out.println(prompt);
			out.flush();
		}
	}

	private synchronized String readLine() {
		if (inputReader == null) {
			inputReader = new BufferedReader(new InputStreamReader(getSettings().getInput(), StandardCharsets.UTF_8));
		}
		try {
			String line = inputReader.readLine();
			if (line == null) {
				throw new EOFException("End of input reached while reading a line");
			}
			return line;
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
