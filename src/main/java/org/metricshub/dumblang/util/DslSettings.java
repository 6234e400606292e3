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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.io.PrintStream;
import org.metricshub.dumblang.backend.StoreMode;

/**
 * A simple container for the parameters of a single DumbLang run.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking DumbLang programmatically, from within Java code.
 */
public class DslSettings {

	/** Default entry value handed to {@code main}. */
	public static final Double DEFAULT_ENTRY_VALUE = Double.valueOf(0);

	/** Default prefix written in front of every {@code print} output. */
	public static final String DEFAULT_PRINT_PREFIX = "DSL> ";

	/** Default upper bound for nested user function calls. */
	public static final int DEFAULT_MAX_CALL_DEPTH = 1000;

	/**
	 * Where input is read from ({@code inpstr()} and {@code inpnum()}).
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Value bound into the store of {@code main} before it runs.
	 */
	private Object entryValue = DEFAULT_ENTRY_VALUE;

	/**
	 * Whether user functions share one store per name (the default) or
	 * get a fresh store per call.
	 */
	private StoreMode storeMode = StoreMode.SHARED;

	/**
	 * Written in front of each value printed by {@code print}.
	 */
	private String printPrefix = DEFAULT_PRINT_PREFIX;

	/**
	 * Whether {@code inpstr()} and {@code inpnum()} write a prompt before
	 * blocking on input; <code>true</code> by default.
	 */
	private boolean promptForInput = true;

	/**
	 * Maximum number of nested user function activations before the run is
	 * aborted.
	 */
	private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("entryValue = ").append(getEntryValue()).append(newLine);
		desc.append("storeMode = ").append(getStoreMode()).append(newLine);
		desc.append("printPrefix = '").append(getPrintPrefix()).append('\'').append(newLine);
		desc.append("promptForInput = ").append(isPromptForInput()).append(newLine);
		desc.append("maxCallDepth = ").append(getMaxCallDepth()).append(newLine);

		return desc.toString();
	}

	/**
	 * Where input is read from.
	 * By default, this is {@link java.lang.System#in}.
	 *
	 * @return the input
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public InputStream getInput() {
		return input;
	}

	/**
	 * Where input is read from.
	 *
	 * @param input the input to set
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setInput(InputStream input) {
		this.input = input;
	}

	/**
	 * Output stream; <code>System.out</code> by default.
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Output stream; <code>System.out</code> by default.
	 *
	 * @param outputStream the output stream to set
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	public Object getEntryValue() {
		return entryValue;
	}

	public void setEntryValue(Object entryValue) {
		this.entryValue = entryValue;
	}

	public StoreMode getStoreMode() {
		return storeMode;
	}

	public void setStoreMode(StoreMode storeMode) {
		if (storeMode == null) {
			throw new IllegalArgumentException("Store mode must not be null");
		}
		this.storeMode = storeMode;
	}

	public String getPrintPrefix() {
		return printPrefix;
	}

	public void setPrintPrefix(String printPrefix) {
		this.printPrefix = printPrefix == null ? "" : printPrefix;
	}

	public boolean isPromptForInput() {
		return promptForInput;
	}

	public void setPromptForInput(boolean promptForInput) {
		this.promptForInput = promptForInput;
	}

	public int getMaxCallDepth() {
		return maxCallDepth;
	}

	/**
	 * @param maxCallDepth maximum number of nested user function calls, at least 1
	 */
	public void setMaxCallDepth(int maxCallDepth) {
		if (maxCallDepth < 1) {
			throw new IllegalArgumentException("Maximum call depth must be at least 1, not " + maxCallDepth);
		}
		this.maxCallDepth = maxCallDepth;
	}
}
