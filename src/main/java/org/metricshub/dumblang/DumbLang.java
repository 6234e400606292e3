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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.metricshub.dumblang.backend.Evaluator;
import org.metricshub.dumblang.backend.PythonRenderer;
import org.metricshub.dumblang.ext.Builtin;
import org.metricshub.dumblang.ext.BuiltinTable;
import org.metricshub.dumblang.ext.CoreExtension;
import org.metricshub.dumblang.ext.DslExtension;
import org.metricshub.dumblang.frontend.DslParser;
import org.metricshub.dumblang.frontend.ast.ProgramAst;
import org.metricshub.dumblang.util.DslLogger;
import org.metricshub.dumblang.util.DslSettings;
import org.metricshub.dumblang.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point for embedding DumbLang in a host application.
 * <p>
 * A DumbLang program is processed in two steps:
 * <ul>
 * <li>Parse the program text, producing an abstract syntax tree.
 * <li>Either evaluate the tree, running {@code main} with an entry value and
 * returning its result, <strong>or</strong> render the tree as an equivalent
 * Python program.
 * </ul>
 * The builtins {@code print}, {@code inpstr}, {@code inpnum} and {@code sqrt}
 * are always available. The host adds its own through extensions passed to
 * the constructors, or per call as a map of {@link Builtin}s. The builtin
 * table of an instance is built once, by the constructor, with the instance's
 * {@link DslSettings}.
 * <p>
 * An instance may run several programs one after the other, but not
 * concurrently.
 */
public class DumbLang {

	private static final Logger LOG = DslLogger.getLogger(DumbLang.class);

	private final DslSettings settings;

	private final BuiltinTable builtins;

	private final List<DslExtension> extensions;

	/**
	 * The last parsed program.
	 */
	private ProgramAst lastAst;

	/**
	 * The evaluator of the last run.
	 */
	private Evaluator lastEvaluator;

	/**
	 * Create a new instance of DumbLang with default settings and the core
	 * builtins only
	 */
	public DumbLang() {
		this(new DslSettings());
	}

	/**
	 * Create a new instance of DumbLang with the specified extension instances.
	 *
	 * @param extensions extension instances implementing {@link DslExtension}
	 */
	public DumbLang(DslExtension... extensions) {
		this(new DslSettings(), Arrays.asList(extensions));
	}

	/**
	 * @param settings where input is read, output is written, and how calls
	 *        are evaluated
	 */
	public DumbLang(DslSettings settings) {
		this(settings, Collections.<DslExtension>emptyList());
	}

	/**
	 * @param settings where input is read, output is written, and how calls
	 *        are evaluated
	 * @param extensions extension instances, whose functions are added after
	 *        (and may replace) the core builtins
	 */
	public DumbLang(DslSettings settings, Collection<? extends DslExtension> extensions) {
		if (settings == null) {
			throw new IllegalArgumentException("Settings must not be null");
		}
		this.settings = settings;
		List<DslExtension> all = new ArrayList<DslExtension>();
		all.add(new CoreExtension());
		if (extensions != null) {
			all.addAll(extensions);
		}
		this.extensions = Collections.unmodifiableList(all);

		BuiltinTable.Builder builder = BuiltinTable.builder();
		for (DslExtension extension : this.extensions) {
			extension.init(settings);
			builder.addExtension(extension);
		}
		this.builtins = builder.build();
		if (LOG.isDebugEnabled()) {
			LOG.debug("DumbLang settings:\n{}", settings.toDescriptionString());
		}
	}

	/**
	 * @return the settings of this instance
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public DslSettings getSettings() {
		return settings;
	}

	/**
	 * @return the builtins every program run by this instance can call
	 */
	public BuiltinTable getBuiltins() {
		return builtins;
	}

	/**
	 * @return the extensions of this instance, the core extension first
	 */
	public List<DslExtension> getExtensions() {
		return extensions;
	}

	/**
	 * Returns the last program parsed by this instance.
	 *
	 * @return the last {@link ProgramAst}, or {@code null} if nothing was parsed
	 */
	public ProgramAst getLastAst() {
		return lastAst;
	}

	/**
	 * Returns the evaluator of the last run, whose variable stores can be
	 * inspected.
	 *
	 * @return the last {@link Evaluator}, or {@code null} if nothing ran
	 */
	public Evaluator getLastEvaluator() {
		return lastEvaluator;
	}

	/**
	 * Parses a program.
	 *
	 * @param source program text
	 * @return the abstract syntax tree of the program
	 * @throws IOException upon an IO error
	 * @throws org.metricshub.dumblang.frontend.ast.ParserException when the text is not a valid program
	 */
	public ProgramAst compile(String source) throws IOException {
		return compile(ScriptSource.inline(source));
	}

	/**
	 * Parses a program read from a {@link Reader}.
	 *
	 * @param source program text
	 * @return the abstract syntax tree of the program
	 * @throws IOException upon an IO error
	 */
	public ProgramAst compile(Reader source) throws IOException {
		return compile(ScriptSource.inline(source));
	}

	/**
	 * Parses the program of a {@link ScriptSource}.
	 *
	 * @param source where the program is read from
	 * @return the abstract syntax tree of the program
	 * @throws IOException upon an IO error
	 */
	public ProgramAst compile(ScriptSource source) throws IOException {
		ProgramAst ast = new DslParser().parse(source);
		lastAst = ast;
		return ast;
	}

	/**
	 * Parses and runs a program with the entry value of the settings.
	 *
	 * @param source program text
	 * @return the value returned by {@code main}
	 * @throws IOException upon an IO error
	 */
	public Object evaluate(String source) throws IOException {
		return evaluate(source, settings.getEntryValue());
	}

	/**
	 * Parses and runs a program.
	 *
	 * @param source program text
	 * @param entryValue value bound to the parameter of {@code main}
	 * @return the value returned by {@code main}
	 * @throws IOException upon an IO error
	 */
	public Object evaluate(String source, Object entryValue) throws IOException {
		return execute(compile(source), entryValue, null);
	}

	/**
	 * Parses and runs a program with additional builtins.
	 *
	 * @param source program text
	 * @param entryValue value bound to the parameter of {@code main}
	 * @param hostBuiltins builtins added for this run only, replacing builtins
	 *        of the same name
	 * @return the value returned by {@code main}
	 * @throws IOException upon an IO error
	 */
	public Object evaluate(String source, Object entryValue, Map<String, ? extends Builtin> hostBuiltins)
			throws IOException {
		return execute(compile(source), entryValue, hostBuiltins);
	}

	/**
	 * Parses and runs the program of a {@link ScriptSource}.
	 *
	 * @param source where the program is read from
	 * @param entryValue value bound to the parameter of {@code main}
	 * @return the value returned by {@code main}
	 * @throws IOException upon an IO error
	 */
	public Object evaluate(ScriptSource source, Object entryValue) throws IOException {
		return execute(compile(source), entryValue, null);
	}

	/**
	 * Runs a parsed program.
	 *
	 * @param program the abstract syntax tree, as returned by {@link #compile(String)}
	 * @param entryValue value bound to the parameter of {@code main}
	 * @param hostBuiltins builtins added for this run only, may be {@code null}
	 * @return the value returned by {@code main}
	 */
	public Object execute(ProgramAst program, Object entryValue, Map<String, ? extends Builtin> hostBuiltins) {
		BuiltinTable table = builtins;
		if (hostBuiltins != null && !hostBuiltins.isEmpty()) {
			table = builtins.toBuilder().addAll(hostBuiltins).build();
		}
		Evaluator evaluator = new Evaluator(program, table, settings);
		lastEvaluator = evaluator;
		try {
			return evaluator.execute(entryValue);
		} finally {
			settings.getOutputStream().flush();
		}
	}

	/**
	 * Parses a program and renders it as a Python program.
	 *
	 * @param source program text
	 * @return the Python source
	 * @throws IOException upon an IO error
	 */
	public String render(String source) throws IOException {
		return render(compile(source));
	}

	/**
	 * Renders a parsed program as a Python program.
	 *
	 * @param program the abstract syntax tree
	 * @return the Python source
	 */
	public String render(ProgramAst program) {
		return new PythonRenderer(settings).render(program);
	}
}
