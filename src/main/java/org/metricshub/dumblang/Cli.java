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
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.dumblang.backend.StoreMode;
import org.metricshub.dumblang.ext.DslExtension;
import org.metricshub.dumblang.frontend.ast.ParserException;
import org.metricshub.dumblang.frontend.ast.ProgramAst;
import org.metricshub.dumblang.jrt.DslRuntimeException;
import org.metricshub.dumblang.jrt.IllegalDslArgumentException;
import org.metricshub.dumblang.util.DslLogger;
import org.metricshub.dumblang.util.DslSettings;
import org.metricshub.dumblang.util.ScriptFileSource;
import org.metricshub.dumblang.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for DumbLang.
 * <p>
 * {@code run <source-file>} evaluates a program, {@code <source-file>
 * --emit-source} prints it as a Python program.
 */
public final class Cli {

	private static final Logger LOG = DslLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "DumbLang.jar";
		}
		JAR_NAME = myName;
	}

	private static final String RUN_COMMAND = "run";

	private final DslSettings settings = new DslSettings();
	private final PrintStream out;
	private final PrintStream err;

	private ScriptSource scriptSource;
	private final List<String> extensionClassNames = new ArrayList<String>();

	private boolean emitSource;
	private boolean dumpSyntaxTree;
	private boolean dumpStores;
	private boolean printUsage;
	private int exitCode;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which program input is read
	 * @param out stream where program output is written
	 * @param err stream where error messages are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
		settings.setInput(in);
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link DslSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public DslSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program source given on the command line, {@code null} if none
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	public boolean isEmitSource() {
		return emitSource;
	}

	/**
	 * @return the exit code of the last {@link #run()}: 0 on success, 1 on failure
	 */
	public int getExitCode() {
		return exitCode;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException when the arguments are invalid
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		boolean runCommand = false;
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.equals("--emit-source")) {
				emitSource = true;
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("--dump-stores")) {
				dumpStores = true;
			} else if (arg.equals("--frames")) {
				// --frames : fresh variable store per call
				settings.setStoreMode(StoreMode.PER_ACTIVATION);
			} else if (arg.equals("--no-prompt")) {
				settings.setPromptForInput(false);
			} else if (arg.equals("--entry")) {
				// --entry value : value handed to main
				checkParameterHasArgument(args, argIdx);
				settings.setEntryValue(parseEntryValue(args[++argIdx]));
			} else if (arg.equals("-l") || arg.equals("--load")) {
				// -l/--load class : load an extension
				checkParameterHasArgument(args, argIdx);
				extensionClassNames.add(args[++argIdx]);
			} else if (arg.equals("-h") || arg.equals("-?") || arg.equals("--help")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else if (arg.charAt(0) == '-') {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			} else if (arg.equals(RUN_COMMAND) && !runCommand && scriptSource == null) {
				runCommand = true;
			} else if (scriptSource == null) {
				scriptSource = new ScriptFileSource(arg);
			} else {
				throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null) {
			throw new IllegalArgumentException("DumbLang source file not provided.");
		}
		if (runCommand && emitSource) {
			throw new IllegalArgumentException("'run' and --emit-source cannot be combined.");
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * A number when the text parses as one, the text itself otherwise.
	 */
	private static Object parseEntryValue(String valueString) {
		try {
			return Double.valueOf(Double.parseDouble(valueString));
		} catch (NumberFormatException nfe) {
			return valueString;
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments. Failures of
	 * the program are reported on the error stream.
	 *
	 * @return the exit code: 0 on success, 1 when the program failed
	 */
	public int run() {
		exitCode = 0;
		if (printUsage) {
			usage(out);
			return exitCode;
		}
		try {
			execute();
		} catch (ParserException e) {
			report(e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
		} catch (DslRuntimeException e) {
			report(e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
		} catch (IllegalDslArgumentException e) {
			report(e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
		} catch (IOException | RuntimeException e) {
			LOG.debug("Execution failed", e);
			report(e.getClass().getSimpleName(), -1, e.getMessage());
		}
		return exitCode;
	}

	private void execute() throws IOException {
		List<DslExtension> extensions = new ArrayList<DslExtension>();
		for (String className : extensionClassNames) {
			extensions.add(instantiateExtension(className));
		}
		DumbLang dumbLang = new DumbLang(settings, extensions);
		ProgramAst program = dumbLang.compile(scriptSource);

		if (dumpSyntaxTree) {
			program.dump(out);
			// If only dumping information, no need to execute the program
			return;
		}
		if (emitSource) {
			out.print(dumbLang.render(program));
			out.flush();
			return;
		}
		try {
			dumbLang.execute(program, settings.getEntryValue(), null);
		} finally {
			if (dumpStores && dumbLang.getLastEvaluator() != null) {
				dumbLang.getLastEvaluator().dumpStores(out);
			}
		}
	}

	private static DslExtension instantiateExtension(String className) {
		try {
			Class<?> clazz = Class.forName(className);
			if (!DslExtension.class.isAssignableFrom(clazz)) {
				throw new IllegalArgumentException(className + " is not a " + DslExtension.class.getSimpleName());
			}
			return clazz.asSubclass(DslExtension.class).getDeclaredConstructor().newInstance();
		} catch (ClassNotFoundException e) {
			throw new IllegalArgumentException("Unknown extension '" + className + "'", e);
		} catch (InstantiationException | IllegalAccessException | NoSuchMethodException e) {
			throw new IllegalStateException("Cannot instantiate extension " + className, e);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			throw new IllegalStateException("Cannot instantiate extension " + className, cause);
		}
	}

	private void report(String type, int lineNumber, String message) {
		out.flush();
		if (lineNumber >= 0) {
			err.println(type + " (line " + lineNumber + "): " + message);
		} else {
			err.println(type + ": " + message);
		}
		err.flush();
		exitCode = 1;
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" run" +
								" [--entry value]" +
								" [--frames]" +
								" [--no-prompt]" +
								" [--dump-stores]" +
								" [-l extension-class]..." +
								" source-file");
		dest.println("java -jar " + JAR_NAME + " source-file --emit-source");
		dest.println("java -jar " + JAR_NAME + " source-file --dump-syntax");
		dest.println();
		dest.println(" run = Parse and evaluate the program.");
		dest.println(" --emit-source = Print the program as an equivalent Python program.");
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println(" --dump-stores = Print the variable store of every function after the run.");
		dest.println(" --entry value = Value handed to main (a number if it parses as one). Default: 0.0");
		dest.println(" --frames = Give each function call its own variable store.");
		dest.println(" --no-prompt = Do not print a prompt before reading input.");
		dest.println(" -l class, --load class = Load an extension by class name.");
		dest.println("                      Extensions must already be on the class path before loading them.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for program input
	 * @param os output stream for program output
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance, see {@link #getExitCode()}
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		Cli cli = new Cli();
		try {
			cli.parse(args);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.println(e.getMessage());
			System.exit(1);
		}
		System.exit(cli.run());
	}
}
