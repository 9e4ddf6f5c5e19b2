package org.metricshub.tcldoc;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Tcldoc
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
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.metricshub.tcldoc.util.ScriptFileSource;
import org.metricshub.tcldoc.util.SourceWalker;
import org.metricshub.tcldoc.util.TclDocSettings;

/**
 * Command-line interface for Tcldoc.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "tcldoc.jar";
		}
		JAR_NAME = myName;
	}

	private final TclDocSettings settings = new TclDocSettings();
	private final PrintStream out;

	private Path source;
	private boolean dumpSyntaxTree;
	private boolean printUsage;
	private TclDoc tclDoc;

	/**
	 * Creates a CLI instance writing to the standard output.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance using the supplied stream for usage and syntax
	 * dumps. Diagnostics go through the logger.
	 *
	 * @param out stream where output is written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
	}

	/**
	 * Returns the mutable {@link TclDocSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public TclDocSettings getSettings() {
		return settings;
	}

	/**
	 * @return the script file or directory given on the command line
	 */
	public Path getSource() {
		return source;
	}

	/**
	 * @return the run executed by {@link #run()}, or {@code null} before that
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public TclDoc getTclDoc() {
		return tclDoc;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// source file or directory
				if (source != null) {
					throw new IllegalArgumentException("Only one source may be given, found '" + source + "' and '" + arg + "'");
				}
				source = Paths.get(arg);
			} else if (arg.equals("-d") || arg.equals("--debug")) {
				// -d level : diagnostic output level
				checkParameterHasArgument(args, argIdx);
				settings.setDebugLevel(parseInt(arg, args[++argIdx]));
			} else if (arg.equals("-o") || arg.equals("--output")) {
				// -o dir : write documentation under dir
				checkParameterHasArgument(args, argIdx);
				settings.setOutputDirectory(Paths.get(args[++argIdx]));
			} else if (arg.equals("-R") || arg.equals("--recursive")) {
				settings.setRecursive(true);
			} else if (arg.equals("--title")) {
				checkParameterHasArgument(args, argIdx);
				settings.setIndexTitle(args[++argIdx]);
			} else if (arg.equals("--max-depth")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMaxNestingDepth(parseInt(arg, args[++argIdx]));
			} else if (arg.equals("--encoding")) {
				// unknown charsets throw IllegalArgumentException subclasses
				checkParameterHasArgument(args, argIdx);
				settings.setCharset(Charset.forName(args[++argIdx]));
			} else if (arg.equals("--dump-syntax")) {
				// --dump-syntax : print the parse tree of each script
				dumpSyntaxTree = true;
			} else if (arg.equals("-h") || arg.equals("-?") || arg.equals("--help")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (source == null) {
			throw new IllegalArgumentException("Tcl source not provided.");
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

	private static int parseInt(String option, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects an integer, got '" + value + "'", e);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments: parses every
	 * script found at the source, then writes the documentation if an output
	 * directory was given. Scripts that fail to parse are logged and skipped.
	 *
	 * @throws IOException if the source cannot be read or the output cannot be
	 *         written
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		List<ScriptFileSource> sources = SourceWalker.discover(source, settings);
		tclDoc = new TclDoc(settings);
		if (settings.getDebugLevel() > 0) {
			out.println("debug level is " + settings.getDebugLevel());
			out.println(settings.toDescriptionString());
		}
		List<ParsedScript> parsed = tclDoc.process(sources);
		if (dumpSyntaxTree) {
			for (ParsedScript script : parsed) {
				out.println("=== " + script.getTitle());
				script.getTree().dump(out);
			}
		}
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
								" [-d level]" +
								" [-o output-dir]" +
								" [-R]" +
								" [--title text]" +
								" [--max-depth n]" +
								" [--encoding charset]" +
								" [--dump-syntax]" +
								" source");
		dest.println();
		dest.println(" source = A .tcl file, or a directory containing .tcl files.");
		dest.println(" -d level = Debug printout level (0=none, default is 0).");
		dest.println(" -o dir = Output path, created if necessary. Omit for no output.");
		dest.println(" -R = Recursively visit all the .tcl files under the source directory.");
		dest.println(" --title text = Title of the master index page (default is \"Command Index\").");
		dest.println(" --max-depth n = Maximum nesting depth of braces, brackets and quotes (default is 256).");
		dest.println(" --encoding charset = Character set of the source files (default is UTF-8).");
		dest.println(" --dump-syntax = Print the parse tree of each script.");
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
	 * @param os output stream for usage and syntax dumps
	 * @return configured and executed CLI instance
	 * @throws IOException if execution fails
	 */
	public static Cli create(String[] args, PrintStream os) throws IOException {
		Cli cli = new Cli(os);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.println(e.getMessage());
			System.exit(1);
		} catch (IOException | UncheckedIOException e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(2);
		}
	}
}
