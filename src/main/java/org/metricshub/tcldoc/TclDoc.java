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
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.tcldoc.export.DocNode;
import org.metricshub.tcldoc.export.HtmlPage;
import org.metricshub.tcldoc.export.IndexBuilder;
import org.metricshub.tcldoc.export.TreeExporter;
import org.metricshub.tcldoc.frontend.ParseNode;
import org.metricshub.tcldoc.frontend.SourceFile;
import org.metricshub.tcldoc.frontend.TclParseException;
import org.metricshub.tcldoc.frontend.TclParser;
import org.metricshub.tcldoc.index.ProcedureIndex;
import org.metricshub.tcldoc.util.ScriptDecoder;
import org.metricshub.tcldoc.util.ScriptFileSource;
import org.metricshub.tcldoc.util.ScriptReadException;
import org.metricshub.tcldoc.util.ScriptSource;
import org.metricshub.tcldoc.util.TclDocLogger;
import org.metricshub.tcldoc.util.TclDocSettings;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and documentation of Tcl scripts.
 * <p>
 * One instance corresponds to one run: all the scripts parsed by an instance
 * share its {@link ProcedureIndex}, so that procedures defined in one script
 * are cross-referenced from the pages of all the others. The index must be
 * complete before any page is written, hence the two phases:
 * <ol>
 * <li>{@link #parseAll(List)} parses every script, registering procedures;
 * <li>{@link #writeDocumentation(List, Path)} writes the stylesheet, the master
 * index and one page per parsed script.
 * </ol>
 * A script that cannot be read or fails to parse is reported and skipped; it
 * never stops the run.
 * <p>
 * Instances are not thread-safe.
 */
public class TclDoc {

	private static final Logger LOG = TclDocLogger.getLogger(TclDoc.class);

	/** Name of the stylesheet bundled with this class. */
	public static final String STYLESHEET_RESOURCE = "tclcode.css";

	/** Name of the master index page. */
	public static final String MASTER_INDEX = "index.html";

	private final TclDocSettings settings;
	private final ProcedureIndex procedureIndex = new ProcedureIndex();
	private final List<TclParseException> failures = new ArrayList<TclParseException>();

	/** Charset that gives back the bytes of each tree parsed from bytes */
	private final Map<ParseNode, Charset> sourceCharsets = new IdentityHashMap<ParseNode, Charset>();

	/**
	 * Create a new instance with default settings
	 */
	public TclDoc() {
		this(new TclDocSettings());
	}

	/**
	 * @param settings settings of the run
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public TclDoc(TclDocSettings settings) {
		this.settings = settings;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public TclDocSettings getSettings() {
		return settings;
	}

	/**
	 * @return the procedures found so far in this run
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ProcedureIndex getProcedureIndex() {
		return procedureIndex;
	}

	/**
	 * @return the errors of the scripts that {@link #parseAll(List)} skipped:
	 *         {@link ScriptReadException} for those that could not be read, a
	 *         parse error for the others
	 */
	public List<TclParseException> getFailures() {
		return Collections.unmodifiableList(failures);
	}

	/**
	 * Parses one script, registering its procedures in this run's index.
	 * <p>
	 * Bytes that are not valid in the configured charset are read as ISO-8859-1,
	 * so that {@link #reconstructBytes(ParseNode)} always gives them back.
	 *
	 * @param sourceBytes script contents, preferably in the configured charset
	 * @param title title under which procedures are indexed
	 * @return the root of the parse tree
	 * @throws TclParseException if the script is not valid
	 */
	public ParseNode parse(byte[] sourceBytes, String title) {
		return parse(sourceBytes, settings.getCharset(), title);
	}

	private ParseNode parse(byte[] sourceBytes, Charset preferred, String title) {
		ScriptDecoder.Decoded decoded = ScriptDecoder.decode(sourceBytes, preferred);
		if (settings.getDebugLevel() > 0 && !decoded.getCharset().equals(preferred)) {
			LOG.info("{} is not valid {}, reading it as {}", title, preferred, decoded.getCharset());
		}
		ParseNode tree = parse(decoded.getText(), title);
		sourceCharsets.put(tree, decoded.getCharset());
		return tree;
	}

	/**
	 * Parses one script, registering its procedures in this run's index.
	 *
	 * @param content script contents
	 * @param title title under which procedures are indexed
	 * @return the root of the parse tree
	 * @throws TclParseException if the script is not valid
	 */
	public ParseNode parse(String content, String title) {
		SourceFile sourceFile = new SourceFile(content, title, settings.getDebugLevel());
		if (settings.getDebugLevel() > 0) {
			LOG.info("parsing {} ({} lines)", title, sourceFile.getLineCount());
		}
		TclParser parser = new TclParser(
				sourceFile,
				procedureIndex,
				settings.getDebugLevel(),
				settings.getMaxNestingDepth());
		return parser.parse();
	}

	/**
	 * Reads and parses one script. Files are read as bytes, see
	 * {@link #parse(byte[], String)}.
	 *
	 * @param source script to parse
	 * @return the root of the parse tree
	 * @throws IOException if the script cannot be read
	 * @throws TclParseException if the script is not valid
	 */
	public ParseNode parse(ScriptSource source) throws IOException {
		if (source instanceof ScriptFileSource) {
			ScriptFileSource file = (ScriptFileSource) source;
			return parse(file.readBytes(), file.getCharset(), source.getDescription());
		}
		return parse(source.readContent(), source.getDescription());
	}

	/**
	 * Parses all the given scripts in order. Scripts that cannot be read or are
	 * not valid are logged, recorded in {@link #getFailures()} and left out of the
	 * result.
	 *
	 * @param sources scripts to parse
	 * @return the scripts parsed successfully, in the same order
	 */
	public List<ParsedScript> parseAll(List<? extends ScriptSource> sources) {
		List<ParsedScript> parsed = new ArrayList<ParsedScript>();
		for (ScriptSource source : sources) {
			try {
				parsed.add(new ParsedScript(source.getDescription(), source.getBaseHref(), parse(source)));
			} catch (IOException e) {
				unreadable(source, e);
			} catch (UncheckedIOException e) {
				unreadable(source, e.getCause());
			} catch (TclParseException e) {
				LOG.error("{} (line {}): {}", e.getSourceDescription(), e.getLineNumber(), e.getMessage());
				failures.add(e);
			}
		}
		return parsed;
	}

	private void unreadable(ScriptSource source, IOException e) {
		LOG.error("{}: {}", source.getDescription(), e.toString());
		failures.add(new ScriptReadException(source.getDescription(), e));
	}

	/**
	 * Parses all the given scripts and, if an output directory is configured,
	 * writes their documentation.
	 *
	 * @param sources scripts to document
	 * @return the scripts parsed successfully
	 * @throws IOException if the output cannot be written
	 */
	public List<ParsedScript> process(List<? extends ScriptSource> sources) throws IOException {
		List<ParsedScript> parsed = parseAll(sources);
		if (settings.getOutputDirectory() != null) {
			writeDocumentation(parsed, settings.getOutputDirectory());
		}
		return parsed;
	}

	/**
	 * Regenerates the exact text of a parsed script.
	 *
	 * @param tree root of a parse tree
	 * @return the script text, line continuations included
	 */
	public static String reconstruct(ParseNode tree) {
		return tree.reconstruct();
	}

	/**
	 * @param tree root of a parse tree
	 * @return the script text, encoded in the charset it was read with if it was
	 *         parsed from bytes by this instance, in the configured charset
	 *         otherwise
	 */
	public byte[] reconstructBytes(ParseNode tree) {
		return reconstruct(tree).getBytes(sourceCharsets.getOrDefault(tree, settings.getCharset()));
	}

	/**
	 * @param tree root of a parse tree
	 * @return the structural document of the script
	 */
	public static DocNode.Element export(ParseNode tree) {
		return TreeExporter.export(tree);
	}

	/**
	 * @return the cross-reference of all the procedures of this run
	 */
	public DocNode.Element buildIndex() {
		return IndexBuilder.build(procedureIndex);
	}

	/**
	 * @param titleFilter title of the script whose procedures are listed, or
	 *        {@code null} for all
	 * @return the cross-reference of the procedures defined in one script
	 */
	public DocNode.Element buildIndex(String titleFilter) {
		return IndexBuilder.build(procedureIndex, titleFilter);
	}

	/**
	 * Writes the documentation of parsed scripts: the stylesheet, a master index
	 * when there is more than one script, and one page per script named after
	 * its title.
	 *
	 * @param parsed scripts returned by {@link #parseAll(List)}
	 * @param outputDirectory root of the documentation, created if needed
	 * @throws IOException if the output cannot be written
	 */
	public void writeDocumentation(List<ParsedScript> parsed, Path outputDirectory) throws IOException {
		if (!Files.isDirectory(outputDirectory)) {
			if (settings.getDebugLevel() > 0) {
				LOG.info("creating output directory {}", outputDirectory);
			}
			Files.createDirectories(outputDirectory);
		}
		copyStylesheet(outputDirectory.resolve(settings.getStylesheet()));

		if (parsed.size() > 1) {
			if (settings.getDebugLevel() > 0) {
				LOG.info("writing master index with title \"{}\"", settings.getIndexTitle());
			}
			HtmlPage master = new HtmlPage(settings.getIndexTitle(), null, settings.getStylesheet()).withIndex(buildIndex());
			Files.writeString(outputDirectory.resolve(MASTER_INDEX), master.render(), StandardCharsets.UTF_8);
		}

		for (ParsedScript script : parsed) {
			Path page = outputDirectory.resolve(IndexBuilder.pageFor(script.getTitle()));
			Path directory = page.getParent();
			if (directory != null && !Files.isDirectory(directory)) {
				if (settings.getDebugLevel() > 0) {
					LOG.info("creating {}", directory);
				}
				Files.createDirectories(directory);
			}
			if (settings.getDebugLevel() > 0) {
				LOG.info("writing {}", page);
			}
			HtmlPage html = new HtmlPage(script.getTitle(), script.getBaseHref(), settings.getStylesheet())
					.withIndex(buildIndex(script.getTitle()))
					.withContent(export(script.getTree()));
			Files.writeString(page, html.render(), StandardCharsets.UTF_8);
		}
	}

	private static void copyStylesheet(Path target) throws IOException {
		try (InputStream in = TclDoc.class.getResourceAsStream(STYLESHEET_RESOURCE)) {
			if (in == null) {
				throw new NoSuchFileException(STYLESHEET_RESOURCE, null, "stylesheet is missing from the class path");
			}
			Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}
}
