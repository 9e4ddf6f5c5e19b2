package org.metricshub.tcldoc.util;

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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.metricshub.tcldoc.frontend.TclParser;

/**
 * A simple container for the parameters of a single documentation run.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Tcldoc programmatically, from within Java code.
 */
public class TclDocSettings {

	/**
	 * Diagnostic output level; 0 (silent unless a file fails to parse) by default.
	 * It never changes the result of a parse.
	 */
	private int debugLevel = 0;

	/**
	 * Deepest nesting of groups, quotes, substitutions and variables accepted
	 * before a file is rejected.
	 */
	private int maxNestingDepth = TclParser.DEFAULT_MAX_DEPTH;

	/**
	 * Encoding of the script files;
	 * <code>UTF-8</code> by default.
	 */
	private Charset charset = StandardCharsets.UTF_8;

	/**
	 * Where the HTML pages are written.
	 * <code>null</code> means the scripts are only parsed.
	 */
	private Path outputDirectory = null;

	/**
	 * Whether sub-directories of the source directory are visited;
	 * <code>false</code> by default.
	 */
	private boolean recursive = false;

	/**
	 * Title of the master index page.
	 */
	private String indexTitle = "Command Index";

	/**
	 * Name of the stylesheet copied next to the generated pages.
	 */
	private String stylesheet = "tclcode.css";

	/**
	 * Extension of the files considered as Tcl scripts.
	 */
	private String sourceExtension = ".tcl";

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

		desc.append("debugLevel = ").append(getDebugLevel()).append(newLine);
		desc.append("maxNestingDepth = ").append(getMaxNestingDepth()).append(newLine);
		desc.append("charset = ").append(getCharset()).append(newLine);
		desc.append("outputDirectory = ").append(getOutputDirectory()).append(newLine);
		desc.append("recursive = ").append(isRecursive()).append(newLine);
		desc.append("indexTitle = ").append(getIndexTitle()).append(newLine);
		desc.append("stylesheet = ").append(getStylesheet()).append(newLine);
		desc.append("sourceExtension = ").append(getSourceExtension()).append(newLine);

		return desc.toString();
	}

	public int getDebugLevel() {
		return debugLevel;
	}

	public void setDebugLevel(int debugLevel) {
		this.debugLevel = debugLevel;
	}

	public int getMaxNestingDepth() {
		return maxNestingDepth;
	}

	/**
	 * @param maxNestingDepth a positive nesting limit
	 */
	public void setMaxNestingDepth(int maxNestingDepth) {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maximum nesting depth must be positive: " + maxNestingDepth);
		}
		this.maxNestingDepth = maxNestingDepth;
	}

	public Charset getCharset() {
		return charset;
	}

	public void setCharset(Charset charset) {
		this.charset = charset;
	}

	public Path getOutputDirectory() {
		return outputDirectory;
	}

	public void setOutputDirectory(Path outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

	public boolean isRecursive() {
		return recursive;
	}

	public void setRecursive(boolean recursive) {
		this.recursive = recursive;
	}

	public String getIndexTitle() {
		return indexTitle;
	}

	public void setIndexTitle(String indexTitle) {
		this.indexTitle = indexTitle;
	}

	public String getStylesheet() {
		return stylesheet;
	}

	public void setStylesheet(String stylesheet) {
		this.stylesheet = stylesheet;
	}

	public String getSourceExtension() {
		return sourceExtension;
	}

	public void setSourceExtension(String sourceExtension) {
		this.sourceExtension = sourceExtension;
	}
}
