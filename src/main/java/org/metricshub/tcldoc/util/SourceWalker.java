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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers the Tcl scripts to document.
 * <p>
 * A single file is titled with its file name. In a directory, every file with
 * the configured extension is titled with its path relative to that directory,
 * always using <code>/</code> as separator, and gets the <code>../</code> path
 * leading from its page back to the output root.
 */
public final class SourceWalker {

	/**
	 * Private constructor to prevent instantiation.
	 */
	private SourceWalker() {
		// utility class
	}

	/**
	 * Lists the scripts found at {@code source}, sorted by title.
	 *
	 * @param source a script file or a directory
	 * @param settings extension, recursion and charset to use
	 * @return the script sources, not yet opened
	 * @throws IOException if {@code source} does not exist or cannot be listed
	 */
	public static List<ScriptFileSource> discover(Path source, TclDocSettings settings) throws IOException {
		if (!Files.exists(source)) {
			throw new NoSuchFileException(source.toString());
		}
		List<ScriptFileSource> sources = new ArrayList<ScriptFileSource>();
		if (Files.isRegularFile(source)) {
			sources.add(new ScriptFileSource(source, source.getFileName().toString(), "", settings.getCharset()));
			return sources;
		}
		int maxDepth = settings.isRecursive() ? Integer.MAX_VALUE : 1;
		List<Path> files;
		try (Stream<Path> walk = Files.walk(source, maxDepth)) {
			files = walk
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(settings.getSourceExtension()))
					.collect(Collectors.toList());
		}
		for (Path file : files) {
			Path relative = source.relativize(file);
			sources.add(new ScriptFileSource(file, toTitle(relative), baseHref(relative), settings.getCharset()));
		}
		sources.sort(Comparator.comparing(ScriptSource::getDescription));
		return sources;
	}

	/**
	 * @param relative path relative to the source directory
	 * @return the path with <code>/</code> separators
	 */
	static String toTitle(Path relative) {
		StringBuilder title = new StringBuilder();
		for (Path segment : relative) {
			if (title.length() > 0) {
				title.append('/');
			}
			title.append(segment.toString());
		}
		return title.toString();
	}

	/**
	 * @param relative path relative to the source directory
	 * @return one <code>../</code> per directory containing the file
	 */
	static String baseHref(Path relative) {
		StringBuilder base = new StringBuilder();
		for (int i = 1; i < relative.getNameCount(); i++) {
			base.append("../");
		}
		return base.toString();
	}
}
