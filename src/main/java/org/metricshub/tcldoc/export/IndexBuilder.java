package org.metricshub.tcldoc.export;

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

import java.util.List;
import org.metricshub.tcldoc.index.ProcedureIndex;

/**
 * Builds the alphabetical cross-reference of the procedures of a run.
 * <p>
 * Procedures are sorted ignoring case and banded by their upper-cased first
 * letter. The first definition of a name links to <code>page#name</code>, every
 * further one is an ordinal link <code>[n]</code> to <code>page#name_n</code>,
 * where the page of a script is its title with the <code>.tcl</code> extension
 * replaced by <code>.html</code>.
 */
public final class IndexBuilder {

	/**
	 * Private constructor to prevent instantiation.
	 */
	private IndexBuilder() {
		// utility class
	}

	/**
	 * Returns the index of all procedures.
	 *
	 * @param procedureIndex procedures found during the run
	 * @return a <code>div class="index"</code> element
	 */
	public static DocNode.Element build(ProcedureIndex procedureIndex) {
		return build(procedureIndex, null);
	}

	/**
	 * Returns the index of the procedures defined in one script. A procedure
	 * defined there and in other scripts keeps its links to every definition.
	 *
	 * @param procedureIndex procedures found during the run
	 * @param title script title to filter on, or {@code null} for all procedures
	 * @return a <code>div class="index"</code> element
	 */
	public static DocNode.Element build(ProcedureIndex procedureIndex, String title) {
		DocNode.Element index = DocNode.element("div", "index");
		char firstLetter = '?';
		for (String proc : procedureIndex.getSortedNames()) {
			if (title != null && !procedureIndex.isDefinedIn(proc, title)) {
				continue;
			}
			char letter = Character.toUpperCase(proc.charAt(0));
			if (letter != firstLetter) {
				firstLetter = letter;
				index
						.append(
								DocNode
										.element("div", "letter")
										.append(DocNode.entity("mdash"), DocNode.text(" " + letter + " "), DocNode.entity("mdash")));
			}
			List<ProcedureIndex.Definition> definitions = procedureIndex.getDefinitions(proc);
			for (ProcedureIndex.Definition definition : definitions) {
				int occurrence = definition.getOccurrence();
				String href = pageFor(definition.getTitle()) + "#" + ProcedureIndex.tag(proc, occurrence);
				if (occurrence == 1) {
					index.append(DocNode.text(" "), DocNode.element("a").attribute("href", href).append(proc));
				} else {
					index
							.append(
									DocNode.entity("nbsp"),
									DocNode.element("a").attribute("href", href).append("[" + occurrence + "]"));
				}
			}
		}
		return index;
	}

	/**
	 * @param title script title
	 * @return the relative path of the page documenting the script
	 */
	public static String pageFor(String title) {
		if (title.endsWith(".tcl")) {
			return title.substring(0, title.length() - ".tcl".length()) + ".html";
		}
		return title + ".html";
	}
}
