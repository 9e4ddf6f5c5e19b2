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

import org.metricshub.tcldoc.frontend.ParseNode;

/**
 * A script that was parsed successfully, with what is needed to document it.
 */
public class ParsedScript {

	private final String title;
	private final String baseHref;
	private final ParseNode tree;

	/**
	 * @param title title under which the script is indexed
	 * @param baseHref relative path from the script's page back to the output root
	 * @param tree root of the parse tree
	 */
	public ParsedScript(String title, String baseHref, ParseNode tree) {
		this.title = title;
		this.baseHref = baseHref;
		this.tree = tree;
	}

	public String getTitle() {
		return title;
	}

	public String getBaseHref() {
		return baseHref;
	}

	public ParseNode getTree() {
		return tree;
	}

	@Override
	public String toString() {
		return title;
	}
}
