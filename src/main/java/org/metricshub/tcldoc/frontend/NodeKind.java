package org.metricshub.tcldoc.frontend;

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

/**
 * The grammar constructs of a Tcl script. Each construct owns the fixed
 * delimiters consumed when it is entered and left.
 */
public enum NodeKind {
	/** A sequence of commands; the root of a file or of an embedded script. */
	SCRIPT("Script", "", ""),
	/** Words up to and including the terminating newline or semicolon. */
	COMMAND("Command", "", ""),
	/** From <code>#</code> up to and including the end of line. */
	COMMENT("Comment", "#", ""),
	QUOTED("Quoted", "\"", "\""),
	/** An opaque braced word; only nested braces are recognized inside. */
	GROUP("Group", "{", "}"),
	/** A command substitution. */
	SUBSTITUTION("Substitution", "[", "]"),
	/** <code>$name</code> or <code>${name}</code>. */
	VARIABLE("Variable", "$", "");

	private final String displayName;
	private final String prefix;
	private final String suffix;

	NodeKind(String displayName, String prefix, String suffix) {
		this.displayName = displayName;
		this.prefix = prefix;
		this.suffix = suffix;
	}

	/**
	 * @return the name used in messages and as CSS class of exported nodes
	 */
	public String getDisplayName() {
		return displayName;
	}

	public String getPrefix() {
		return prefix;
	}

	public String getSuffix() {
		return suffix;
	}
}
