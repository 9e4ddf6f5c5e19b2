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
 * A cursor over classified tokens, consumed by the {@link TclParser}.
 * <p>
 * Exhaustion is reported as data: once the input is consumed, every call to
 * {@link #nextToken()} returns a token of type {@link TokenType#EOF}. Whether
 * that is an error is for the parser to decide.
 */
public interface TokenSource {

	/**
	 * @return the next token, or an {@link TokenType#EOF} sentinel
	 */
	Token nextToken();

	/**
	 * @return the 1-based line number where the next token starts
	 */
	int lineNumber();

	/**
	 * @return the title of the script the tokens come from
	 */
	String getDescription();
}
