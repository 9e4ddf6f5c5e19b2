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
 * Lexical token classes of a Tcl script.
 * <p>
 * Besides the three non-literal classes ({@link #WS}, {@link #EOL} and
 * {@link #WORD}), every reserved character of the language is its own
 * single-character literal class. {@link #EOF} is the sentinel returned by a
 * {@link TokenSource} once its input is exhausted.
 */
public enum TokenType {
	/** A run of spaces and tabs. */
	WS,
	/** A newline followed by any mixture of newlines, spaces and tabs. */
	EOL,
	/** A run of non-reserved characters and escaped pairs. */
	WORD,

	OPEN_BRACE('{'),
	CLOSE_BRACE('}'),
	HASH('#'),
	DOLLAR('$'),
	QUOTE('"'),
	OPEN_BRACKET('['),
	CLOSE_BRACKET(']'),
	SEMICOLON(';'),

	/** End of input. Never produced by the lexer itself. */
	EOF;

	private final char literal;

	TokenType() {
		this.literal = 0;
	}

	TokenType(char literal) {
		this.literal = literal;
	}

	/**
	 * @return {@code true} for the single-character reserved classes
	 */
	public boolean isLiteral() {
		return literal != 0;
	}

	/**
	 * @return the reserved character of a literal class, or {@code 0}
	 */
	public char getLiteral() {
		return literal;
	}

	/**
	 * Looks up the literal class of a reserved character.
	 *
	 * @param c character to classify
	 * @return the literal class, or {@code null} if {@code c} is not reserved
	 */
	public static TokenType forLiteral(int c) {
		switch (c) {
		case '{':
			return OPEN_BRACE;
		case '}':
			return CLOSE_BRACE;
		case '#':
			return HASH;
		case '$':
			return DOLLAR;
		case '"':
			return QUOTE;
		case '[':
			return OPEN_BRACKET;
		case ']':
			return CLOSE_BRACKET;
		case ';':
			return SEMICOLON;
		default:
			return null;
		}
	}
}
