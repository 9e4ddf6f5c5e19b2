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

import java.util.function.IntUnaryOperator;

/**
 * Splits normalized Tcl text into a flat sequence of {@link Token}s.
 * <p>
 * The classification needs at most one character of lookahead:
 * <ul>
 * <li>spaces and tabs form a {@link TokenType#WS} token;
 * <li>a newline followed by any mix of newlines, spaces and tabs forms a
 * single {@link TokenType#EOL} token, so blank lines collapse;
 * <li>each reserved character <code>{ } # $ " [ ] ;</code> is its own literal token;
 * <li>everything else forms a {@link TokenType#WORD}, where a backslash and the
 * character after it are consumed together, so an escaped reserved character
 * stays inside the word.
 * </ul>
 * A backslash that has nothing to escape (end of input, or a newline that was
 * not normalized away) is illegal.
 * <p>
 * The lexer holds no parser state. Line numbers of the tokens it returns come
 * from the supplied line locator, which the {@link SourceFile} replaces later
 * with the line of the un-normalized source.
 *
 * @author Danny Daglas
 */
public class Lexer {

	private final CharSequence text;
	private final String sourceDescription;
	private final IntUnaryOperator lineLocator;
	private final int length;
	private int position;

	/**
	 * <p>
	 * Constructor for Lexer.
	 * </p>
	 *
	 * @param text normalized script text
	 * @param sourceDescription title of the script, used in error messages
	 * @param lineLocator maps an offset of {@code text} to its 1-based line number
	 */
	public Lexer(CharSequence text, String sourceDescription, IntUnaryOperator lineLocator) {
		this.text = text;
		this.sourceDescription = sourceDescription;
		this.lineLocator = lineLocator;
		this.length = text.length();
		this.position = 0;
	}

	/**
	 * @return the offset where the next token will start
	 */
	public int getPosition() {
		return position;
	}

	/**
	 * Reads the next token.
	 *
	 * @return the next token, or {@code null} once the text is exhausted
	 * @throws LexerException if an illegal character is found
	 */
	public Token next() {
		if (position >= length) {
			return null;
		}
		int start = position;
		char c = text.charAt(position);
		TokenType type;

		if (isInlineWhitespace(c)) {
			while (position < length && isInlineWhitespace(text.charAt(position))) {
				position++;
			}
			type = TokenType.WS;
		} else if (c == '\n') {
			position++;
			while (position < length && (text.charAt(position) == '\n' || isInlineWhitespace(text.charAt(position)))) {
				position++;
			}
			type = TokenType.EOL;
		} else if (TokenType.forLiteral(c) != null) {
			position++;
			type = TokenType.forLiteral(c);
		} else {
			readWord();
			if (position == start) {
				throw new LexerException(
						"Illegal character on line " + lineLocator.applyAsInt(start) + ": '" + c + "'",
						sourceDescription,
						lineLocator.applyAsInt(start));
			}
			type = TokenType.WORD;
		}
		return new Token(type, text.subSequence(start, position).toString(), start, position, lineLocator.applyAsInt(start));
	}

	/**
	 * Advances over a word. Stops without consuming an unusable backslash, so
	 * that the next call reports it.
	 */
	private void readWord() {
		while (position < length) {
			char c = text.charAt(position);
			if (c == '\\') {
				if (position + 1 >= length || text.charAt(position + 1) == '\n') {
					return;
				}
				position += 2;
			} else if (isInlineWhitespace(c) || c == '\n' || TokenType.forLiteral(c) != null) {
				return;
			} else {
				position++;
			}
		}
	}

	private static boolean isInlineWhitespace(char c) {
		return c == ' ' || c == '\t';
	}
}
