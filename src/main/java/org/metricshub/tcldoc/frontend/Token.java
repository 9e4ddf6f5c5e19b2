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

import java.util.List;

/**
 * A classified, positioned fragment of script text.
 * <p>
 * Tokens are immutable: the offset tracker and the procedure registration
 * derive corrected or tagged copies instead of changing a token in place.
 * Offsets refer to the normalized text, <code>[start, end)</code>.
 */
public final class Token implements ParseElement {

	private final TokenType type;
	private final String text;
	private final int start;
	private final int end;
	private final int lineNumber;
	private final String tag;

	/**
	 * <p>
	 * Constructor for Token.
	 * </p>
	 *
	 * @param type lexical class
	 * @param text text of the token
	 * @param start offset of the first character
	 * @param end offset after the last character
	 * @param lineNumber 1-based line number
	 */
	public Token(TokenType type, String text, int start, int end, int lineNumber) {
		this(type, text, start, end, lineNumber, null);
	}

	private Token(TokenType type, String text, int start, int end, int lineNumber, String tag) {
		this.type = type;
		this.text = text;
		this.start = start;
		this.end = end;
		this.lineNumber = lineNumber;
		this.tag = tag;
	}

	/**
	 * Creates the end-of-input sentinel.
	 *
	 * @param offset offset at which the input ended
	 * @param lineNumber line number of the last line
	 * @return an {@link TokenType#EOF} token with empty text
	 */
	public static Token eof(int offset, int lineNumber) {
		return new Token(TokenType.EOF, "", offset, offset, lineNumber);
	}

	public TokenType getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the definition tag of this token, or {@code null}
	 */
	public String getTag() {
		return tag;
	}

	public boolean isTagged() {
		return tag != null;
	}

	public boolean is(TokenType t) {
		return type == t;
	}

	public boolean isEof() {
		return type == TokenType.EOF;
	}

	/**
	 * @param newText replacement text
	 * @param newLineNumber replacement line number
	 * @return a copy of this token with the given text and line number
	 */
	public Token withTextAndLine(String newText, int newLineNumber) {
		return new Token(type, newText, start, end, newLineNumber, tag);
	}

	/**
	 * @param newTag definition tag
	 * @return a copy of this token carrying the given definition tag
	 */
	public Token withTag(String newTag) {
		return new Token(type, text, start, end, lineNumber, newTag);
	}

	/** {@inheritDoc} */
	@Override
	public void reconstruct(StringBuilder out) {
		out.append(text);
	}

	/** {@inheritDoc} */
	@Override
	public void flatten(List<Token> out) {
		out.add(this);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(type.name()).append('(');
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\n') {
				sb.append("\\n");
			} else if (c == '\t') {
				sb.append("\\t");
			} else {
				sb.append(c);
			}
		}
		sb.append(")@").append(lineNumber);
		if (tag != null) {
			sb.append('#').append(tag);
		}
		return sb.toString();
	}
}
