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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.tcldoc.util.TclDocLogger;
import org.slf4j.Logger;

/**
 * Prepares the content of one Tcl file for parsing.
 * <p>
 * Every line ending with an escaped newline (<code>\</code> immediately followed by
 * the line feed) has those two characters replaced by two spaces, so that the
 * lexer sees a continued line as ordinary whitespace while all offsets stay
 * valid. The offset of each replacement is remembered and undone in the text of
 * any token that covers it, so the tokens handed to the parser carry the
 * original characters and the line numbers of the original file.
 * <p>
 * A debug level of 0 is silent. Level 2 reports each escape removal and
 * restoration, level 3 also reports each token.
 */
public class SourceFile implements TokenSource {

	private static final Logger LOG = TclDocLogger.getLogger(SourceFile.class);

	private static final String ESCAPED_NEWLINE = "\\\n";

	private final String title;
	private final int debugLevel;
	private final String normalized;
	private final int[] lineOffsets;
	private final List<Integer> escapes = new ArrayList<Integer>();
	private final Lexer lexer;
	private int lastLine = 0;
	private int escapeCursor = 0;

	/**
	 * <p>
	 * Constructor for SourceFile.
	 * </p>
	 *
	 * @param content complete text of the file
	 * @param title title of the file, used for index bookkeeping and in messages
	 * @param debugLevel diagnostic output level
	 */
	public SourceFile(String content, String title, int debugLevel) {
		this.title = title;
		this.debugLevel = debugLevel;

		StringBuilder data = new StringBuilder(content.length());
		List<Integer> offsets = new ArrayList<Integer>();
		int offset = 0;
		while (offset < content.length()) {
			offsets.add(offset);
			int newline = content.indexOf('\n', offset);
			int next = newline < 0 ? content.length() : newline + 1;
			if (newline > offset && content.charAt(newline - 1) == '\\') {
				if (debugLevel > 1) {
					LOG.debug("removing escaped newline at end of line {}", offsets.size());
				}
				data.append(content, offset, newline - 1).append("  ");
				escapes.add(newline - 1);
			} else {
				data.append(content, offset, next);
			}
			offset = next;
		}
		this.normalized = data.toString();
		this.lineOffsets = new int[offsets.size()];
		for (int i = 0; i < lineOffsets.length; i++) {
			lineOffsets[i] = offsets.get(i);
		}
		this.lexer = new Lexer(normalized, title, this::lineNumber);
	}

	/** {@inheritDoc} */
	@Override
	public String getDescription() {
		return title;
	}

	/**
	 * @return the text handed to the lexer
	 */
	public String getNormalizedText() {
		return normalized;
	}

	/**
	 * @return the number of physical lines of the file
	 */
	public int getLineCount() {
		return lineOffsets.length;
	}

	/**
	 * @return offsets of the escaped newlines replaced during normalization
	 */
	public List<Integer> getEscapeOffsets() {
		return Collections.unmodifiableList(escapes);
	}

	/**
	 * Returns the line number in the input file for the given offset.
	 * <p>
	 * The scan continues from the line resolved by the previous call, unless the
	 * offset lies before it, in which case it restarts from the first line.
	 *
	 * @param offset offset in the file
	 * @return the 1-based line number containing {@code offset}
	 */
	public int lineNumber(int offset) {
		if (lineOffsets.length == 0) {
			return 1;
		}
		int line = offset >= lineOffsets[lastLine] ? lastLine : 0;
		while (line < lineOffsets.length && offset >= lineOffsets[line]) {
			line++;
		}
		lastLine = Math.max(line - 1, 0);
		return Math.max(line, 1);
	}

	/** {@inheritDoc} */
	@Override
	public int lineNumber() {
		return lineNumber(lexer.getPosition());
	}

	/**
	 * Returns the next token of the file. The returned token has its line number
	 * and text set as if there had been no escaped-newline processing.
	 *
	 * @return the next token, or an {@link TokenType#EOF} sentinel
	 * @throws LexerException if the file contains an illegal character
	 */
	@Override
	public Token nextToken() {
		Token token = lexer.next();
		if (token == null) {
			return Token.eof(normalized.length(), Math.max(lineOffsets.length, 1));
		}
		int line = lineNumber(token.getStart());
		String value = token.getText();
		while (escapeCursor < escapes.size() && escapes.get(escapeCursor) + 1 < token.getStart()) {
			escapeCursor++;
		}
		char[] chars = null;
		for (int i = escapeCursor; i < escapes.size() && escapes.get(i) < token.getEnd(); i++) {
			int escape = escapes.get(i);
			for (int k = 0; k < ESCAPED_NEWLINE.length(); k++) {
				int at = escape + k;
				if (at >= token.getStart() && at < token.getEnd()) {
					if (chars == null) {
						chars = value.toCharArray();
					}
					chars[at - token.getStart()] = ESCAPED_NEWLINE.charAt(k);
				}
			}
			if (debugLevel > 1) {
				LOG.debug("restored escaped newline at end of line {}", lineNumber(escape));
			}
		}
		if (chars != null) {
			value = new String(chars);
		}
		token = token.withTextAndLine(value, line);
		if (debugLevel > 2) {
			LOG.debug("shift {}", token);
		}
		return token;
	}
}
