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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.metricshub.tcldoc.util.TclDocLogger;
import org.slf4j.Logger;

/**
 * Marks a position within a list of tokens that were already classified, and
 * replays them as a {@link TokenSource}. Used to re-parse the content of a node
 * as an embedded script without reading the source again.
 *
 * @author Danny Daglas
 */
public class TokenReplay implements TokenSource {

	private static final Logger LOG = TclDocLogger.getLogger(TokenReplay.class);

	private int idx = 0;
	private final List<Token> queue;
	private final String description;
	private final int debugLevel;

	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "TokenReplay must iterate over the flattened token list")
	public TokenReplay(List<Token> queue, String description, int debugLevel) {
		this.queue = queue;
		this.description = description;
		this.debugLevel = debugLevel;
	}

	public boolean isEOF() {
		return idx >= queue.size();
	}

	/** {@inheritDoc} */
	@Override
	public Token nextToken() {
		if (isEOF()) {
			if (queue.isEmpty()) {
				return Token.eof(0, -1);
			}
			Token last = queue.get(queue.size() - 1);
			return Token.eof(last.getEnd(), last.getLineNumber());
		}
		Token token = queue.get(idx++);
		if (debugLevel > 2) {
			LOG.debug("shift {}", token);
		}
		return token;
	}

	/** {@inheritDoc} */
	@Override
	public int lineNumber() {
		if (idx < queue.size()) {
			return queue.get(idx).getLineNumber();
		}
		return queue.isEmpty() ? -1 : queue.get(queue.size() - 1).getLineNumber();
	}

	/** {@inheritDoc} */
	@Override
	public String getDescription() {
		return description;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "[" + idx + "]-->" + (isEOF() ? "EOF" : queue.get(idx).toString());
	}
}
