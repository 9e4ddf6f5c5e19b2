package org.metricshub.tcldoc.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class TokenReplayTest {

	@Test
	public void testReplayInOrderThenEof() {
		Token a = new Token(TokenType.WORD, "a", 0, 1, 3);
		Token ws = new Token(TokenType.WS, " ", 1, 2, 3);
		Token b = new Token(TokenType.WORD, "b", 2, 3, 4);
		TokenReplay replay = new TokenReplay(Arrays.asList(a, ws, b), "replay.tcl", 0);

		assertEquals(3, replay.lineNumber());
		assertSame(a, replay.nextToken());
		assertSame(ws, replay.nextToken());
		assertEquals(4, replay.lineNumber());
		assertSame(b, replay.nextToken());
		assertTrue(replay.isEOF());

		Token eof = replay.nextToken();
		assertTrue(eof.isEof());
		assertEquals(3, eof.getStart());
		assertEquals(4, eof.getLineNumber());
		assertEquals("replay.tcl", replay.getDescription());
	}

	@Test
	public void testEmptyReplay() {
		TokenReplay replay = new TokenReplay(Collections.<Token>emptyList(), "empty.tcl", 0);
		assertTrue(replay.isEOF());
		assertTrue(replay.nextToken().isEof());
		assertEquals(-1, replay.lineNumber());
	}
}
