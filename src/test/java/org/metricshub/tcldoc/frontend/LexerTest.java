package org.metricshub.tcldoc.frontend;

import static org.junit.Assert.*;
import static org.metricshub.tcldoc.TclTestSupport.lex;
import static org.metricshub.tcldoc.TclTestSupport.texts;
import static org.metricshub.tcldoc.TclTestSupport.types;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class LexerTest {

	@Test
	public void testSimpleCommand() {
		List<Token> tokens = lex("set x 1\n");
		assertEquals(
				Arrays
						.asList(
								TokenType.WORD,
								TokenType.WS,
								TokenType.WORD,
								TokenType.WS,
								TokenType.WORD,
								TokenType.EOL),
				types(tokens));
		assertEquals(Arrays.asList("set", " ", "x", " ", "1", "\n"), texts(tokens));
	}

	@Test
	public void testOffsets() {
		List<Token> tokens = lex("puts  hello");
		assertEquals(0, tokens.get(0).getStart());
		assertEquals(4, tokens.get(0).getEnd());
		assertEquals(4, tokens.get(1).getStart());
		assertEquals(6, tokens.get(1).getEnd());
		assertEquals(6, tokens.get(2).getStart());
		assertEquals(11, tokens.get(2).getEnd());
	}

	@Test
	public void testBlankLinesCollapseIntoOneEndOfLine() {
		List<Token> tokens = lex("a\n\n  \t\nb");
		assertEquals(Arrays.asList(TokenType.WORD, TokenType.EOL, TokenType.WORD), types(tokens));
		assertEquals("\n\n  \t\n", tokens.get(1).getText());
	}

	@Test
	public void testReservedCharactersAreSingleTokens() {
		List<Token> tokens = lex("{}#$\"[];");
		assertEquals(
				Arrays
						.asList(
								TokenType.OPEN_BRACE,
								TokenType.CLOSE_BRACE,
								TokenType.HASH,
								TokenType.DOLLAR,
								TokenType.QUOTE,
								TokenType.OPEN_BRACKET,
								TokenType.CLOSE_BRACKET,
								TokenType.SEMICOLON),
				types(tokens));
		for (Token token : tokens) {
			assertTrue(token.getType() + " must be a literal", token.getType().isLiteral());
			assertEquals(String.valueOf(token.getType().getLiteral()), token.getText());
		}
	}

	@Test
	public void testBackslashKeepsNextCharacterInWord() {
		assertEquals(Arrays.asList("a\\ b"), texts(lex("a\\ b")));
		assertEquals(Arrays.asList("x\\[y\\]"), texts(lex("x\\[y\\]")));
		assertEquals(Arrays.asList("\\$x", " ", "\\{"), texts(lex("\\$x \\{")));
	}

	@Test
	public void testWordStopsAtReservedCharacter() {
		assertEquals(Arrays.asList("a", "$", "b(i)"), texts(lex("a$b(i)")));
		assertEquals(Arrays.asList("foo", "[", "bar", "]"), texts(lex("foo[bar]")));
		assertEquals(Arrays.asList("a", ";", "b"), texts(lex("a;b")));
	}

	@Test
	public void testTrailingBackslashIsIllegal() {
		LexerException e = assertThrows(
				"A backslash with nothing to escape must throw",
				LexerException.class,
				() -> lex("puts \\"));
		assertEquals(1, e.getLineNumber());
		assertEquals("test.tcl", e.getSourceDescription());
		assertTrue(e.getMessage(), e.getMessage().startsWith("Illegal character on line 1"));
	}

	@Test
	public void testUnnormalizedEscapedNewlineIsIllegal() {
		assertThrows(
				"A raw escaped newline must have been normalized before lexing",
				LexerException.class,
				() -> lex("a \\\nb"));
	}

	@Test
	public void testForLiteral() {
		assertEquals(TokenType.OPEN_BRACE, TokenType.forLiteral('{'));
		assertEquals(TokenType.SEMICOLON, TokenType.forLiteral(';'));
		assertNull(TokenType.forLiteral('a'));
		assertFalse(TokenType.WORD.isLiteral());
	}
}
