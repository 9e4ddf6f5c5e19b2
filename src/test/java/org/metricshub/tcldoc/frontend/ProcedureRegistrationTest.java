package org.metricshub.tcldoc.frontend;

import static org.junit.Assert.*;
import static org.metricshub.tcldoc.TclTestSupport.command;
import static org.metricshub.tcldoc.TclTestSupport.parse;

import org.junit.Before;
import org.junit.Test;
import org.metricshub.tcldoc.index.ProcedureIndex;

public class ProcedureRegistrationTest {

	private ProcedureIndex index;

	@Before
	public void setUp() {
		index = new ProcedureIndex();
	}

	private static Token nameToken(ParseNode script, int commandIndex) {
		return (Token) command(script, commandIndex).getWords().get(1);
	}

	@Test
	public void testProcIsRegisteredAndTagged() {
		ParseNode script = parse("proc foo {a b} {return $a}\n", index, "a.tcl");
		assertEquals(1, index.size());
		assertEquals("a.tcl", index.getDefinitions("foo").get(0).getTitle());
		assertEquals("foo", nameToken(script, 0).getTag());
		assertEquals("proc foo {a b} {return $a}\n", script.reconstruct());
	}

	@Test
	public void testSecondDefinitionAcrossFiles() {
		parse("proc foo {a b} {return $a}\n", index, "a.tcl");
		ParseNode second = parse("proc foo {} {}\n", index, "b.tcl");
		assertEquals(2, index.getDefinitions("foo").size());
		assertEquals("b.tcl", index.getDefinitions("foo").get(1).getTitle());
		assertEquals("foo_2", nameToken(second, 0).getTag());
	}

	@Test
	public void testSecondDefinitionInSameFile() {
		ParseNode script = parse("proc foo {} {}\nproc foo {} {}\n", index, "same.tcl");
		assertEquals("foo", nameToken(script, 0).getTag());
		assertEquals("foo_2", nameToken(script, 1).getTag());
	}

	@Test
	public void testWrongArityIsIgnored() {
		ParseNode script = parse("proc foo {}\nproc bar {} {} extra\n", index, "arity.tcl");
		assertTrue(index.isEmpty());
		assertFalse(nameToken(script, 0).isTagged());
	}

	@Test
	public void testComputedNameIsIgnored() {
		parse("proc [name] {} {}\nproc $n {} {}\nproc {braced} {} {}\n", index, "computed.tcl");
		assertTrue(index.isEmpty());
	}

	@Test
	public void testProcMustBeFirstWord() {
		parse("puts proc foo {}\n", index, "first.tcl");
		assertTrue(index.isEmpty());
	}

	@Test
	public void testTrailingCommentDoesNotCount() {
		parse("proc foo {} {} ;# helper\n", index, "comment.tcl");
		assertEquals(1, index.getDefinitions("foo").size());
	}

	@Test
	public void testProcOnContinuedLines() {
		ParseNode script = parse("proc foo \\\n  {x} \\\n  {return $x}\n", index, "cont.tcl");
		assertEquals("foo", nameToken(script, 0).getTag());
		assertEquals("proc foo \\\n  {x} \\\n  {return $x}\n", script.reconstruct());
	}

	@Test
	public void testProcInsideGroupIsNotIndexed() {
		// braces defer evaluation, their content is not parsed as commands
		parse("namespace eval ns {\n  proc inner {} {}\n}\n", index, "ns.tcl");
		assertTrue(index.isEmpty());
	}
}
