package org.metricshub.tcldoc.frontend;

import static org.junit.Assert.*;
import static org.metricshub.tcldoc.TclTestSupport.command;
import static org.metricshub.tcldoc.TclTestSupport.describeWords;
import static org.metricshub.tcldoc.TclTestSupport.find;
import static org.metricshub.tcldoc.TclTestSupport.parse;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.tcldoc.index.ProcedureIndex;

public class EmbeddedScriptTest {

	@Test
	public void testSubstitutionIsReparsed() {
		ParseNode script = parse("set y [expr {1+$x}]\n");
		ParseNode substitution = find(script, NodeKind.SUBSTITUTION);
		ParseNode embedded = substitution.getEmbeddedScript();
		assertNotNull("the substitution must expose its structure", embedded);
		assertEquals(1, embedded.getChildren().size());
		assertEquals(Arrays.asList("expr", "Group"), describeWords(command(embedded, 0)));
		assertEquals("set y [expr {1+$x}]\n", script.reconstruct());
	}

	@Test
	public void testNestedSubstitutions() {
		ParseNode script = parse("set a [lindex [list 1 2] 0]\n");
		ParseNode outer = find(script, NodeKind.SUBSTITUTION).getEmbeddedScript();
		assertNotNull(outer);
		ParseNode outerCommand = command(outer, 0);
		assertEquals(Arrays.asList("lindex", "Substitution", "0"), describeWords(outerCommand));
		ParseNode inner = outerCommand.getChildNodes(NodeKind.SUBSTITUTION).get(0);
		assertNotNull(inner.getEmbeddedScript());
		assertEquals(Arrays.asList("list", "1", "2"), describeWords(command(inner.getEmbeddedScript(), 0)));
		assertEquals("set a [lindex [list 1 2] 0]\n", script.reconstruct());
	}

	@Test
	public void testVariablesAndQuotesInsideSubstitution() {
		ParseNode script = parse("puts [format \"%s\" $name]\n");
		ParseNode embedded = find(script, NodeKind.SUBSTITUTION).getEmbeddedScript();
		assertNotNull(embedded);
		assertEquals(Arrays.asList("format", "Quoted", "Variable"), describeWords(command(embedded, 0)));
	}

	@Test
	public void testMalformedSubstitutionStaysFlat() {
		String text = "puts [puts \"abc]\nputs ok\n";
		ParseNode script = parse(text);
		assertEquals("the outer parse goes on", 2, script.getChildren().size());
		ParseNode substitution = find(script, NodeKind.SUBSTITUTION);
		assertNull(substitution.getEmbeddedScript());
		assertTrue(substitution.getChildren().get(0) instanceof Token);
		assertEquals(text, script.reconstruct());
	}

	@Test
	public void testEmptySubstitution() {
		ParseNode script = parse("set a []\n");
		ParseNode embedded = find(script, NodeKind.SUBSTITUTION).getEmbeddedScript();
		assertNotNull(embedded);
		assertTrue(embedded.isEmpty());
		assertEquals("set a []\n", script.reconstruct());
	}

	@Test
	public void testEmbeddedLineNumbersFollowTheSource() {
		ParseNode script = parse("\n\nset a [b \\\n c]\n");
		ParseNode embedded = find(script, NodeKind.SUBSTITUTION).getEmbeddedScript();
		Token c = (Token) command(embedded, 0).getWords().get(1);
		assertEquals("c", c.getText());
		assertEquals(4, c.getLineNumber());
	}

	@Test
	public void testProcedureInsideSubstitutionIsIndexedOnce() {
		ProcedureIndex index = new ProcedureIndex();
		ParseNode script = parse("eval [list [proc helper {} {return 1}]]\n", index, "embed.tcl");
		assertEquals(1, index.getDefinitions("helper").size());
		ParseNode proc = find(find(script, NodeKind.SUBSTITUTION).getEmbeddedScript(), NodeKind.SUBSTITUTION)
				.getEmbeddedScript();
		Token name = (Token) command(proc, 0).getWords().get(1);
		assertEquals("helper", name.getTag());
	}

	private static String nest(int depth, String innermost, String suffix) {
		String text = innermost;
		for (int i = 0; i < depth; i++) {
			text = "[a " + text + suffix + "]";
		}
		return "set x " + text + "\n";
	}

	@Test(timeout = 10000)
	public void testDeeplyNestedSubstitutions() {
		String text = nest(40, "b", "");
		ParseNode script = parse(text);
		ParseNode substitution = find(script, NodeKind.SUBSTITUTION);
		for (int level = 1; level < 40; level++) {
			ParseNode embedded = substitution.getEmbeddedScript();
			assertNotNull("level " + level, embedded);
			assertEquals(Arrays.asList("a", "Substitution"), describeWords(command(embedded, 0)));
			substitution = find(embedded, NodeKind.SUBSTITUTION);
		}
		assertEquals(Arrays.asList("a", "b"), describeWords(command(substitution.getEmbeddedScript(), 0)));
		assertEquals(text, script.reconstruct());
	}

	@Test(timeout = 10000)
	public void testDeeplyNestedMalformedSubstitutions() {
		// each level ends with an unterminated quote once re-parsed
		String text = nest(40, "b", " \"");
		ParseNode script = parse(text);
		ParseNode substitution = find(script, NodeKind.SUBSTITUTION);
		assertNull(substitution.getEmbeddedScript());
		assertEquals(1, substitution.getChildNodes(NodeKind.SUBSTITUTION).size());
		assertEquals(text, script.reconstruct());
	}

	@Test
	public void testProcedureInMalformedSubstitutionIsNotIndexed() {
		ProcedureIndex index = new ProcedureIndex();
		ParseNode script = parse("set x [proc foo {} {}; puts \"a]\nproc foo {} {}\n", index, "f.tcl");
		assertNull(find(script, NodeKind.SUBSTITUTION).getEmbeddedScript());
		assertEquals(1, index.getDefinitions("foo").size());
		Token name = (Token) command(script, 1).getWords().get(1);
		assertEquals("foo", name.getTag());
	}

	@Test
	public void testProcedureInNestedSubstitutionSurvivesMalformedEnclosingOne() {
		ProcedureIndex index = new ProcedureIndex();
		ParseNode script = parse("set x [a [proc bar {} {}] \"]\n", index, "g.tcl");
		ParseNode outer = find(script, NodeKind.SUBSTITUTION);
		assertNull(outer.getEmbeddedScript());
		ParseNode inner = outer.getChildNodes(NodeKind.SUBSTITUTION).get(0);
		Token name = (Token) command(inner.getEmbeddedScript(), 0).getWords().get(1);
		assertEquals("bar", name.getTag());
		assertEquals(1, index.getDefinitions("bar").size());
	}
}
