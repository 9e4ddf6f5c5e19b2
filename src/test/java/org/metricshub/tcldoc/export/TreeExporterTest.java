package org.metricshub.tcldoc.export;

import static org.junit.Assert.*;
import static org.metricshub.tcldoc.TclTestSupport.parse;

import org.junit.Test;
import org.metricshub.tcldoc.frontend.ParseNode;
import org.metricshub.tcldoc.index.ProcedureIndex;

public class TreeExporterTest {

	@Test
	public void testSimpleCommand() {
		DocNode.Element exported = TreeExporter.export(parse("set x 1\n"));
		assertEquals(
				"<span class=\"Script\"><span class=\"Command\">set x 1\n</span></span>",
				HtmlSerializer.serialize(exported));
	}

	@Test
	public void testDelimitersAreKept() {
		ParseNode script = parse("puts \"a $b\" {c} [d] ${e}\n");
		String html = HtmlSerializer.serialize(TreeExporter.export(script));
		assertTrue(html, html.contains("<span class=\"Quoted\">\"a <span class=\"Variable\">$b</span>\"</span>"));
		assertTrue(html, html.contains("<span class=\"Group\">{c}</span>"));
		assertTrue(
				html,
				html.contains("<span class=\"Substitution\">[<span class=\"Script\"><span class=\"Command\">d</span></span>]</span>"));
		assertTrue(html, html.contains("<span class=\"Variable\">${e}</span>"));
	}

	@Test
	public void testTextContentIsTheSource() {
		String text = "# note\nproc f {a} {\n  return [expr {$a * 2}]\n}\n";
		ParseNode script = parse(text);
		assertEquals(text, TreeExporter.export(script).getTextContent());
	}

	@Test
	public void testComment() {
		String html = HtmlSerializer.serialize(TreeExporter.export(parse("# a < b\n")));
		assertTrue(html, html.contains("<span class=\"Comment\"># a &lt; b\n</span>"));
	}

	@Test
	public void testTaggedProcedureName() {
		ProcedureIndex index = new ProcedureIndex();
		parse("proc foo {} {}\n", index, "a.tcl");
		DocNode.Element exported = TreeExporter.export(parse("proc foo {} {}\n", index, "b.tcl"));
		DocNode.Element anchor = exported.findById("foo_2");
		assertNotNull(anchor);
		assertEquals("span", anchor.getTag());
		assertEquals(TreeExporter.TAGGED_CLASS, anchor.getAttribute("class"));
		assertEquals("foo", anchor.getTextContent());
	}

	@Test
	public void testMalformedSubstitutionIsExportedFlat() {
		String html = HtmlSerializer.serialize(TreeExporter.export(parse("puts [a \"b]\n")));
		assertTrue(html, html.contains("<span class=\"Substitution\">[a \"b]</span>"));
	}

	@Test
	public void testExportIntoContainer() {
		DocNode.Element content = DocNode.element("div").attribute("id", "content");
		TreeExporter.export(parse("x\n"), content);
		assertEquals(1, content.getChildren().size());
		assertEquals("x\n", content.getTextContent());
	}
}
