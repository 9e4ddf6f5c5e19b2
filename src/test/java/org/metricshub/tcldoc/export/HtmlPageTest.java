package org.metricshub.tcldoc.export;

import static org.junit.Assert.*;

import org.junit.Test;

public class HtmlPageTest {

	@Test
	public void testScriptPage() {
		HtmlPage page = new HtmlPage("sub/b.tcl", "../", "tclcode.css")
				.withIndex(DocNode.element("div", "index"))
				.withContent(DocNode.element("span", "Script").append("puts hi\n"));
		String html = page.render();
		assertTrue(html, html.startsWith("<!DOCTYPE html>\n<html><head>"));
		assertTrue(html, html.contains("<title>sub/b.tcl</title>"));
		assertTrue(html, html.contains("<base href=\"../\">"));
		assertTrue(html, html.contains("<link rel=\"stylesheet\" href=\"tclcode.css\">"));
		assertTrue(
				html,
				html
						.contains(
								"<body><h1>sub/b.tcl</h1><div class=\"index\"></div>"
										+ "<div id=\"content\"><span class=\"Script\">puts hi\n</span></div></body>"));
	}

	@Test
	public void testMasterIndexPage() {
		DocNode.Element document = new HtmlPage("Command Index", null, "tclcode.css")
				.withIndex(DocNode.element("div", "index"))
				.toDocument();
		String html = HtmlSerializer.serialize(document);
		assertFalse("no base without a base URL", html.contains("<base"));
		assertNull("no content section", document.findById("content"));
		assertTrue(html, html.contains("<h1>Command Index</h1>"));
	}

	@Test
	public void testTitleIsEscaped() {
		String html = new HtmlPage("a&b", "", null).render();
		assertTrue(html, html.contains("<title>a&amp;b</title>"));
		assertFalse(html, html.contains("<link"));
	}
}
