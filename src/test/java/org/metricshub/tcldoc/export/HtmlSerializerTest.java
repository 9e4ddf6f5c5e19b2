package org.metricshub.tcldoc.export;

import static org.junit.Assert.*;

import org.junit.Test;

public class HtmlSerializerTest {

	@Test
	public void testTextIsEscaped() {
		assertEquals("a &lt;b&gt; &amp; \"c\"", HtmlSerializer.serialize(DocNode.text("a <b> & \"c\"")));
	}

	@Test
	public void testAttributesAreEscaped() {
		DocNode.Element a = DocNode.element("a").attribute("href", "x.html#\"q\"&r").append("link");
		assertEquals("<a href=\"x.html#&quot;q&quot;&amp;r\">link</a>", HtmlSerializer.serialize(a));
	}

	@Test
	public void testEntity() {
		assertEquals("&nbsp;", HtmlSerializer.serialize(DocNode.entity("nbsp")));
	}

	@Test
	public void testAttributeOrderIsKept() {
		DocNode.Element span = DocNode.element("span", "tagged").attribute("id", "foo");
		assertEquals("<span class=\"tagged\" id=\"foo\"></span>", HtmlSerializer.serialize(span));
	}

	@Test
	public void testVoidElements() {
		DocNode.Element head = DocNode.element("head").append(DocNode.element("base").attribute("href", "../"));
		assertEquals("<head><base href=\"../\"></head>", HtmlSerializer.serialize(head));
	}

	@Test
	public void testNesting() {
		DocNode.Element div = DocNode.element("div").append(DocNode.element("p").append("1"), DocNode.text("2"));
		assertEquals("<div><p>1</p>2</div>", HtmlSerializer.serialize(div));
		assertEquals("12", div.getTextContent());
	}

	@Test
	public void testSerializeToAppendable() throws Exception {
		StringBuilder out = new StringBuilder("x");
		HtmlSerializer.serialize(DocNode.element("b").append("y"), out);
		assertEquals("x<b>y</b>", out.toString());
	}
}
