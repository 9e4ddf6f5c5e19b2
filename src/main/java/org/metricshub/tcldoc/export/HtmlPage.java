package org.metricshub.tcldoc.export;

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

/**
 * The chrome around generated documentation: a complete HTML page with a
 * title, an optional base URL, a stylesheet link, a heading, an optional index
 * and an optional content section.
 */
public class HtmlPage {

	private final String title;
	private final String baseHref;
	private final String stylesheet;
	private DocNode index;
	private DocNode content;

	/**
	 * <p>
	 * Constructor for HtmlPage.
	 * </p>
	 *
	 * @param title page title and heading
	 * @param baseHref base URL of relative links, or {@code null}/empty for none
	 * @param stylesheet stylesheet path, relative to the base URL
	 */
	public HtmlPage(String title, String baseHref, String stylesheet) {
		this.title = title;
		this.baseHref = baseHref;
		this.stylesheet = stylesheet;
	}

	/**
	 * @param index index shown under the heading
	 * @return this page
	 */
	public HtmlPage withIndex(DocNode index) {
		this.index = index;
		return this;
	}

	/**
	 * @param content node placed in the <code>div id="content"</code> section
	 * @return this page
	 */
	public HtmlPage withContent(DocNode content) {
		this.content = content;
		return this;
	}

	/**
	 * @return the <code>html</code> element of the page
	 */
	public DocNode.Element toDocument() {
		DocNode.Element head = DocNode.element("head");
		head.append(DocNode.element("meta").attribute("charset", "UTF-8"));
		head.append(DocNode.element("title").append(title));
		if (baseHref != null && !baseHref.isEmpty()) {
			head.append(DocNode.element("base").attribute("href", baseHref));
		}
		if (stylesheet != null) {
			head.append(DocNode.element("link").attribute("rel", "stylesheet").attribute("href", stylesheet));
		}

		DocNode.Element body = DocNode.element("body");
		body.append(DocNode.element("h1").append(title));
		if (index != null) {
			body.append(index);
		}
		if (content != null) {
			body.append(DocNode.element("div").attribute("id", "content").append(content));
		}
		return DocNode.element("html").append(head, body);
	}

	/**
	 * @return the page as HTML text
	 */
	public String render() {
		return "<!DOCTYPE html>\n" + HtmlSerializer.serialize(toDocument()) + "\n";
	}
}
