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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Set;

/**
 * Writes a structural document as HTML text.
 * <p>
 * Text is escaped, so that <code>&lt;</code>, <code>&gt;</code> and
 * <code>&amp;</code> in scripts display literally; attribute values additionally
 * escape double quotes.
 */
public final class HtmlSerializer {

	private static final Set<String> VOID_ELEMENTS = Set.of("base", "br", "link", "meta");

	private final Appendable out;

	private HtmlSerializer(Appendable out) {
		this.out = out;
	}

	/**
	 * @param node node to serialize
	 * @return the HTML text of {@code node}
	 */
	public static String serialize(DocNode node) {
		StringBuilder sb = new StringBuilder();
		try {
			serialize(node, sb);
		} catch (IOException e) {
			// StringBuilder does not throw
			throw new UncheckedIOException(e);
		}
		return sb.toString();
	}

	/**
	 * @param node node to serialize
	 * @param out destination
	 * @throws IOException if writing to {@code out} fails
	 */
	public static void serialize(DocNode node, Appendable out) throws IOException {
		new HtmlSerializer(out).serializeNode(node);
	}

	private void serializeNode(DocNode node) throws IOException {
		if (node instanceof DocNode.Text) {
			escape(((DocNode.Text) node).getText(), false);
		} else if (node instanceof DocNode.Entity) {
			out.append('&').append(((DocNode.Entity) node).getName()).append(';');
		} else {
			DocNode.Element element = (DocNode.Element) node;
			out.append('<').append(element.getTag());
			for (Map.Entry<String, String> attribute : element.getAttributes().entrySet()) {
				out.append(' ').append(attribute.getKey()).append("=\"");
				escape(attribute.getValue(), true);
				out.append('"');
			}
			out.append('>');
			if (VOID_ELEMENTS.contains(element.getTag())) {
				return;
			}
			for (DocNode child : element.getChildren()) {
				serializeNode(child);
			}
			out.append("</").append(element.getTag()).append('>');
		}
	}

	private void escape(String text, boolean attribute) throws IOException {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
			case '<':
				out.append("&lt;");
				break;
			case '>':
				out.append("&gt;");
				break;
			case '&':
				out.append("&amp;");
				break;
			case '"':
				out.append(attribute ? "&quot;" : "\"");
				break;
			default:
				out.append(c);
				break;
			}
		}
	}
}
