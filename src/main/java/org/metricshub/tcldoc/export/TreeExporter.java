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

import org.metricshub.tcldoc.frontend.NodeKind;
import org.metricshub.tcldoc.frontend.ParseElement;
import org.metricshub.tcldoc.frontend.ParseNode;
import org.metricshub.tcldoc.frontend.Token;

/**
 * Renders a parse tree as a structural document.
 * <p>
 * Each node becomes a <code>span</code> whose class is the display name of its
 * {@link NodeKind}, holding the node's prefix, its children in order and its
 * suffix. Tokens become plain text, except tagged procedure names which become
 * a <code>span class="tagged"</code> with the tag as id, so that index links can
 * point at them.
 */
public final class TreeExporter {

	/** CSS class of the anchor spans around defined procedure names. */
	public static final String TAGGED_CLASS = "tagged";

	/**
	 * Private constructor to prevent instantiation.
	 */
	private TreeExporter() {
		// utility class
	}

	/**
	 * @param node root of the tree to export
	 * @return the <code>span</code> element representing {@code node}
	 */
	public static DocNode.Element export(ParseNode node) {
		NodeKind kind = node.getKind();
		DocNode.Element content = DocNode.element("span", kind.getDisplayName());
		if (!kind.getPrefix().isEmpty()) {
			content.append(kind.getPrefix());
		}
		for (ParseElement child : node.getChildren()) {
			if (child instanceof ParseNode) {
				content.append(export((ParseNode) child));
			} else {
				Token token = (Token) child;
				if (token.isTagged()) {
					content
							.append(
									DocNode
											.element("span", TAGGED_CLASS)
											.attribute("id", token.getTag())
											.append(token.getText()));
				} else {
					content.append(token.getText());
				}
			}
		}
		if (!kind.getSuffix().isEmpty()) {
			content.append(kind.getSuffix());
		}
		return content;
	}

	/**
	 * Appends the export of {@code node} to {@code container}.
	 *
	 * @param node root of the tree to export
	 * @param container element receiving the export
	 */
	public static void export(ParseNode node, DocNode.Element container) {
		container.append(export(node));
	}
}
