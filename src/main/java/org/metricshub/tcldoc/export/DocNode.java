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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the structural document produced from parse trees and from the
 * procedure index, ready to be serialized by {@link HtmlSerializer}.
 * <p>
 * Three kinds of nodes exist: literal text, named character entities, and
 * elements with attributes and children.
 */
public abstract class DocNode {

	DocNode() {}

	/**
	 * @param text literal text, escaped on output
	 * @return a text node
	 */
	public static Text text(String text) {
		return new Text(text);
	}

	/**
	 * @param name entity name without <code>&amp;</code> and <code>;</code>
	 * @return an entity node
	 */
	public static Entity entity(String name) {
		return new Entity(name);
	}

	/**
	 * @param tag element name
	 * @return an element without attributes nor children
	 */
	public static Element element(String tag) {
		return new Element(tag);
	}

	/**
	 * @param tag element name
	 * @param className value of the {@code class} attribute
	 * @return an element carrying a CSS class
	 */
	public static Element element(String tag, String className) {
		return new Element(tag).attribute("class", className);
	}

	/**
	 * Appends the text this node displays, entities excluded.
	 *
	 * @param out destination buffer
	 */
	abstract void appendTextContent(StringBuilder out);

	/**
	 * @return the text this node displays, entities excluded
	 */
	public String getTextContent() {
		StringBuilder out = new StringBuilder();
		appendTextContent(out);
		return out.toString();
	}

	/**
	 * Literal text.
	 */
	public static final class Text extends DocNode {

		private final String text;

		Text(String text) {
			this.text = text;
		}

		public String getText() {
			return text;
		}

		@Override
		void appendTextContent(StringBuilder out) {
			out.append(text);
		}

		@Override
		public String toString() {
			return "\"" + text + "\"";
		}
	}

	/**
	 * A named character entity such as <code>&amp;nbsp;</code>.
	 */
	public static final class Entity extends DocNode {

		private final String name;

		Entity(String name) {
			this.name = name;
		}

		public String getName() {
			return name;
		}

		@Override
		void appendTextContent(StringBuilder out) {
			// entities are decoration only
		}

		@Override
		public String toString() {
			return "&" + name + ";";
		}
	}

	/**
	 * An element with ordered attributes and children.
	 */
	public static final class Element extends DocNode {

		private final String tag;
		private final Map<String, String> attributes = new LinkedHashMap<String, String>();
		private final List<DocNode> children = new ArrayList<DocNode>();

		Element(String tag) {
			this.tag = tag;
		}

		public String getTag() {
			return tag;
		}

		/**
		 * @param name attribute name
		 * @return the attribute value, or {@code null} if absent
		 */
		public String getAttribute(String name) {
			return attributes.get(name);
		}

		public Map<String, String> getAttributes() {
			return Collections.unmodifiableMap(attributes);
		}

		public List<DocNode> getChildren() {
			return Collections.unmodifiableList(children);
		}

		/**
		 * Sets an attribute, replacing any previous value.
		 *
		 * @param name attribute name
		 * @param value attribute value
		 * @return this element
		 */
		public Element attribute(String name, String value) {
			attributes.put(name, value);
			return this;
		}

		/**
		 * @param nodes children to append, in order
		 * @return this element
		 */
		public Element append(DocNode... nodes) {
			Collections.addAll(children, nodes);
			return this;
		}

		/**
		 * @param text text to append as a child
		 * @return this element
		 */
		public Element append(String text) {
			children.add(new Text(text));
			return this;
		}

		/**
		 * Finds the first descendant element, this one included, with the given id.
		 *
		 * @param id value of the {@code id} attribute
		 * @return the element, or {@code null}
		 */
		public Element findById(String id) {
			if (id.equals(attributes.get("id"))) {
				return this;
			}
			for (DocNode child : children) {
				if (child instanceof Element) {
					Element found = ((Element) child).findById(id);
					if (found != null) {
						return found;
					}
				}
			}
			return null;
		}

		@Override
		void appendTextContent(StringBuilder out) {
			for (DocNode child : children) {
				child.appendTextContent(out);
			}
		}

		@Override
		public String toString() {
			return tag + attributes + children;
		}
	}
}
