package org.metricshub.tcldoc.frontend;

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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed construct of a Tcl script.
 * <p>
 * Children are kept in source order and whitespace is preserved, so that
 * concatenating the prefix of the node's {@link NodeKind}, the reconstruction of
 * every child and the suffix gives back exactly the text the node was built
 * from. Nodes other than the root script also remember the delimiter tokens that
 * opened and closed them, so that their content can be flattened back into the
 * original token stream.
 */
public final class ParseNode implements ParseElement {

	private final NodeKind kind;
	private final List<ParseElement> children = new ArrayList<ParseElement>();
	private Token prefixToken;
	private Token suffixToken;

	/**
	 * <p>
	 * Constructor for ParseNode.
	 * </p>
	 *
	 * @param kind construct this node represents
	 * @param prefixToken token that opened the construct, or {@code null}
	 */
	ParseNode(NodeKind kind, Token prefixToken) {
		this.kind = kind;
		this.prefixToken = prefixToken;
	}

	public NodeKind getKind() {
		return kind;
	}

	public boolean is(NodeKind k) {
		return kind == k;
	}

	/**
	 * @return the children of this node, read-only
	 */
	public List<ParseElement> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public boolean isEmpty() {
		return children.isEmpty();
	}

	/**
	 * @return the token that opened this node, or {@code null}
	 */
	public Token getPrefixToken() {
		return prefixToken;
	}

	/**
	 * @return the token that closed this node, or {@code null}
	 */
	public Token getSuffixToken() {
		return suffixToken;
	}

	void setSuffixToken(Token suffixToken) {
		this.suffixToken = suffixToken;
	}

	void add(ParseElement child) {
		children.add(child);
	}

	void set(int index, ParseElement child) {
		children.set(index, child);
	}

	/**
	 * Replaces all children with a single embedded script.
	 */
	void embed(ParseNode script) {
		children.clear();
		children.add(script);
	}

	/**
	 * @return the embedded script this node was re-parsed into, or {@code null}
	 */
	public ParseNode getEmbeddedScript() {
		if (children.size() == 1 && children.get(0) instanceof ParseNode) {
			ParseNode only = (ParseNode) children.get(0);
			if (only.kind == NodeKind.SCRIPT) {
				return only;
			}
		}
		return null;
	}

	/**
	 * Returns the nodes among the children of this node, in order.
	 *
	 * @param k kind of the nodes wanted, or {@code null} for any kind
	 * @return the matching child nodes
	 */
	public List<ParseNode> getChildNodes(NodeKind k) {
		List<ParseNode> nodes = new ArrayList<ParseNode>();
		for (ParseElement child : children) {
			if (child instanceof ParseNode && (k == null || ((ParseNode) child).kind == k)) {
				nodes.add((ParseNode) child);
			}
		}
		return nodes;
	}

	/**
	 * Returns the words of a command: every child except whitespace, end of line,
	 * the terminating semicolon and comments.
	 *
	 * @return the significant children, in order
	 */
	public List<ParseElement> getWords() {
		List<ParseElement> words = new ArrayList<ParseElement>();
		for (ParseElement child : children) {
			if (child instanceof Token) {
				TokenType type = ((Token) child).getType();
				if (type == TokenType.WS || type == TokenType.EOL || type == TokenType.SEMICOLON) {
					continue;
				}
			} else if (((ParseNode) child).kind == NodeKind.COMMENT) {
				continue;
			}
			words.add(child);
		}
		return words;
	}

	/**
	 * Reconstructs the text that was parsed to create this node.
	 *
	 * @return the exact source text of this node
	 */
	public String reconstruct() {
		StringBuilder out = new StringBuilder();
		reconstruct(out);
		return out.toString();
	}

	/** {@inheritDoc} */
	@Override
	public void reconstruct(StringBuilder out) {
		out.append(kind.getPrefix());
		for (ParseElement child : children) {
			child.reconstruct(out);
		}
		out.append(kind.getSuffix());
	}

	/** {@inheritDoc} */
	@Override
	public void flatten(List<Token> out) {
		if (prefixToken != null) {
			out.add(prefixToken);
		}
		for (ParseElement child : children) {
			child.flatten(out);
		}
		if (suffixToken != null) {
			out.add(suffixToken);
		}
	}

	/**
	 * Returns the tokens of the content of this node. The delimiters of this node
	 * are not included, those of its descendants are.
	 *
	 * @return the flattened content tokens
	 */
	public List<Token> tokenStream() {
		List<Token> stream = new ArrayList<Token>();
		for (ParseElement child : children) {
			child.flatten(stream);
		}
		return stream;
	}

	/**
	 * Prints an indented outline of this node and its descendants.
	 *
	 * @param ps destination stream
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int indent) {
		StringBuilder pad = new StringBuilder();
		for (int i = 0; i < indent; i++) {
			pad.append("  ");
		}
		ps.println(pad + kind.getDisplayName());
		for (ParseElement child : children) {
			if (child instanceof ParseNode) {
				((ParseNode) child).dump(ps, indent + 1);
			} else {
				ps.println(pad + "  " + child);
			}
		}
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return kind.getDisplayName() + children;
	}
}
