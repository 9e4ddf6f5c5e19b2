package org.metricshub.tcldoc;

import java.util.ArrayList;
import java.util.List;
import org.metricshub.tcldoc.frontend.Lexer;
import org.metricshub.tcldoc.frontend.NodeKind;
import org.metricshub.tcldoc.frontend.ParseElement;
import org.metricshub.tcldoc.frontend.ParseNode;
import org.metricshub.tcldoc.frontend.SourceFile;
import org.metricshub.tcldoc.frontend.TclParser;
import org.metricshub.tcldoc.frontend.Token;
import org.metricshub.tcldoc.frontend.TokenType;
import org.metricshub.tcldoc.index.ProcedureIndex;

/**
 * Reusable helpers for parsing Tcl text held in memory and inspecting the
 * resulting tokens and trees, so that tests do not have to go through files.
 */
public final class TclTestSupport {

	/** Title given to scripts parsed without an explicit one. */
	public static final String TITLE = "test.tcl";

	private TclTestSupport() {}

	/**
	 * Parses a script against a fresh procedure index.
	 *
	 * @param text script text
	 * @return root of the parse tree
	 */
	public static ParseNode parse(String text) {
		return parse(text, new ProcedureIndex(), TITLE);
	}

	/**
	 * Parses a script against the given procedure index.
	 *
	 * @param text script text
	 * @param index run-wide procedure index
	 * @param title title of the script
	 * @return root of the parse tree
	 */
	public static ParseNode parse(String text, ProcedureIndex index, String title) {
		return parse(text, index, title, TclParser.DEFAULT_MAX_DEPTH);
	}

	/**
	 * Parses a script with a custom nesting limit.
	 *
	 * @param text script text
	 * @param index run-wide procedure index
	 * @param title title of the script
	 * @param maxDepth nesting limit
	 * @return root of the parse tree
	 */
	public static ParseNode parse(String text, ProcedureIndex index, String title, int maxDepth) {
		return new TclParser(new SourceFile(text, title, 0), index, 0, maxDepth).parse();
	}

	/**
	 * Lexes text that needs no normalization, every token on line 1.
	 *
	 * @param text text without escaped newlines
	 * @return all the tokens
	 */
	public static List<Token> lex(String text) {
		Lexer lexer = new Lexer(text, TITLE, offset -> 1);
		List<Token> tokens = new ArrayList<Token>();
		Token token;
		while ((token = lexer.next()) != null) {
			tokens.add(token);
		}
		return tokens;
	}

	/**
	 * Reads all the tokens of a file, EOF sentinel excluded.
	 *
	 * @param file source file
	 * @return the tokens with restored text and original line numbers
	 */
	public static List<Token> tokens(SourceFile file) {
		List<Token> tokens = new ArrayList<Token>();
		Token token;
		while (!(token = file.nextToken()).isEof()) {
			tokens.add(token);
		}
		return tokens;
	}

	/**
	 * @param tokens tokens
	 * @return their types, in order
	 */
	public static List<TokenType> types(List<Token> tokens) {
		List<TokenType> types = new ArrayList<TokenType>();
		for (Token token : tokens) {
			types.add(token.getType());
		}
		return types;
	}

	/**
	 * @param tokens tokens
	 * @return their texts, in order
	 */
	public static List<String> texts(List<Token> tokens) {
		List<String> texts = new ArrayList<String>();
		for (Token token : tokens) {
			texts.add(token.getText());
		}
		return texts;
	}

	/**
	 * @param script a script node
	 * @param index position of the command
	 * @return the command at {@code index}
	 */
	public static ParseNode command(ParseNode script, int index) {
		return script.getChildNodes(NodeKind.COMMAND).get(index);
	}

	/**
	 * Returns the first descendant of the given kind, depth first.
	 *
	 * @param node where to search, included
	 * @param kind wanted kind
	 * @return the node, or {@code null}
	 */
	public static ParseNode find(ParseNode node, NodeKind kind) {
		if (node.is(kind)) {
			return node;
		}
		for (ParseElement child : node.getChildren()) {
			if (child instanceof ParseNode) {
				ParseNode found = find((ParseNode) child, kind);
				if (found != null) {
					return found;
				}
			}
		}
		return null;
	}

	/**
	 * Describes the words of a command, tokens by their text and nodes by their
	 * kind, for compact assertions.
	 *
	 * @param command a command node
	 * @return one entry per word
	 */
	public static List<String> describeWords(ParseNode command) {
		List<String> words = new ArrayList<String>();
		for (ParseElement word : command.getWords()) {
			if (word instanceof Token) {
				words.add(((Token) word).getText());
			} else {
				words.add(((ParseNode) word).getKind().getDisplayName());
			}
		}
		return words;
	}
}
