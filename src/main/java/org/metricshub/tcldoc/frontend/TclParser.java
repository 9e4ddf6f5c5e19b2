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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.tcldoc.index.ProcedureIndex;
import org.metricshub.tcldoc.util.TclDocLogger;
import org.slf4j.Logger;

/**
 * Converts a stream of Tcl tokens into a tree of {@link ParseNode}s.
 * <p>
 * The grammar is a recursive descent over the token stream:
 *
 * <pre>
 * SCRIPT       : COMMAND*
 * COMMAND      : ( WORD | $ VARIABLE | [ SUBSTITUTION | " QUOTED | { GROUP )* [ EOL | ; | COMMENT ]
 * COMMENT      : # any* EOL                  (only where the command has no word yet)
 * QUOTED       : " ( WORD | $ VARIABLE | [ SUBSTITUTION | { GROUP )* "
 * GROUP        : { ( any | { GROUP )* }
 * SUBSTITUTION : [ ( any | [ SUBSTITUTION | { GROUP )* ]
 * VARIABLE     : $ ( { any* } | WORD )
 * </pre>
 *
 * Every construct method consumes its content and closing delimiter, or throws a
 * {@link ParserException}. Reaching the end of the tokens is only legal between
 * commands, or at the end of a non-empty last command.
 * <p>
 * Once a substitution is complete, its tokens are replayed through a nested
 * parser as an embedded script. If that fails, the substitution stays flat.
 * Substitutions nested in the replayed tokens were already handled when they
 * were completed: the nested parser skips over their tokens and reuses their
 * node, so each substitution is re-parsed exactly once.
 * <p>
 * Each <code>proc name args body</code> command with a literal name is recorded in
 * the {@link ProcedureIndex}, and its name token is tagged for cross-referencing.
 * A nested parser records its procedures in a staged index that is only
 * committed when the embedded script is kept.
 * <p>
 * A debug level of 0 is silent. Level 1 reports degraded constructs, level 2
 * also the line numbers where each construct begins and ends.
 *
 * @author Danny Daglas
 */
public class TclParser {

	private static final Logger LOG = TclDocLogger.getLogger(TclParser.class);

	/** Nesting depth allowed when none is specified. */
	public static final int DEFAULT_MAX_DEPTH = 256;

	private static final String PROC = "proc";

	private final TokenSource tokens;
	private final ProcedureIndex procedureIndex;
	private final int debugLevel;
	private final int maxDepth;
	private int depth;

	/** Nodes of the substitutions whose tokens are being replayed, by opening bracket */
	private final Map<Token, ParseNode> parsedSubstitutions;

	/**
	 * <p>
	 * Constructor for TclParser.
	 * </p>
	 *
	 * @param tokens source of the tokens to parse
	 * @param procedureIndex run-wide index receiving procedure definitions
	 * @param debugLevel diagnostic output level
	 * @param maxDepth maximum nesting depth of constructs
	 */
	public TclParser(TokenSource tokens, ProcedureIndex procedureIndex, int debugLevel, int maxDepth) {
		this(tokens, procedureIndex, debugLevel, maxDepth, 0, Collections.<Token, ParseNode>emptyMap());
	}

	private TclParser(
			TokenSource tokens,
			ProcedureIndex procedureIndex,
			int debugLevel,
			int maxDepth,
			int depth,
			Map<Token, ParseNode> parsedSubstitutions) {
		this.tokens = tokens;
		this.procedureIndex = procedureIndex;
		this.debugLevel = debugLevel;
		this.maxDepth = maxDepth;
		this.depth = depth;
		this.parsedSubstitutions = parsedSubstitutions;
	}

	/**
	 * Parses all the tokens as a script.
	 *
	 * @return the root {@link NodeKind#SCRIPT} node
	 * @throws TclParseException if the tokens do not form a valid script
	 */
	public ParseNode parse() {
		return SCRIPT();
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// SCRIPT : COMMAND*
	ParseNode SCRIPT() {
		ParseNode script = begin(NodeKind.SCRIPT, null, "");
		ParseNode command;
		while ((command = COMMAND()) != null) {
			script.add(command);
		}
		end(script, "");
		return script;
	}

	// COMMAND : words [terminator]
	// returns null when no token is left
	ParseNode COMMAND() {
		ParseNode command = begin(NodeKind.COMMAND, null, "");
		while (true) {
			Token token = tokens.nextToken();
			if (token.isEof()) {
				if (command.isEmpty()) {
					depth--;
					return null;
				}
				if (debugLevel > 1) {
					LOG.debug("{}: non-empty final line is missing \\n", tokens.getDescription());
				}
				break;
			}
			TokenType type = token.getType();
			if (type == TokenType.EOL || type == TokenType.SEMICOLON) {
				command.add(token);
				break;
			} else if (type == TokenType.HASH) {
				if (onlyWhitespace(command)) {
					command.add(COMMENT(token));
					break;
				}
				if (debugLevel > 0) {
					LOG.info("{}: found non-comment # in command on line {}", tokens.getDescription(), token.getLineNumber());
				}
				command.add(token);
			} else if (type == TokenType.DOLLAR) {
				command.add(VARIABLE(token));
			} else if (type == TokenType.OPEN_BRACKET) {
				command.add(SUBSTITUTION(token));
			} else if (type == TokenType.QUOTE) {
				command.add(QUOTED(token));
			} else if (type == TokenType.OPEN_BRACE) {
				command.add(GROUP(token, 1));
			} else if (type == TokenType.CLOSE_BRACE || type == TokenType.CLOSE_BRACKET) {
				throw unexpected(token, NodeKind.COMMAND);
			} else {
				command.add(token);
			}
		}
		end(command, "");
		registerProcedure(command);
		return command;
	}

	// COMMENT : # any* EOL
	ParseNode COMMENT(Token hash) {
		ParseNode comment = begin(NodeKind.COMMENT, hash, "");
		while (true) {
			Token token = next(NodeKind.COMMENT);
			comment.add(token);
			if (token.is(TokenType.EOL)) {
				break;
			}
		}
		end(comment, "");
		return comment;
	}

	// QUOTED : " ( WORD | $ VARIABLE | [ SUBSTITUTION | { GROUP )* "
	ParseNode QUOTED(Token quote) {
		ParseNode quoted = begin(NodeKind.QUOTED, quote, "");
		while (true) {
			Token token = next(NodeKind.QUOTED);
			TokenType type = token.getType();
			if (type == TokenType.DOLLAR) {
				quoted.add(VARIABLE(token));
			} else if (type == TokenType.OPEN_BRACKET) {
				quoted.add(SUBSTITUTION(token));
			} else if (type == TokenType.OPEN_BRACE) {
				quoted.add(GROUP(token, 1));
			} else if (type == TokenType.CLOSE_BRACE || type == TokenType.CLOSE_BRACKET) {
				throw unexpected(token, NodeKind.QUOTED);
			} else if (type == TokenType.QUOTE) {
				quoted.setSuffixToken(token);
				break;
			} else {
				quoted.add(token);
			}
		}
		end(quoted, "");
		return quoted;
	}

	// GROUP : { ( any | { GROUP )* }
	// Braces inside a group only need to balance, nothing else is recognized.
	ParseNode GROUP(Token brace, int level) {
		String info = groupInfo(level);
		ParseNode group = begin(NodeKind.GROUP, brace, info);
		while (true) {
			Token token = next(NodeKind.GROUP);
			if (token.is(TokenType.OPEN_BRACE)) {
				group.add(GROUP(token, level + 1));
			} else if (token.is(TokenType.CLOSE_BRACE)) {
				group.setSuffixToken(token);
				break;
			} else {
				group.add(token);
			}
		}
		end(group, info);
		return group;
	}

	// SUBSTITUTION : [ ( any | [ SUBSTITUTION | { GROUP )* ]
	ParseNode SUBSTITUTION(Token bracket) {
		ParseNode parsed = parsedSubstitutions.get(bracket);
		if (parsed != null) {
			return skipOver(parsed);
		}
		ParseNode substitution = begin(NodeKind.SUBSTITUTION, bracket, "");
		while (true) {
			Token token = next(NodeKind.SUBSTITUTION);
			TokenType type = token.getType();
			if (type == TokenType.CLOSE_BRACKET) {
				substitution.setSuffixToken(token);
				break;
			} else if (type == TokenType.OPEN_BRACKET) {
				substitution.add(SUBSTITUTION(token));
			} else if (type == TokenType.OPEN_BRACE) {
				substitution.add(GROUP(token, 1));
			} else if (type == TokenType.EOL || type == TokenType.CLOSE_BRACE) {
				throw unexpected(token, NodeKind.SUBSTITUTION);
			} else {
				substitution.add(token);
			}
		}
		end(substitution, "");
		// now that the whole substitution is captured, try to expose its structure
		embed(substitution);
		return substitution;
	}

	// VARIABLE : $ ( { any* } | WORD )
	// Only the leading name of $name(index) is captured.
	ParseNode VARIABLE(Token dollar) {
		ParseNode variable = begin(NodeKind.VARIABLE, dollar, "");
		Token token = next(NodeKind.VARIABLE);
		if (token.is(TokenType.OPEN_BRACE)) {
			variable.add(token);
			do {
				token = next(NodeKind.VARIABLE);
				variable.add(token);
			} while (!token.is(TokenType.CLOSE_BRACE));
		} else if (token.is(TokenType.WORD)) {
			variable.add(token);
		} else {
			throw parserException("unexpected token " + token + " in Variable on line " + token.getLineNumber(), token);
		}
		end(variable, "");
		return variable;
	}

	// CHECKSTYLE.ON: MethodName

	/**
	 * Re-parses the content of a node as a self-contained script, replaying its
	 * tokens. On success the node's children are replaced by the embedded script
	 * and the procedures it defines are committed to the index; on failure the
	 * node is left untouched and those procedures are dropped.
	 *
	 * @param node node whose content is re-parsed
	 */
	void embed(ParseNode node) {
		if (debugLevel > 1) {
			LOG.debug("re-parsing {} as an embedded script", node.getKind().getDisplayName());
		}
		Map<Token, ParseNode> nested = new IdentityHashMap<Token, ParseNode>();
		for (ParseNode substitution : node.getChildNodes(NodeKind.SUBSTITUTION)) {
			nested.put(substitution.getPrefixToken(), substitution);
		}
		ProcedureIndex staged = procedureIndex.stage();
		TclParser embedded = new TclParser(
				new TokenReplay(node.tokenStream(), tokens.getDescription(), debugLevel),
				staged,
				debugLevel,
				maxDepth,
				depth,
				nested);
		try {
			node.embed(embedded.parse());
			staged.commit();
		} catch (TclParseException e) {
			if (debugLevel > 0) {
				LOG.info("re-parsing of {} as embedded script failed: {}", node.getKind().getDisplayName(), e.getMessage());
			}
		}
	}

	/**
	 * Consumes the replayed tokens of a substitution that was already parsed.
	 *
	 * @param parsed the node built from these tokens
	 * @return {@code parsed}, unchanged
	 */
	private ParseNode skipOver(ParseNode parsed) {
		Token last = parsed.getSuffixToken();
		Token token;
		do {
			token = next(NodeKind.SUBSTITUTION);
		} while (token != last);
		return parsed;
	}

	/**
	 * Records a <code>proc name args body</code> command in the procedure index and
	 * tags its name token.
	 *
	 * @param command a complete command
	 */
	private void registerProcedure(ParseNode command) {
		List<ParseElement> words = command.getWords();
		if (words.isEmpty() || !isWord(words.get(0)) || !PROC.equals(((Token) words.get(0)).getText())) {
			return;
		}
		Token proc = (Token) words.get(0);
		// http://www.tcl.tk/man/tcl8.4/TclCmd/proc.htm
		if (words.size() != 4) {
			if (debugLevel > 0) {
				LOG
						.info(
								"{}: ignoring \"proc\" with {} words (expected 4) on line {}",
								tokens.getDescription(),
								words.size(),
								proc.getLineNumber());
			}
			return;
		}
		if (!isWord(words.get(1))) {
			if (debugLevel > 0) {
				LOG.info("{}: ignoring \"proc\" with computed name on line {}", tokens.getDescription(), proc.getLineNumber());
			}
			return;
		}
		Token name = (Token) words.get(1);
		if (name.isTagged()) {
			// replayed from a script that was already indexed
			return;
		}
		String tag = procedureIndex.register(name.getText(), tokens.getDescription());
		if (debugLevel > 0 && !tag.equals(name.getText())) {
			LOG
					.info(
							"{}: added duplicate \"{}\" to command dictionary on line {}",
							tokens.getDescription(),
							tag,
							proc.getLineNumber());
		} else if (debugLevel > 1) {
			LOG.debug("{}: added \"{}\" to command dictionary on line {}", tokens.getDescription(), tag, proc.getLineNumber());
		}
		command.set(command.getChildren().indexOf(name), name.withTag(tag));
	}

	private static boolean isWord(ParseElement element) {
		return element instanceof Token && ((Token) element).is(TokenType.WORD);
	}

	/**
	 * Only whitespace can precede a valid comment.
	 */
	private static boolean onlyWhitespace(ParseNode command) {
		for (ParseElement child : command.getChildren()) {
			if (!(child instanceof Token)) {
				return false;
			}
			TokenType type = ((Token) child).getType();
			if (type != TokenType.WS && type != TokenType.EOL) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Returns the next token, failing at the end of the input.
	 */
	private Token next(NodeKind within) {
		Token token = tokens.nextToken();
		if (token.isEof()) {
			throw parserException("unexpected EOF in " + within.getDisplayName(), token);
		}
		return token;
	}

	private ParseNode begin(NodeKind kind, Token prefixToken, String info) {
		if (++depth > maxDepth) {
			int line = prefixToken != null ? prefixToken.getLineNumber() : tokens.lineNumber();
			throw new ParserException(
					kind.getDisplayName() + " nested deeper than " + maxDepth + " on line " + line,
					tokens.getDescription(),
					line);
		}
		if (debugLevel > 1) {
			LOG.debug(String.format("line %4d: %s begin %s", tokens.lineNumber(), kind.getDisplayName(), info));
		}
		return new ParseNode(kind, prefixToken);
	}

	private void end(ParseNode node, String info) {
		depth--;
		if (debugLevel > 1) {
			LOG.debug(String.format("line %4d: %s end   %s", tokens.lineNumber(), node.getKind().getDisplayName(), info));
		}
	}

	private static String groupInfo(int level) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < level; i++) {
			sb.append('-');
		}
		return sb.append(String.format("> %2d", level)).toString();
	}

	private ParserException unexpected(Token token, NodeKind within) {
		String what = token.is(TokenType.EOL) ? "end of line" : token.getText();
		return parserException(
				"unexpected " + what + " on line " + token.getLineNumber() + " during " + within.getDisplayName(),
				token);
	}

	private ParserException parserException(String msg, Token at) {
		return new ParserException(msg, tokens.getDescription(), at.getLineNumber());
	}
}
