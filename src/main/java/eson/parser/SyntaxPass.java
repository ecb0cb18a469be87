package eson.parser;

import java.util.*;
import java.util.logging.Logger;

import eson.Config;
import eson.NestingDepthExceeded;
import eson.grammar.Grammar;
import eson.grammar.NonTerminal;
import eson.grammar.Production;
import eson.grammar.Rule;
import eson.lexer.Token;
import eson.lexer.TokenSeq;

/**
 * Builds a parse tree shaped like the productions of the grammar out of a token sequence.
 *
 * A recursive descent parser that is driven by the production kinds: the decisions of
 * alternations, options and repetitions are taken by looking at the first set of the candidate
 * rules and the current token. Decisions are never revisited.
 */
public class SyntaxPass {

	private static final Logger LOG = Logger.getLogger("eson.parser");

	private final Grammar grammar;

	private final int maxDepth;

	public SyntaxPass(Grammar grammar) {
		this(grammar, Config.maxRuleDepth());
	}

	/**
	 * @param maxDepth maximum number of nested rules
	 */
	public SyntaxPass(Grammar grammar, int maxDepth) {
		this.grammar = grammar;
		this.maxDepth = maxDepth;
	}

	public static Tree buildTree(TokenSeq tokens, Grammar grammar){
		return new SyntaxPass(grammar).buildTree(tokens);
	}

	/**
	 * Builds the parse tree for the passed tokens.
	 *
	 * @throws SyntaxError if the tokens can't be reduced to the start rule of the grammar
	 * @throws NestingDepthExceeded if the rules are nested too deeply
	 */
	public Tree buildTree(TokenSeq tokens){
		Parse parse = new Parse(tokens);
		NonTerminal start = grammar.getStart();
		if (!grammar.canStart(start.name, parse.current())){
			throw parse.error(start, "expected one of " + grammar.first(start.name));
		}
		int root = parse.parse(start, Collections.emptyMap(), 1);
		if (parse.position < tokens.size()){
			throw parse.error(start, "unexpected token after the end of the program");
		}
		parse.tree.setRoot(root);
		LOG.fine(() -> String.format("Built a parse tree with %d nodes out of %d tokens", parse.tree.size(), tokens.size()));
		return parse.tree;
	}

	/**
	 * State of parsing a single token sequence
	 */
	private class Parse {

		final TokenSeq tokens;
		final Tree tree = new Tree();
		int position = 0;

		Parse(TokenSeq tokens) {
			this.tokens = tokens;
		}

		/**
		 * @return current token or null at the end of the input
		 */
		Token current(){
			return position < tokens.size() ? tokens.get(position) : null;
		}

		/**
		 * Parses the rule at the current position, the caller has checked that the rule can start here.
		 *
		 * @param inherited inherited attribute values of the parent
		 * @return id of the created node
		 */
		int parse(Rule rule, Map<String, Object> inherited, int depth){
			if (depth > maxDepth){
				throw new NestingDepthExceeded("parse tree", maxDepth);
			}
			if (rule.isTerminal()){
				return matchTerminal(rule);
			}
			NonTerminal nonTerminal = (NonTerminal)rule;
			int node = tree.addNode(nonTerminal.nodeName(), inheritedAttributes(nonTerminal, inherited));
			Map<String, Object> context = tree.attributes(node);
			Production production = nonTerminal.production;
			LOG.finest(() -> String.format("%s at %s", nonTerminal.name, current()));
			switch (production.kind){
				case CONCATENATION:
					for (String ref : production.right){
						Rule sub = grammar.getRule(ref);
						if (!grammar.canStart(ref, current()) && !grammar.isNullable(ref)){
							throw error(nonTerminal, "expected one of " + grammar.first(ref) + " for " + ref);
						}
						tree.addChild(node, parse(sub, context, depth + 1));
					}
					break;
				case ALTERNATION:
					tree.addChild(node, parse(chooseAlternative(nonTerminal), context, depth + 1));
					break;
				case OPTION:
					String optional = production.right.get(0);
					if (grammar.canStart(optional, current())){
						tree.addChild(node, parse(grammar.getRule(optional), context, depth + 1));
					} else {
						tree.addChild(node, tree.addNullable(context));
					}
					break;
				case REPETITION:
					String repeated = production.right.get(0);
					int matches = 0;
					while (current() != null && grammar.canStart(repeated, current())){
						int before = position;
						tree.addChild(node, parse(grammar.getRule(repeated), context, depth + 1));
						matches++;
						if (position == before){
							break;
						}
					}
					if (matches == 0){
						tree.addChild(node, tree.addNullable(context));
					}
					break;
			}
			return node;
		}

		/**
		 * The first alternative that can start with the current token, or the first alternative that
		 * matches nothing.
		 */
		private Rule chooseAlternative(NonTerminal nonTerminal){
			List<String> alternatives = nonTerminal.production.right;
			if (current() != null){
				for (String alternative : alternatives){
					if (grammar.first(alternative).contains(current().name)){
						return grammar.getRule(alternative);
					}
				}
			}
			for (String alternative : alternatives){
				if (grammar.isNullable(alternative)){
					return grammar.getRule(alternative);
				}
			}
			Set<String> expected = new TreeSet<>();
			for (String alternative : alternatives){
				expected.addAll(grammar.first(alternative));
			}
			throw error(nonTerminal, "expected one of " + expected);
		}

		private int matchTerminal(Rule terminal){
			Token token = current();
			if (token == null || !token.is(terminal.name)){
				throw error(terminal, "expected " + terminal.name);
			}
			position++;
			return tree.addLeaf(token);
		}

		/**
		 * Values of the inherited attributes: the value of the first token of the rule if it has one,
		 * otherwise the value of the parent.
		 */
		private Map<String, Object> inheritedAttributes(NonTerminal nonTerminal, Map<String, Object> inherited){
			Map<String, Object> attrs = new LinkedHashMap<>();
			Token token = current();
			for (String attr : nonTerminal.getIAttr()){
				if (token != null && token.hasAttribute(attr)){
					attrs.put(attr, token.attribute(attr));
				} else if (inherited.containsKey(attr)){
					attrs.put(attr, inherited.get(attr));
				}
			}
			return attrs;
		}

		SyntaxError error(Rule rule, String message){
			Token token = current();
			if (token == null && !tokens.isEmpty()){
				return new SyntaxError(tokens.last(), rule.name, message + " but reached the end of the program");
			}
			return new SyntaxError(token, rule.name, message);
		}
	}
}
