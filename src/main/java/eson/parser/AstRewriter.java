package eson.parser;

import java.util.*;
import java.util.logging.Logger;

import eson.EsonException;
import eson.grammar.Production;

/**
 * Rewrites a parse tree into the abstract syntax tree.
 *
 * Removes the nodes that only reflect the structure of the grammar and makes the binary
 * operators the roots of their sub trees: {@code attribute_name : value} becomes
 * {@code (bind attribute_name value)}, {@code procedure : argument} becomes
 * {@code (apply procedure argument)}. Every stage can be applied to its own output again.
 */
public class AstRewriter {

	private static final Logger LOG = Logger.getLogger("eson.ast");

	public static final String ALTERNATION = Production.Kind.ALTERNATION.tag();
	public static final String OPTION = Production.Kind.OPTION.tag();
	public static final String REPETITION = Production.Kind.REPETITION.tag();

	public static final String BIND = "bind";
	public static final String APPLY = "apply";

	static final List<String> ARRAY_SCAFFOLDING = Arrays.asList("element_list", "element_more", "element_more_once");
	static final List<String> ARRAY_TOKENS = Arrays.asList("element_divider", "array_start", "array_end");
	static final List<String> PROGRAM_SCAFFOLDING = Arrays.asList("declaration_list", "declaration_more", "declaration_more_once");
	static final List<String> PROGRAM_TOKENS = Arrays.asList("declaration_divider", "program_start", "program_end");

	public static Tree convertToAst(Tree tree){
		removeAlternationRules(tree);
		removeOptionRules(tree);
		removeRepetitionRules(tree);
		reduceArraySet(tree);
		reduceProgramSet(tree);
		reduceString(tree);
		makeOperatorsRoot(tree);
		LOG.fine(() -> String.format("Rewrote the parse tree into an AST with %d nodes", tree.size()));
		return tree;
	}

	public static void removeAlternationRules(Tree tree){
		tree.findAll(ALTERNATION).forEach(tree::reduceRoot);
	}

	public static void removeOptionRules(Tree tree){
		tree.findAll(OPTION).forEach(tree::reduceRoot);
	}

	public static void removeRepetitionRules(Tree tree){
		tree.findAll(REPETITION).forEach(tree::removeRoot);
	}

	public static void reduceArraySet(Tree tree){
		removeRoots(tree, ARRAY_SCAFFOLDING);
		deleteNodes(tree, ARRAY_TOKENS);
		removeNullableChild(tree, "array");
	}

	public static void reduceProgramSet(Tree tree){
		removeRoots(tree, PROGRAM_SCAFFOLDING);
		deleteNodes(tree, PROGRAM_TOKENS);
		removeNullableChild(tree, "program");
	}

	public static void reduceString(Tree tree){
		deleteNodes(tree, Collections.singletonList("string_delimiter"));
		removeNullableChild(tree, "string");
	}

	private static void removeRoots(Tree tree, List<String> names){
		for (String name : names){
			tree.findAll(name).forEach(tree::removeRoot);
		}
	}

	private static void deleteNodes(Tree tree, List<String> names){
		for (String name : names){
			tree.findAll(name).forEach(tree::deleteNode);
		}
	}

	/**
	 * Deletes the nullable markers of the matching nodes that have other children.
	 */
	static void removeNullableChild(Tree tree, String name){
		for (int node : tree.findAll(name)){
			if (tree.degree(node) > 1 && tree.hasChild(node, Tree.NULLABLE)){
				for (int child : new ArrayList<>(tree.children(node))){
					if (tree.is(child, Tree.NULLABLE)){
						tree.deleteNode(child);
					}
				}
			}
		}
	}

	public static void makeOperatorsRoot(Tree tree){
		makeOperatorTrees(tree, "attribute", BIND);
		makeOperatorTrees(tree, "call", APPLY);
	}

	/**
	 * Turns every {@code (wrapper left colon right)} into {@code (operator left right)} that takes
	 * the place of the wrapper.
	 *
	 * @throws EsonException if a wrapper doesn't have this shape
	 */
	static void makeOperatorTrees(Tree tree, String wrapper, String operator){
		for (int node : tree.findAll(wrapper)){
			List<Integer> children = tree.children(node);
			if (children.size() != 3 || !tree.is(children.get(1), "colon")){
				throw new EsonException(String.format("Can't make a %s tree out of %s", operator, tree.toString(node)));
			}
			int left = children.get(0);
			int colon = children.get(1);
			int right = children.get(2);
			tree.relabel(colon, operator);
			tree.makeTreeNode(colon);
			tree.setChildren(colon, Arrays.asList(left, right));
			tree.reduceRoot(node);
		}
	}
}
