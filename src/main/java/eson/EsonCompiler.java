package eson;

import java.util.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;

import eson.grammar.EsonGrammars;
import eson.grammar.Grammar;
import eson.json.Json;
import eson.lexer.TokenSeq;
import eson.lexer.Tokenizer;
import eson.parser.AstRewriter;
import eson.parser.SyntaxPass;
import eson.parser.Tree;

/**
 * Compiles eson programs into abstract syntax trees.
 *
 * The program is validated as JSON, tokenized, checked for unknown special forms, parsed and
 * rewritten. Every error aborts the whole compilation.
 */
public class EsonCompiler {

	private static final Logger LOG = Logger.getLogger("eson.compiler");

	/**
	 * Result of a compilation: the AST or nothing for an empty program
	 */
	public static class Result {

		private static final Result EMPTY = new Result(null);

		private final Tree ast;

		private Result(Tree ast) {
			this.ast = ast;
		}

		public static Result empty(){
			return EMPTY;
		}

		public static Result of(Tree ast){
			return new Result(ast);
		}

		public boolean isEmpty(){
			return ast == null;
		}

		/**
		 * @throws IllegalStateException for the empty program
		 */
		public Tree getAst(){
			if (ast == null){
				throw new IllegalStateException("The empty program has no AST");
			}
			return ast;
		}

		@Override
		public String toString() {
			return isEmpty() ? "empty_program" : ast.toString();
		}
	}

	private final Grammar grammar;

	private final int maxNestingDepth;

	private final int maxRuleDepth;

	public EsonCompiler() {
		this(EsonGrammars.format());
	}

	public EsonCompiler(Grammar grammar) {
		this(grammar, Config.maxNestingDepth(), Config.maxRuleDepth());
	}

	public EsonCompiler(Grammar grammar, int maxNestingDepth, int maxRuleDepth) {
		this.grammar = grammar;
		this.maxNestingDepth = maxNestingDepth;
		this.maxRuleDepth = maxRuleDepth;
	}

	/**
	 * Compiles a program.
	 *
	 * @param program eson program text
	 * @return the AST or the empty result if the program is blank or the empty object
	 * @throws MalformedProgram if the program isn't a JSON object
	 * @throws EsonException for every other error
	 */
	public Result compile(String program){
		if (program == null || program.trim().isEmpty()){
			LOG.fine("Blank program");
			return Result.empty();
		}
		JsonNode json = Json.parse(program);
		if (!json.isObject()){
			throw new MalformedProgram("the program has to be a JSON object, got " + json.getNodeType());
		}
		if (json.size() == 0){
			LOG.fine("Empty program");
			return Result.empty();
		}
		TokenSeq tokens = tokenize(json);
		Tree tree = new SyntaxPass(grammar, maxRuleDepth).buildTree(tokens);
		return Result.of(AstRewriter.convertToAst(tree));
	}

	/**
	 * Tokenizes a parsed program and verifies its special forms.
	 */
	public TokenSeq tokenize(JsonNode program){
		return new Tokenizer(grammar, maxNestingDepth).tokenize(program)
				.verifySpecialForms(grammar.getSpecialForms());
	}

	public Grammar getGrammar(){
		return grammar;
	}
}
