package eson.parser;

import org.junit.jupiter.api.Test;

import eson.EsonInputs;
import eson.NestingDepthExceeded;
import eson.grammar.EsonGrammars;
import eson.grammar.Grammar;
import eson.lexer.Token;
import eson.lexer.TokenSeq;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxPassTest {

	private final Grammar grammar = EsonGrammars.format();

	@Test
	public void testEmptyProgram(){
		assertEquals("(program program_start({) (option (nullable)) program_end(}))",
				EsonInputs.parseTree(EsonInputs.EMPTY_PROGRAM).toString());
	}

	@Test
	public void testAttribute(){
		assertEquals("(program program_start({) (option (declaration_list (alternation (attribute attribute_name(\"$x\") "
						+ "colon(:) (alternation (string string_delimiter(\") (repetition (alternation word_form(hello))) "
						+ "string_delimiter(\"))))) (declaration_more (nullable)))) program_end(}))",
				EsonInputs.parseTree("{\"$x\": \"hello\"}").toString());
	}

	@Test
	public void testCallAndArray(){
		Tree tree = EsonInputs.parseTree("{\"&doc\": [1, true]}");
		assertEquals(1, tree.findAll("call").size());
		assertEquals(1, tree.findAll("array").size());
		assertEquals(1, tree.findAll("element_more_once").size());
		int call = tree.findAll("call").get(0);
		assertEquals("special_form_identifier", tree.name(tree.child(tree.child(call, 0), 0)));
	}

	@Test
	public void testEmptyArrayAndString(){
		Tree tree = EsonInputs.parseTree("{\"a\": [], \"b\": \"\"}");
		int array = tree.findAll("array").get(0);
		assertEquals("(array array_start([) (option (nullable)) array_end(]))", tree.toString(array));
		int string = tree.findAll("string").get(0);
		assertEquals("(string string_delimiter(\") (repetition (nullable)) string_delimiter(\"))", tree.toString(string));
	}

	@Test
	public void testLeavesInTokenOrder(){
		String program = EsonInputs.validEson();
		TokenSeq tokens = EsonInputs.tokenSequence(program);
		Tree tree = new SyntaxPass(grammar).buildTree(tokens);
		TokenSeq leaves = new TokenSeq();
		for (int node : tree.nodes()){
			if (tree.isLeaf(node)){
				leaves.push(tree.token(node));
			}
		}
		assertEquals(tokens, leaves);
	}

	@Test
	public void testInheritedLineNumbers(){
		Tree tree = EsonInputs.parseTree("{\"a\": 1, \"b\": [2, 3]}");
		assertEquals(1, tree.attributes(tree.root()).get(Token.LINE_NO));
		int array = tree.findAll("array").get(0);
		assertEquals(3, tree.attributes(array).get(Token.LINE_NO));
		assertTrue(tree.findAll(Tree.NULLABLE).isEmpty());
	}

	@Test
	public void testNullableInheritsLineNumber(){
		Tree tree = EsonInputs.parseTree("{\"a\": 1, \"b\": []}");
		int array = tree.findAll("array").get(0);
		int nullable = tree.findAll(Tree.NULLABLE).get(0);
		assertEquals(array, tree.parent(tree.parent(nullable)));
		assertEquals(3, tree.attributes(array).get(Token.LINE_NO));
		// the empty slot takes the line of the token that follows it
		assertEquals(4, tree.attributes(nullable).get(Token.LINE_NO));
	}

	@Test
	public void testMissingToken(){
		TokenSeq tokens = TokenSeq.of(new Token("{", "program_start"), new Token(":", "colon"));
		SyntaxError error = assertThrows(SyntaxError.class, () -> new SyntaxPass(grammar).buildTree(tokens));
		assertEquals("program", error.rule);
		assertEquals(tokens.get(1), error.errorToken);
	}

	@Test
	public void testEndOfInput(){
		TokenSeq tokens = TokenSeq.of(new Token("{", "program_start"));
		SyntaxError error = assertThrows(SyntaxError.class, () -> new SyntaxPass(grammar).buildTree(tokens));
		assertTrue(error.getMessage().contains("end of the program"));
	}

	@Test
	public void testWrongStart(){
		TokenSeq tokens = TokenSeq.of(new Token(":", "colon"));
		assertThrows(SyntaxError.class, () -> new SyntaxPass(grammar).buildTree(tokens));
		assertThrows(SyntaxError.class, () -> new SyntaxPass(grammar).buildTree(new TokenSeq()));
	}

	@Test
	public void testTrailingTokens(){
		TokenSeq tokens = TokenSeq.of(new Token("{", "program_start"), new Token("}", "program_end"),
				new Token("}", "program_end"));
		SyntaxError error = assertThrows(SyntaxError.class, () -> new SyntaxPass(grammar).buildTree(tokens));
		assertTrue(error.getMessage().contains("after the end"));
	}

	@Test
	public void testMissingValue(){
		TokenSeq tokens = TokenSeq.of(new Token("{", "program_start"), new Token("\"a\"", "attribute_name"),
				new Token(":", "colon"), new Token("}", "program_end"));
		SyntaxError error = assertThrows(SyntaxError.class, () -> new SyntaxPass(grammar).buildTree(tokens));
		assertEquals("attribute", error.rule);
	}

	@Test
	public void testNestingDepth(){
		TokenSeq empty = EsonInputs.tokenSequence(EsonInputs.EMPTY_PROGRAM);
		new SyntaxPass(grammar, 2).buildTree(empty);
		TokenSeq tokens = EsonInputs.tokenSequence("{\"a\": 1}");
		NestingDepthExceeded error = assertThrows(NestingDepthExceeded.class,
				() -> new SyntaxPass(grammar, 5).buildTree(tokens));
		assertEquals(5, error.limit);
	}
}
