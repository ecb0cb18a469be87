package eson.parser;

import java.util.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import eson.EsonException;
import eson.EsonInputs;
import eson.lexer.Token;

import static org.junit.jupiter.api.Assertions.*;

public class AstRewriterTest {

	private static Tree ast(String program){
		return AstRewriter.convertToAst(EsonInputs.parseTree(program));
	}

	@Test
	public void testAttribute(){
		assertEquals("(program (bind attribute_name(\"$x\") (string word_form(hello))))",
				ast("{\"$x\": \"hello\"}").toString());
	}

	@Test
	public void testCall(){
		assertEquals("(program (apply special_form_identifier(\"&doc\") (string word_form(text))) "
						+ "(apply unreserved_procedure_identifier(\"&Math.max\") (array number(1) number(2))))",
				ast("{\"&doc\": \"text\", \"&Math.max\": [1, 2]}").toString());
	}

	@Test
	public void testScalarsAndNesting(){
		assertEquals("(program (bind attribute_name(\"a\") (program (bind attribute_name(\"b\") true(true)) "
						+ "(bind attribute_name(\"c\") null(null)))) (bind attribute_name(\"d\") number(-1.5)))",
				ast("{\"a\": {\"b\": true, \"c\": null}, \"d\": -1.5}").toString());
	}

	@Test
	public void testMixedString(){
		assertEquals("(program (bind attribute_name(\"g\") (string word_form(Hi ) variable_identifier($name) word_form(!))))",
				ast("{\"g\": \"Hi $name!\"}").toString());
	}

	@Test
	public void testEmptyParts(){
		assertEquals("(program (bind attribute_name(\"a\") (array (nullable))) (bind attribute_name(\"b\") (string (nullable))) "
						+ "(bind attribute_name(\"c\") (program (nullable))))",
				ast("{\"a\": [], \"b\": \"\", \"c\": {}}").toString());
	}

	@Test
	public void testNoScaffoldingLeft(){
		Tree tree = ast(EsonInputs.validEson());
		List<String> names = new ArrayList<>();
		for (int node : tree.nodes()){
			names.add(tree.name(node));
		}
		for (String removed : Arrays.asList("alternation", "option", "repetition", "attribute", "call", "colon",
				"element_list", "element_more", "element_more_once", "element_divider", "array_start", "array_end",
				"declaration_list", "declaration_more", "declaration_more_once", "declaration_divider",
				"program_start", "program_end", "string_delimiter")){
			assertFalse(names.contains(removed), removed);
		}
	}

	@Test
	public void testOperatorsAreBinary(){
		Tree tree = ast(EsonInputs.validEson());
		for (String operator : Arrays.asList(AstRewriter.BIND, AstRewriter.APPLY)){
			for (int node : tree.findAll(operator)){
				assertEquals(2, tree.degree(node));
				assertNull(tree.token(node));
			}
		}
		assertEquals(3, tree.findAll(AstRewriter.APPLY).size());
	}

	@Test
	public void testNullableOnlyAsSingleChild(){
		Tree tree = ast(EsonInputs.validEson());
		for (int node : tree.findAll(Tree.NULLABLE)){
			assertEquals(1, tree.degree(tree.parent(node)));
		}
	}

	@ParameterizedTest
	@ValueSource(strings = {"{}", "{\"a\": [1, [2, []], {\"b\": \"$c\"}]}", "{\"&let\": {\"x\": 1}, \"y\": \"$x\"}"})
	public void testIdempotent(String program){
		Tree tree = ast(program);
		String once = tree.toString();
		assertEquals(once, AstRewriter.convertToAst(tree).toString());
	}

	@Test
	public void testMalformedOperator(){
		Tree tree = new Tree();
		int attribute = tree.addNode("attribute", Collections.emptyMap());
		int name = tree.addLeaf(new Token("\"a\"", "attribute_name"));
		tree.addChild(attribute, name);
		tree.setRoot(attribute);
		EsonException error = assertThrows(EsonException.class, () -> AstRewriter.makeOperatorsRoot(tree));
		assertTrue(error.getMessage().contains("(attribute attribute_name(\"a\"))"));
	}
}
