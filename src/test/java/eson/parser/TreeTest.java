package eson.parser;

import java.util.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import eson.lexer.Token;

import static org.junit.jupiter.api.Assertions.*;

public class TreeTest {

	private Tree tree;
	private int root;
	private int wrapper;
	private int a;
	private int b;
	private int c;

	/**
	 * (root (wrapper a b) c)
	 */
	@BeforeEach
	public void setUp(){
		tree = new Tree();
		root = tree.addNode("root", Collections.emptyMap());
		wrapper = tree.addNode("wrapper", Collections.emptyMap());
		a = tree.addLeaf(new Token("1", "a"));
		b = tree.addLeaf(new Token("2", "b"));
		c = tree.addLeaf(new Token("3", "c"));
		tree.addChild(root, wrapper);
		tree.addChild(wrapper, a);
		tree.addChild(wrapper, b);
		tree.addChild(root, c);
		tree.setRoot(root);
	}

	@Test
	public void testStructure(){
		assertEquals("(root (wrapper a(1) b(2)) c(3))", tree.toString());
		assertEquals(Arrays.asList(root, wrapper, a, b, c), tree.nodes());
		assertEquals(5, tree.size());
		assertEquals(wrapper, tree.parent(a));
		assertEquals(Tree.NO_NODE, tree.parent(root));
		assertTrue(tree.isLeaf(a));
		assertFalse(tree.isLeaf(wrapper));
		assertEquals(Collections.singletonList(b), tree.findAll("b"));
		assertTrue(tree.hasChild(root, "c"));
	}

	@Test
	public void testRemoveRoot(){
		tree.removeRoot(wrapper);
		assertEquals("(root a(1) b(2) c(3))", tree.toString());
		assertEquals(root, tree.parent(a));
		assertEquals(Tree.NO_NODE, tree.parent(wrapper));
	}

	@Test
	public void testReduceRoot(){
		tree.deleteNode(b);
		tree.reduceRoot(wrapper);
		assertEquals("(root a(1) c(3))", tree.toString());
		assertEquals(root, tree.parent(a));
	}

	@Test
	public void testReduceRootNeedsOneChild(){
		assertThrows(IllegalStateException.class, () -> tree.reduceRoot(wrapper));
	}

	@Test
	public void testReduceTreeRoot(){
		tree.deleteNode(c);
		tree.reduceRoot(root);
		assertEquals(wrapper, tree.root());
		assertEquals("(wrapper a(1) b(2))", tree.toString());
	}

	@Test
	public void testDeleteNode(){
		tree.deleteNode(wrapper);
		assertEquals("(root c(3))", tree.toString());
		assertFalse(tree.nodes().contains(a));
		tree.deleteNode(root);
		assertEquals("()", tree.toString());
	}

	@Test
	public void testOperatorTree(){
		tree.relabel(b, "op");
		tree.makeTreeNode(b);
		tree.setChildren(b, Arrays.asList(a, c));
		assertEquals("(root (wrapper (op a(1) c(3))))", tree.toString());
		tree.reduceRoot(wrapper);
		assertEquals("(root (op a(1) c(3)))", tree.toString());
		assertEquals(root, tree.parent(b));
		assertEquals(b, tree.parent(c));
	}

	@Test
	public void testNodeView(){
		Tree.Node node = tree.rootNode();
		assertEquals("root", node.name());
		assertEquals(2, node.degree());
		assertEquals("wrapper", node.child(0).name());
		assertEquals(node, node.child(0).parent());
		assertEquals("3", node.child(1).token().lexeme);
		assertNull(node.parent());
	}

	@Test
	public void testLeafAttributes(){
		Token token = new Token("4", "d");
		token.setAttribute(Token.LINE_NO, 7);
		int leaf = tree.addLeaf(token);
		assertEquals(7, tree.attributes(leaf).get(Token.LINE_NO));
		assertEquals(7, tree.node(leaf).attribute(Token.LINE_NO));
	}

	@Test
	public void testPrettyString(){
		assertEquals("(root\n\t(wrapper\n\t\ta(1)\n\t\tb(2))\n\tc(3))", tree.toPrettyString());
	}

	@Test
	public void testUnknownNode(){
		assertThrows(IllegalArgumentException.class, () -> tree.name(42));
	}
}
