package eson.parser;

import java.util.*;
import java.util.stream.Collectors;

import eson.lexer.Token;

/**
 * A mutable tree whose nodes live in an arena and are addressed by stable ids.
 *
 * Parent and child relations are stored as ids, so nodes can be promoted, spliced and excised
 * without dangling references. Excised nodes stay in the arena but are no longer reachable.
 */
public class Tree {

	public static final int NO_NODE = -1;

	public static final String NULLABLE = "nullable";

	private final List<String> names = new ArrayList<>();
	private final List<List<Integer>> children = new ArrayList<>();
	private final List<Integer> parents = new ArrayList<>();
	private final List<Token> tokens = new ArrayList<>();
	private final List<Map<String, Object>> attributes = new ArrayList<>();

	private int root = NO_NODE;

	private int create(String name, Token token, Map<String, Object> attrs){
		names.add(name);
		children.add(new ArrayList<>());
		parents.add(NO_NODE);
		tokens.add(token);
		attributes.add(new LinkedHashMap<>(attrs));
		return names.size() - 1;
	}

	/**
	 * Creates a leaf for a token, it's named after the token and carries its attributes.
	 */
	public int addLeaf(Token token){
		return create(token.name, token, token.attributes());
	}

	public int addNode(String name, Map<String, Object> attrs){
		return create(name, null, attrs);
	}

	/**
	 * Creates a marker for an optional or repeated part that matched nothing.
	 */
	public int addNullable(Map<String, Object> attrs){
		return addNode(NULLABLE, attrs);
	}

	public void addChild(int parent, int child){
		checkNode(parent);
		checkNode(child);
		children.get(parent).add(child);
		parents.set(child, parent);
	}

	public int root(){
		return root;
	}

	public void setRoot(int node){
		checkNode(node);
		root = node;
		parents.set(node, NO_NODE);
	}

	public String name(int node){
		checkNode(node);
		return names.get(node);
	}

	public boolean is(int node, String name){
		return name(node).equals(name);
	}

	public void relabel(int node, String name){
		checkNode(node);
		names.set(node, name);
	}

	public List<Integer> children(int node){
		checkNode(node);
		return Collections.unmodifiableList(children.get(node));
	}

	public int child(int node, int index){
		return children(node).get(index);
	}

	public int degree(int node){
		return children(node).size();
	}

	public boolean hasChild(int node, String name){
		return children(node).stream().anyMatch(c -> is(c, name));
	}

	/**
	 * @return parent id or {@link #NO_NODE} for the root and excised nodes
	 */
	public int parent(int node){
		checkNode(node);
		return parents.get(node);
	}

	/**
	 * @return the token of a leaf, null for internal nodes
	 */
	public Token token(int node){
		checkNode(node);
		return tokens.get(node);
	}

	public boolean isLeaf(int node){
		return token(node) != null;
	}

	public Map<String, Object> attributes(int node){
		checkNode(node);
		return attributes.get(node);
	}

	/**
	 * Ids of all reachable nodes in pre order.
	 */
	public List<Integer> nodes(){
		List<Integer> ret = new ArrayList<>();
		if (root == NO_NODE){
			return ret;
		}
		Deque<Integer> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()){
			int node = stack.pop();
			ret.add(node);
			List<Integer> cs = children.get(node);
			for (int i = cs.size() - 1; i >= 0; i--){
				stack.push(cs.get(i));
			}
		}
		return ret;
	}

	/**
	 * Ids of all reachable nodes with the passed name, in pre order.
	 */
	public List<Integer> findAll(String name){
		return nodes().stream().filter(n -> is(n, name)).collect(Collectors.toList());
	}

	public int size(){
		return nodes().size();
	}

	/**
	 * Replaces a node with a single child in its parent by this child.
	 *
	 * @throws IllegalStateException if the node hasn't exactly one child
	 */
	public void reduceRoot(int node){
		if (degree(node) != 1){
			throw new IllegalStateException(String.format("Can't reduce %s with %d children", name(node), degree(node)));
		}
		int child = child(node, 0);
		replace(node, child);
		children.get(node).clear();
	}

	/**
	 * Removes a node and puts its children at its position in its parent.
	 */
	public void removeRoot(int node){
		int parent = parent(node);
		if (parent == NO_NODE){
			if (node == root && degree(node) == 1){
				reduceRoot(node);
				return;
			}
			throw new IllegalStateException("Can't splice the children of the root or of an excised node " + name(node));
		}
		List<Integer> siblings = children.get(parent);
		int index = siblings.indexOf(node);
		List<Integer> moved = new ArrayList<>(children.get(node));
		siblings.remove(index);
		siblings.addAll(index, moved);
		for (int child : moved){
			parents.set(child, parent);
		}
		children.get(node).clear();
		parents.set(node, NO_NODE);
	}

	/**
	 * Excises a node (with its subtree) from its parent.
	 */
	public void deleteNode(int node){
		checkNode(node);
		if (node == root){
			root = NO_NODE;
		}
		detach(node);
	}

	/**
	 * Puts the replacement at the position of the node in the node's parent (or makes it the root).
	 * The replacement is detached from its former parent.
	 */
	public void replace(int node, int replacement){
		checkNode(node);
		detach(replacement);
		int parent = parent(node);
		if (parent == NO_NODE){
			if (node == root){
				setRoot(replacement);
			}
			return;
		}
		List<Integer> siblings = children.get(parent);
		siblings.set(siblings.indexOf(node), replacement);
		parents.set(replacement, parent);
		parents.set(node, NO_NODE);
	}

	private void detach(int node){
		int parent = parents.get(node);
		if (parent != NO_NODE){
			children.get(parent).remove(Integer.valueOf(node));
			parents.set(node, NO_NODE);
		}
	}

	/**
	 * Turns a leaf into an internal node without children, it keeps its name and attributes.
	 */
	public void makeTreeNode(int node){
		checkNode(node);
		tokens.set(node, null);
	}

	/**
	 * Sets the children of a node, the new children are detached from their former parents.
	 */
	public void setChildren(int node, List<Integer> newChildren){
		checkNode(node);
		List<Integer> kept = new ArrayList<>(newChildren);
		for (int child : new ArrayList<>(children.get(node))){
			detach(child);
		}
		for (int child : kept){
			detach(child);
			children.get(node).add(child);
			parents.set(child, node);
		}
	}

	public Node node(int id){
		checkNode(id);
		return new Node(id);
	}

	public Node rootNode(){
		return root == NO_NODE ? null : node(root);
	}

	private void checkNode(int node){
		if (node < 0 || node >= names.size()){
			throw new IllegalArgumentException("Unknown node " + node);
		}
	}

	/**
	 * S-expression of the tree, leaves are written as their lexemes.
	 */
	@Override
	public String toString() {
		return root == NO_NODE ? "()" : toString(root);
	}

	public String toString(int node){
		if (isLeaf(node)){
			return name(node) + "(" + token(node).lexeme + ")";
		}
		StringBuilder builder = new StringBuilder();
		builder.append("(").append(name(node));
		for (int child : children(node)){
			builder.append(" ").append(toString(child));
		}
		builder.append(")");
		return builder.toString();
	}

	public String toPrettyString(){
		return root == NO_NODE ? "()" : toPrettyString(root, "", "\t");
	}

	public String toPrettyString(int node, String indent, String incr){
		if (isLeaf(node)){
			return indent + toString(node);
		}
		StringBuilder builder = new StringBuilder();
		builder.append(indent).append("(").append(name(node));
		for (int child : children(node)){
			builder.append("\n").append(toPrettyString(child, indent + incr, incr));
		}
		builder.append(")");
		return builder.toString();
	}

	/**
	 * Read only view of a node
	 */
	public class Node {

		public final int id;

		private Node(int id) {
			this.id = id;
		}

		public String name(){
			return Tree.this.name(id);
		}

		public List<Node> children(){
			return Tree.this.children(id).stream().map(c -> new Node(c)).collect(Collectors.toList());
		}

		public Node child(int index){
			return new Node(Tree.this.child(id, index));
		}

		public int degree(){
			return Tree.this.degree(id);
		}

		public Node parent(){
			int parent = Tree.this.parent(id);
			return parent == NO_NODE ? null : new Node(parent);
		}

		public Token token(){
			return Tree.this.token(id);
		}

		public boolean isLeaf(){
			return Tree.this.isLeaf(id);
		}

		public Map<String, Object> attributes(){
			return Collections.unmodifiableMap(Tree.this.attributes(id));
		}

		public Object attribute(String attr){
			return Tree.this.attributes(id).get(attr);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Node && ((Node)obj).id == id && ((Node)obj).tree() == Tree.this;
		}

		private Tree tree(){
			return Tree.this;
		}

		@Override
		public int hashCode() {
			return id;
		}

		@Override
		public String toString() {
			return Tree.this.toString(id);
		}
	}
}
