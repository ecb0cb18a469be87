package eson.lexer;

import java.util.*;

/**
 * A matched terminal: its lexeme, the name of the rule it matched and its evaluated attributes.
 *
 * Attributes are only set while the token is created and pushed onto a token sequence.
 */
public class Token {

	public static final String LINE_NO = "line_no";

	/**
	 * Matched text.
	 */
	public final String lexeme;

	/**
	 * Name of the matched terminal rule.
	 */
	public final String name;

	private final Map<String, Object> attributes = new LinkedHashMap<>();

	public Token(String lexeme, String name){
		this.lexeme = lexeme;
		this.name = name;
	}

	public Token(String lexeme, String name, Map<String, Object> attributes){
		this(lexeme, name);
		this.attributes.putAll(attributes);
	}

	public Map<String, Object> attributes(){
		return Collections.unmodifiableMap(attributes);
	}

	public Object attribute(String attr){
		return attributes.get(attr);
	}

	public boolean hasAttribute(String attr){
		return attributes.containsKey(attr);
	}

	public void setAttribute(String attr, Object value){
		attributes.put(attr, value);
	}

	/**
	 * Line of the token or 0 if it wasn't assigned one.
	 */
	public int line(){
		Object line = attributes.get(LINE_NO);
		return line instanceof Integer ? (Integer)line : 0;
	}

	public boolean is(String ruleName){
		return name.equals(ruleName);
	}

	@Override
	public String toString() {
		return name + "(" + lexeme + ")";
	}

	public String toSimpleString(){
		return name;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Token)){
			return false;
		}
		Token other = (Token)obj;
		return Objects.equals(lexeme, other.lexeme) && Objects.equals(name, other.name)
				&& attributes.equals(other.attributes);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lexeme, name);
	}
}
