package eson.lexer;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A structural symbol of a JSON document, in the order it occurs in the canonical form.
 */
public class JsonSymbol {

	public enum Kind {
		OBJECT_START,
		OBJECT_END,
		ARRAY_START,
		ARRAY_END,
		KEY,
		COLON,
		/**
		 * Scalar value (string, number, boolean or null)
		 */
		VALUE,
		/**
		 * Comma between array elements
		 */
		ARRAY_COMMA,
		/**
		 * Comma between object members
		 */
		MEMBER_COMMA
	}

	/**
	 * Characters of the symbol, the raw key for keys, null for values
	 */
	public final String lexeme;

	public final Kind kind;

	/**
	 * The scalar value, only set for values
	 */
	public final JsonNode value;

	private JsonSymbol(String lexeme, Kind kind, JsonNode value) {
		this.lexeme = lexeme;
		this.kind = kind;
		this.value = value;
	}

	public static JsonSymbol of(String lexeme, Kind kind){
		return new JsonSymbol(lexeme, kind, null);
	}

	public static JsonSymbol key(String key){
		return new JsonSymbol(key, Kind.KEY, null);
	}

	public static JsonSymbol value(JsonNode value){
		return new JsonSymbol(null, Kind.VALUE, value);
	}

	@Override
	public String toString() {
		return kind == Kind.VALUE ? kind + "(" + value + ")" : kind + "(" + lexeme + ")";
	}
}
