package eson.json;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import eson.EsonException;
import eson.MalformedProgram;

/**
 * Reads programs as JSON and writes their canonical compact form.
 *
 * Floating point numbers are kept as exact decimals, so the canonical form of a number is its
 * original text (modulo exponent notation).
 */
public class Json {

	private static final Logger LOG = Logger.getLogger("eson.json");

	private static final ObjectMapper MAPPER = new ObjectMapper()
			.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
			.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));

	/**
	 * Parses a JSON document.
	 *
	 * @throws MalformedProgram if the text isn't valid JSON
	 */
	public static JsonNode parse(String content){
		try {
			JsonNode node = MAPPER.readTree(content);
			if (node == null || node.isMissingNode()){
				throw new MalformedProgram("no JSON value found");
			}
			checkNumbers(node);
			return node;
		} catch (JsonProcessingException e) {
			LOG.log(Level.FINE, "Error reading JSON data", e);
			throw new MalformedProgram(e.getOriginalMessage(), e);
		}
	}

	/**
	 * Jackson reads numbers beyond the range of a double as infinite doubles, their canonical
	 * form would be a string.
	 *
	 * @throws MalformedProgram for the first non finite number
	 */
	private static void checkNumbers(JsonNode root){
		Deque<JsonNode> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()){
			JsonNode node = stack.pop();
			if (node.isFloatingPointNumber() && !node.isBigDecimal() && !Double.isFinite(node.doubleValue())){
				throw new MalformedProgram("the number " + node.asText() + " is out of range");
			}
			node.elements().forEachRemaining(stack::push);
		}
	}

	/**
	 * Compact serialization without any whitespace.
	 */
	public static String canonical(JsonNode node){
		try {
			return MAPPER.writeValueAsString(node);
		} catch (JsonProcessingException e) {
			throw new EsonException("Can't serialize JSON value " + node, e);
		}
	}

	/**
	 * Delimits and escapes a string the way it appears in the canonical form.
	 */
	public static String quote(String string){
		return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(string)) + "\"";
	}

	/**
	 * Reverses {@link #quote(String)}.
	 *
	 * @throws IllegalArgumentException if the argument isn't a JSON string literal
	 */
	public static String unquote(String delimited){
		try {
			return MAPPER.readValue(delimited, String.class);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Not a JSON string: " + delimited, e);
		}
	}
}
