package eson.lexer;

import java.util.*;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;

import eson.Config;
import eson.MalformedProgram;
import eson.NestingDepthExceeded;
import eson.grammar.Environment;
import eson.grammar.Grammar;
import eson.grammar.Terminal;
import eson.json.Json;

import static eson.lexer.JsonSymbol.Kind.*;

/**
 * Converts an eson program into a sequence of eson tokens.
 *
 * The program is parsed as JSON and walked in the order of its canonical compact form. Every
 * structural symbol becomes one or more tokens, every token consumes its lexeme from the front of
 * the canonical form. After the walk the canonical form has to be consumed completely.
 */
public class Tokenizer {

	private static final Logger LOG = Logger.getLogger("eson.tokenizer");

	/**
	 * Candidate terminals for object keys, the first matching the whole key wins
	 */
	public static final List<String> KEY_TERMINALS = Collections.unmodifiableList(Arrays.asList(
			"special_form_identifier", "unreserved_procedure_identifier", "attribute_name"));

	/**
	 * Candidate terminals for the parts of string values, the first matching a prefix wins
	 */
	public static final List<String> STRING_TERMINALS = Collections.unmodifiableList(Arrays.asList(
			"string_delimiter", "variable_identifier", "word_form"));

	private final Grammar grammar;

	private final int maxNestingDepth;

	public Tokenizer(Grammar grammar) {
		this(grammar, Config.maxNestingDepth());
	}

	public Tokenizer(Grammar grammar, int maxNestingDepth) {
		this.grammar = grammar;
		this.maxNestingDepth = maxNestingDepth;
	}

	/**
	 * Convert an eson program into a sequence of eson tokens
	 *
	 * @param programText JSON text of the program
	 * @param grammar grammar with the eson terminals
	 * @return token sequence
	 * @throws MalformedProgram if the program isn't a JSON object
	 * @throws InvalidLexeme if a key or value doesn't match any candidate terminal
	 * @throws TokenizationIncomplete if the tokens don't contain all characters of the program
	 */
	public static TokenSeq tokenizeProgram(String programText, Grammar grammar){
		return new Tokenizer(grammar).tokenize(Json.parse(programText));
	}

	/**
	 * Convert a parsed eson program into a sequence of eson tokens
	 *
	 * @see #tokenizeProgram(String, Grammar)
	 */
	public TokenSeq tokenize(JsonNode program){
		if (!program.isObject()){
			throw new MalformedProgram("the program has to be a JSON object, got " + program.getNodeType());
		}
		ProgramChars chars = new ProgramChars(Json.canonical(program));
		List<JsonSymbol> symbols = new ArrayList<>();
		objectToJsonSymbols(program, symbols, 1);
		LOG.fine(() -> String.format("Tokenizing %d JSON symbols", symbols.size()));
		Run run = new Run(chars, grammar.envInit());
		for (JsonSymbol symbol : symbols){
			run.tokenize(symbol);
		}
		chars.verifyConsumed();
		LOG.fine(() -> String.format("Created %d tokens", run.seq.size()));
		return run.seq;
	}

	private void objectToJsonSymbols(JsonNode object, List<JsonSymbol> symbols, int depth){
		checkDepth(depth);
		symbols.add(JsonSymbol.of("{", OBJECT_START));
		Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
		boolean first = true;
		while (fields.hasNext()){
			Map.Entry<String, JsonNode> field = fields.next();
			if (!first){
				symbols.add(JsonSymbol.of(",", MEMBER_COMMA));
			}
			symbols.add(JsonSymbol.key(field.getKey()));
			symbols.add(JsonSymbol.of(":", COLON));
			valueToJsonSymbols(field.getValue(), symbols, depth);
			first = false;
		}
		symbols.add(JsonSymbol.of("}", OBJECT_END));
	}

	private void arrayToJsonSymbols(JsonNode array, List<JsonSymbol> symbols, int depth){
		checkDepth(depth);
		symbols.add(JsonSymbol.of("[", ARRAY_START));
		for (int i = 0; i < array.size(); i++){
			if (i > 0){
				symbols.add(JsonSymbol.of(",", ARRAY_COMMA));
			}
			valueToJsonSymbols(array.get(i), symbols, depth);
		}
		symbols.add(JsonSymbol.of("]", ARRAY_END));
	}

	private void valueToJsonSymbols(JsonNode value, List<JsonSymbol> symbols, int depth){
		switch (value.getNodeType()){
			case OBJECT:
				objectToJsonSymbols(value, symbols, depth + 1);
				break;
			case ARRAY:
				arrayToJsonSymbols(value, symbols, depth + 1);
				break;
			case STRING:
			case NUMBER:
			case BOOLEAN:
			case NULL:
				symbols.add(JsonSymbol.value(value));
				break;
			case BINARY:
			case POJO:
			case MISSING:
				throw new MalformedProgram("unsupported JSON value " + value);
		}
	}

	private void checkDepth(int depth){
		if (depth > maxNestingDepth){
			throw new NestingDepthExceeded("program", maxNestingDepth);
		}
	}

	/**
	 * State of a single tokenization
	 */
	private class Run {

		final ProgramChars chars;
		final Environment env;
		final TokenSeq seq = new TokenSeq();

		Run(ProgramChars chars, Environment env) {
			this.chars = chars;
			this.env = env;
		}

		void tokenize(JsonSymbol symbol){
			switch (symbol.kind){
				case OBJECT_START:
					fixed("program_start", symbol);
					break;
				case OBJECT_END:
					fixed("program_end", symbol);
					break;
				case ARRAY_START:
					fixed("array_start", symbol);
					break;
				case ARRAY_END:
					fixed("array_end", symbol);
					break;
				case COLON:
					fixed("colon", symbol);
					break;
				case ARRAY_COMMA:
					fixed("element_divider", symbol);
					break;
				case MEMBER_COMMA:
					fixed("declaration_divider", symbol);
					break;
				case KEY:
					lex(KEY_TERMINALS, Json.quote(symbol.lexeme), true);
					break;
				case VALUE:
					tokenizeValue(symbol.value);
					break;
			}
		}

		private void fixed(String terminal, JsonSymbol symbol){
			update(grammar.getTerminal(terminal).makeToken(symbol.lexeme, env));
		}

		private void tokenizeValue(JsonNode value){
			switch (value.getNodeType()){
				case BOOLEAN:
					update(grammar.getTerminal(value.booleanValue() ? "true" : "false")
							.makeToken(Json.canonical(value), env));
					break;
				case NUMBER:
					update(grammar.getTerminal("number").makeToken(Json.canonical(value), env));
					break;
				case NULL:
					update(grammar.getTerminal("null").makeToken("null", env));
					break;
				case STRING:
					tokenizeString(Json.quote(value.textValue()));
					break;
				default:
					throw new MalformedProgram("unexpected JSON value " + value);
			}
		}

		/**
		 * Strings may combine words and variable references, each part is matched separately
		 * until the whole delimited string is consumed.
		 */
		private void tokenizeString(String string){
			String rest = string;
			while (!rest.isEmpty()){
				Token token = lex(STRING_TERMINALS, rest, false);
				rest = rest.substring(token.lexeme.length());
			}
		}

		/**
		 * Matches the candidates in order and emits the token of the first matching one.
		 *
		 * @param whole does the match have to cover the whole string?
		 */
		private Token lex(List<String> candidates, String string, boolean whole){
			for (String candidate : candidates){
				Terminal terminal = grammar.getTerminal(candidate);
				Optional<String> match = terminal.match(string);
				if (match.isPresent() && (!whole || match.get().length() == string.length())){
					Token token = terminal.makeToken(match.get(), env);
					update(token);
					return token;
				}
			}
			throw new InvalidLexeme(string, candidates);
		}

		/**
		 * Consumes the lexeme, evaluates the token hooks and appends the token.
		 */
		private void update(Token token){
			chars.consume(token.lexeme);
			grammar.evalSAttributes(env, token, seq);
			seq.push(token);
			LOG.finest(() -> "Token " + token);
		}
	}
}
