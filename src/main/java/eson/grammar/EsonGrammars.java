package eson.grammar;

import java.math.BigDecimal;
import java.util.*;

import eson.json.Json;
import eson.lexer.Token;
import eson.lexer.TokenSeq;

import static eson.grammar.AttributeDeclaration.*;

/**
 * The grammar of eson.
 *
 * <pre>
 * program               := program_start [declaration_list] program_end
 * declaration_list      := (call | attribute) declaration_more
 * declaration_more      := {declaration_more_once}
 * declaration_more_once := declaration_divider (call | attribute)
 * attribute             := attribute_name colon VALUE
 * call                  := (special_form_identifier | unreserved_procedure_identifier) colon VALUE
 * array                 := array_start [element_list] array_end
 * element_list          := VALUE element_more
 * element_more          := {element_more_once}
 * element_more_once     := element_divider VALUE
 * string                := string_delimiter {variable_identifier | word_form} string_delimiter
 * VALUE                 := number | true | false | null | string | array | program
 * </pre>
 *
 * Nested objects are programs too.
 */
public class EsonGrammars {

	public static final String VALUE = "value";

	public static final String BINDING = "binding";

	/**
	 * Special forms known to the compiler
	 */
	public static final Set<String> SPECIAL_FORMS =
			Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList("let", "ref", "doc")));

	/**
	 * Tokens after which the next token starts a new line
	 */
	private static final Set<String> LINE_BREAKING =
			new HashSet<>(Arrays.asList("program_start", "array_start", "declaration_divider", "element_divider"));

	private static final Set<String> SCALARS = new HashSet<>(Arrays.asList("number", "true", "false", "null"));

	private static final String CURRENT_LINE = "current_line";
	private static final String IN_STRING = "in_string";
	private static final String PENDING_BINDING = "pending_binding";
	private static final String STRING_CONTENT = "string_content";

	/**
	 * The context free part of the eson grammar, without attributes and actions
	 */
	public static Grammar tokenizerCfg(){
		GrammarBuilder b = new GrammarBuilder();
		b.literal("program_start", "{");
		b.literal("program_end", "}");
		b.literal("array_start", "[");
		b.literal("array_end", "]");
		b.literal("colon", ":");
		b.literal("element_divider", ",");
		b.literal("declaration_divider", ",");
		b.literal("true", "true");
		b.literal("false", "false");
		b.literal("null", "null");
		b.pattern("number", "-?(?:0|[1-9][0-9]*)(?:\\.[0-9]+)?(?:[eE][+-]?[0-9]+)?");
		b.pattern("special_form_identifier", "\"&[a-z_]+\"");
		b.pattern("unreserved_procedure_identifier", "\"&[A-Za-z_][\\w.\\-]*\"");
		b.pattern("attribute_name", "\"(?:[^\"\\\\]|\\\\.)*\"");
		b.literal("string_delimiter", "\"");
		b.pattern("variable_identifier", "\\$[A-Za-z_][\\w]*");
		b.pattern("word_form", "(?:[^\"$\\\\]|\\\\.|\\$(?![A-Za-z_]))+");

		String value = b.or("number", "true", "false", "null", "string", "array", "program");
		b.seq("program", "program_start", b.opt("declaration_list"), "program_end");
		b.seq("declaration_list", b.or("call", "attribute"), "declaration_more");
		b.repeat("declaration_more", "declaration_more_once");
		b.seq("declaration_more_once", "declaration_divider", b.or("call", "attribute"));
		b.seq("attribute", "attribute_name", "colon", value);
		b.seq("call", b.or("special_form_identifier", "unreserved_procedure_identifier"), "colon", value);
		b.seq("array", "array_start", b.opt("element_list"), "array_end");
		b.seq("element_list", value, "element_more");
		b.repeat("element_more", "element_more_once");
		b.seq("element_more_once", "element_divider", value);
		b.seq("string", "string_delimiter", b.star(b.or("variable_identifier", "word_form")), "string_delimiter");
		b.specialForms(SPECIAL_FORMS.toArray(new String[0]));
		return b.build("program");
	}

	public static List<AttributeDeclaration> attributes(){
		return Arrays.asList(
				sAttr(VALUE, "number", "true", "false", "null", "word_form", "variable_identifier",
						"attribute_name", "special_form_identifier", "unreserved_procedure_identifier"),
				sAttr(BINDING, "variable_identifier"),
				iAttr(Token.LINE_NO, ALL));
	}

	/**
	 * Attribute actions, line numbering and variable bindings
	 */
	public static SemanticActions actions(){
		return new SemanticActions()
				.on("number", VALUE, (lexeme, env) -> new BigDecimal(lexeme))
				.on("true", VALUE, (lexeme, env) -> Boolean.TRUE)
				.on("false", VALUE, (lexeme, env) -> Boolean.FALSE)
				.on("null", VALUE, (lexeme, env) -> null)
				.on("word_form", VALUE, (lexeme, env) -> Json.unquote("\"" + lexeme + "\""))
				.on("attribute_name", VALUE, (lexeme, env) -> Json.unquote(lexeme))
				.on("special_form_identifier", VALUE, (lexeme, env) -> Json.unquote(lexeme))
				.on("unreserved_procedure_identifier", VALUE, (lexeme, env) -> Json.unquote(lexeme))
				.on("variable_identifier", BINDING, (lexeme, env) -> env.lookup(lexeme.substring(1)))
				.hook(EsonGrammars::numberLines)
				.hook(EsonGrammars::recordBindings);
	}

	/**
	 * The attribute grammar used by the compiler
	 */
	public static Grammar format(){
		return tokenizerCfg().assignAttributeGrammar(Collections.singletonList(actions()), attributes());
	}

	/**
	 * Assigns each token the line it would have in a program with one declaration or element per line.
	 */
	static void numberLines(Environment env, Token token, TokenSeq seq){
		int line = env.get(CURRENT_LINE, 1);
		token.setAttribute(Token.LINE_NO, line);
		if (LINE_BREAKING.contains(token.name)){
			env.put(CURRENT_LINE, line + 1);
		}
	}

	/**
	 * Binds attribute names to their scalar or string values, so that later variable references
	 * can be resolved.
	 */
	static void recordBindings(Environment env, Token token, TokenSeq seq){
		boolean inString = env.get(IN_STRING, false);
		if (token.is("string_delimiter")){
			if (inString){
				if (env.contains(PENDING_BINDING)){
					env.bind((String)env.remove(PENDING_BINDING), env.remove(STRING_CONTENT).toString());
				}
				env.put(IN_STRING, false);
			} else {
				env.put(IN_STRING, true);
				if (seq.seqMatch("attribute_name", "colon")){
					env.put(PENDING_BINDING, attributeName(seq));
					env.put(STRING_CONTENT, new StringBuilder());
				}
			}
		} else if (inString){
			if (env.contains(STRING_CONTENT)){
				StringBuilder content = (StringBuilder)env.get(STRING_CONTENT);
				content.append(stringPart(env, token));
			}
		} else if (SCALARS.contains(token.name) && seq.seqMatch("attribute_name", "colon")){
			env.bind(attributeName(seq), scalarValue(token));
		}
	}

	/**
	 * Text of a string part, bound variables are replaced by their values
	 */
	private static String stringPart(Environment env, Token token){
		if (token.is("word_form")){
			return Json.unquote("\"" + token.lexeme + "\"");
		}
		String variable = token.lexeme.substring(1);
		return env.isBound(variable) ? String.valueOf(env.lookup(variable)) : token.lexeme;
	}

	private static String attributeName(TokenSeq seq){
		return Json.unquote(seq.get(seq.size() - 2).lexeme);
	}

	private static Object scalarValue(Token token){
		switch (token.name){
			case "number":
				return new BigDecimal(token.lexeme);
			case "true":
			case "false":
				return Boolean.valueOf(token.lexeme);
			default:
				return null;
		}
	}
}
