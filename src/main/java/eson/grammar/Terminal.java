package eson.grammar;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import eson.lexer.InvalidLexeme;
import eson.lexer.Token;

/**
 * A terminal rule that matches a prefix of a string, either literally or with a regular expression.
 * Terminals don't have inherited attributes.
 */
public class Terminal extends Rule {

	private final Pattern pattern;

	private final SemanticActions actions;

	public Terminal(String name, Pattern pattern) {
		this(name, pattern, Collections.emptyList(), new SemanticActions());
	}

	private Terminal(String name, Pattern pattern, List<String> sAttr, SemanticActions actions) {
		super(name, sAttr, Collections.emptyList());
		this.pattern = pattern;
		this.actions = actions;
	}

	public static Terminal literal(String name, String literal){
		return new Terminal(name, Pattern.compile(Pattern.quote(literal)));
	}

	public static Terminal pattern(String name, String regex){
		return new Terminal(name, Pattern.compile(regex));
	}

	@Override
	public boolean isTerminal() {
		return true;
	}

	/**
	 * Matches a non empty prefix of the input.
	 *
	 * @return the matched prefix
	 */
	public Optional<String> match(String input){
		Matcher matcher = pattern.matcher(input);
		if (matcher.lookingAt() && matcher.end() > 0){
			return Optional.of(matcher.group());
		}
		return Optional.empty();
	}

	/**
	 * Does this terminal match the whole input?
	 */
	public boolean matchesFully(String input){
		return match(input).map(m -> m.length() == input.length()).orElse(false);
	}

	/**
	 * Creates a token for a lexeme and evaluates its synthesized attributes. Attributes without
	 * a semantic action have the lexeme as their value.
	 */
	public Token makeToken(String lexeme, Environment env){
		Token token = new Token(lexeme, name);
		for (String attr : sAttr){
			Optional<SemanticAction> action = actions.get(name, attr);
			token.setAttribute(attr, action.isPresent() ? action.get().evaluate(lexeme, env) : lexeme);
		}
		return token;
	}

	/**
	 * Creates a token for the prefix of the input this terminal matches.
	 *
	 * @throws InvalidLexeme if the terminal doesn't match the input
	 */
	public Token matchToken(String input, Environment env){
		String lexeme = match(input).orElseThrow(() -> new InvalidLexeme(input, Collections.singletonList(name)));
		return makeToken(lexeme, env);
	}

	public Pattern getPattern(){
		return pattern;
	}

	@Override
	Terminal withAttributes(List<String> sAttr, List<String> iAttr, SemanticActions actions) {
		if (!iAttr.isEmpty()){
			throw new GrammarError(String.format("Terminal %s can't have inherited attributes %s", name, iAttr));
		}
		return new Terminal(name, pattern, sAttr, actions);
	}

	@Override
	public String toString() {
		return "<" + name + ">";
	}
}
