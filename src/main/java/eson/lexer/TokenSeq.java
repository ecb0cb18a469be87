package eson.lexer;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ordered sequence of tokens, in the order of their occurrence in the program.
 *
 * Tokens are only appended, never reordered.
 */
public class TokenSeq implements Iterable<Token> {

	public static final String SPECIAL_FORM_IDENTIFIER = "special_form_identifier";

	private final List<Token> tokens;

	public TokenSeq(){
		this(new ArrayList<>());
	}

	public TokenSeq(List<Token> tokens){
		this.tokens = new ArrayList<>(tokens);
	}

	public static TokenSeq of(Token... tokens){
		return new TokenSeq(Arrays.asList(tokens));
	}

	public TokenSeq push(Token token){
		tokens.add(token);
		return this;
	}

	public Token get(int index){
		return tokens.get(index);
	}

	public Token last(){
		return tokens.get(tokens.size() - 1);
	}

	public int size(){
		return tokens.size();
	}

	public boolean isEmpty(){
		return tokens.isEmpty();
	}

	public List<String> names(){
		return tokens.stream().map(t -> t.name).collect(Collectors.toList());
	}

	/**
	 * Concatenation of all lexemes.
	 */
	public String lexemes(){
		return tokens.stream().map(t -> t.lexeme).collect(Collectors.joining());
	}

	/**
	 * Returns the prefix of this sequence that ends with the first occurrence of the passed
	 * token names (as a contiguous run).
	 *
	 * @param names token names in their expected order
	 * @return the prefix up to and including the matched run or nothing if the run doesn't occur
	 */
	public Optional<TokenSeq> takeWithSeq(String... names){
		if (names.length == 0){
			return Optional.empty();
		}
		for (int end = names.length; end <= tokens.size(); end++){
			if (endsWith(end, names)){
				return Optional.of(new TokenSeq(tokens.subList(0, end)));
			}
		}
		return Optional.empty();
	}

	/**
	 * Do the last tokens of this sequence have the passed names (in the passed order)?
	 */
	public boolean seqMatch(String... names){
		return names.length > 0 && names.length <= tokens.size() && endsWith(tokens.size(), names);
	}

	/**
	 * Do the tokens in front of index {@code end} have the passed names?
	 */
	private boolean endsWith(int end, String[] names){
		int start = end - names.length;
		for (int i = 0; i < names.length; i++){
			if (!tokens.get(start + i).is(names[i])){
				return false;
			}
		}
		return true;
	}

	/**
	 * Checks that every special form identifier in this sequence names a known special form.
	 *
	 * @param specialForms names of the known special forms (without the leading "&amp;")
	 * @return this sequence
	 * @throws UnknownSpecialForm for the first unknown special form
	 */
	public TokenSeq verifySpecialForms(Set<String> specialForms){
		for (Token token : tokens){
			if (token.is(SPECIAL_FORM_IDENTIFIER) && !specialForms.contains(specialFormName(token))){
				throw new UnknownSpecialForm(token, specialFormName(token), specialForms);
			}
		}
		return this;
	}

	static String specialFormName(Token token){
		String lexeme = token.lexeme;
		if (lexeme.startsWith("\"&") && lexeme.endsWith("\"") && lexeme.length() >= 3){
			return lexeme.substring(2, lexeme.length() - 1);
		}
		return lexeme;
	}

	public Stream<Token> stream(){
		return tokens.stream();
	}

	@Override
	public Iterator<Token> iterator() {
		return Collections.unmodifiableList(tokens).iterator();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TokenSeq && ((TokenSeq)obj).tokens.equals(tokens);
	}

	@Override
	public int hashCode() {
		return tokens.hashCode();
	}

	@Override
	public String toString() {
		return tokens.toString();
	}
}
