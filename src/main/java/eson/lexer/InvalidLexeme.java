package eson.lexer;

import java.util.List;

/**
 * A part of the program doesn't match any of the candidate terminals.
 */
public class InvalidLexeme extends LexerError {

	/**
	 * The string that couldn't be matched
	 */
	public final String lexeme;

	public InvalidLexeme(String lexeme, List<String> candidates) {
		super(String.format("The string - \n%s\ncould not be broken up into tokens. It does not match any of the valid tokens in eson %s.",
				lexeme, candidates));
		this.lexeme = lexeme;
	}
}
