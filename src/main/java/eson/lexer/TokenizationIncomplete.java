package eson.lexer;

/**
 * The tokens don't account for every character of the program. This is a bug in the grammar
 * or the tokenizer, not in the program.
 */
public class TokenizationIncomplete extends LexerError {

	/**
	 * Characters that weren't consumed
	 */
	public final String remaining;

	public TokenizationIncomplete(String remaining) {
		super("The sequence of eson tokens generated by the compiler only partially represents the program "
				+ "(unconsumed: " + remaining + "). Compilation cannot continue; please file a bug report "
				+ "providing the eson program tried.");
		this.remaining = remaining;
	}

	/**
	 * @param lexeme token that doesn't match the front of the remaining characters
	 */
	public TokenizationIncomplete(String remaining, String lexeme) {
		super("The eson token " + lexeme + " doesn't match the program at \"" + remaining + "\". Compilation "
				+ "cannot continue; please file a bug report providing the eson program tried.");
		this.remaining = remaining;
	}
}
