package eson.grammar;

import eson.lexer.Token;
import eson.lexer.TokenSeq;

/**
 * Called for every token before it's appended to the token sequence.
 */
@FunctionalInterface
public interface TokenHook {

	/**
	 * @param env environment of the current compilation
	 * @param token new token, its attributes can still be set
	 * @param seq tokens emitted so far (without the new token)
	 */
	void evaluate(Environment env, Token token, TokenSeq seq);
}
