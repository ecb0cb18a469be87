package eson.parser;

import eson.LocatedEsonException;
import eson.lexer.Token;

/**
 * An error thrown after encountering a syntax error
 */
public class SyntaxError extends LocatedEsonException {

	/**
	 * Name of the rule that failed
	 */
	public final String rule;

	public SyntaxError(Token errorToken, String rule, String message) {
		super(errorToken, String.format("Error at line %d in %s: %s, got %s", errorToken == null ? 0 : errorToken.line(),
				rule, message, errorToken == null ? "no tokens" : errorToken));
		this.rule = rule;
	}
}
