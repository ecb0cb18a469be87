package eson;

import eson.lexer.Token;

/**
 * An error that can be traced back to a token of the program.
 */
public class LocatedEsonException extends EsonException {

	public final Token errorToken;
	/**
	 * Line of the error token, 0 if unknown
	 */
	public final int errorLine;

	public LocatedEsonException(Token errorToken, String message) {
		super(message);
		this.errorToken = errorToken;
		if (errorToken != null) {
			this.errorLine = errorToken.line();
		} else {
			this.errorLine = 0;
		}
	}
}
