package eson.lexer;

import eson.EsonException;

/**
 * An error that occurred while turning a program into tokens.
 */
public class LexerError extends EsonException {

	public LexerError(String message) {
		super(message);
	}
}
