package eson.grammar;

import eson.EsonException;

/**
 * A rule table or an attribute declaration is invalid.
 */
public class GrammarError extends EsonException {

	public GrammarError(String message) {
		super(message);
	}
}
