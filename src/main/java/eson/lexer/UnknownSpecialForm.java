package eson.lexer;

import java.util.Set;
import java.util.TreeSet;

import eson.LocatedEsonException;

/**
 * A special form identifier names a special form the grammar doesn't know.
 */
public class UnknownSpecialForm extends LocatedEsonException {

	public final String specialForm;

	public UnknownSpecialForm(Token errorToken, String specialForm, Set<String> knownForms) {
		super(errorToken, String.format("Error at line %d: unknown special form \"&%s\", expected one of %s",
				errorToken.line(), specialForm, new TreeSet<>(knownForms)));
		this.specialForm = specialForm;
	}
}
