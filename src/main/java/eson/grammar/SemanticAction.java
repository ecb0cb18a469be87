package eson.grammar;

/**
 * Computes the value of a synthesized attribute of a token.
 */
@FunctionalInterface
public interface SemanticAction {

	/**
	 * @param lexeme matched text of the token
	 * @param env environment of the current compilation
	 * @return attribute value
	 */
	Object evaluate(String lexeme, Environment env);
}
