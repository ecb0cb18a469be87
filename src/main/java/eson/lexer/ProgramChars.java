package eson.lexer;

/**
 * The characters of the canonical program that still have to be accounted for by tokens.
 * Consumption happens strictly from the front.
 */
class ProgramChars {

	private final String program;

	private int position = 0;

	ProgramChars(String program) {
		this.program = program;
	}

	/**
	 * Removes the lexeme from the front.
	 *
	 * @throws TokenizationIncomplete if the remaining characters don't start with the lexeme
	 */
	void consume(String lexeme){
		if (!program.startsWith(lexeme, position)){
			throw new TokenizationIncomplete(remaining(), lexeme);
		}
		position += lexeme.length();
	}

	String remaining(){
		return program.substring(position);
	}

	boolean isEmpty(){
		return position == program.length();
	}

	/**
	 * @throws TokenizationIncomplete if characters remain
	 */
	void verifyConsumed(){
		if (!isEmpty()){
			throw new TokenizationIncomplete(remaining());
		}
	}
}
