package eson;

/**
 * The program text isn't a JSON object.
 */
public class MalformedProgram extends EsonException {

	public static final String MALFORMED_PROGRAM = "Program is malformed";

	public MalformedProgram(String reason) {
		super(MALFORMED_PROGRAM + ": " + reason);
	}

	public MalformedProgram(String reason, Throwable cause) {
		super(MALFORMED_PROGRAM + ": " + reason, cause);
	}
}
