package eson;

/**
 * Base class of all errors raised while compiling an eson program.
 */
public class EsonException extends RuntimeException {

	public EsonException(String message) {
		super(message);
	}

	public EsonException(String message, Throwable cause) {
		super(message, cause);
	}
}
