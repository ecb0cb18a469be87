package eson;

/**
 * Thrown when the nesting of a program exceeds the configured limit of a pass.
 */
public class NestingDepthExceeded extends EsonException {

	public final int limit;

	public NestingDepthExceeded(String pass, int limit) {
		super(String.format("The %s exceeds the maximum nesting depth of %d", pass, limit));
		this.limit = limit;
	}
}
