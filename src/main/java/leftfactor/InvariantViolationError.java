package leftfactor;

/**
 * Internal consistency of a prefix tree or its factoring table is broken.
 * Valid input never causes this, it signals a bug in the algorithm.
 */
public class InvariantViolationError extends Error {

	public InvariantViolationError(String message) {
		super(message);
	}
}
