package leftfactor;

/**
 * Base class of the errors reported to the caller of the library.
 */
public class LeftFactorException extends RuntimeException {

	public LeftFactorException(String message) {
		super(message);
	}

	public LeftFactorException(String message, Throwable cause) {
		super(message, cause);
	}
}
