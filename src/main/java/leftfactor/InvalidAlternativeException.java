package leftfactor;

import leftfactor.grammar.Production;

/**
 * Thrown when an alternative can't be inserted into a prefix tree (it has no elements).
 */
public class InvalidAlternativeException extends LeftFactorException {

	public final Production alternative;

	public InvalidAlternativeException(Production alternative, String message) {
		super(String.format("Invalid alternative %s: %s", alternative, message));
		this.alternative = alternative;
	}
}
