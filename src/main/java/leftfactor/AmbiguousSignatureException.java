package leftfactor;

/**
 * Two different prefixes concatenate to the same signature string,
 * so a string keyed view of the factoring plan isn't possible.
 */
public class AmbiguousSignatureException extends LeftFactorException {

	public final String signature;

	public AmbiguousSignatureException(String signature, String first, String second) {
		super(String.format("The prefixes '%s' and '%s' both have the signature \"%s\"", first, second, signature));
		this.signature = signature;
	}
}
