package rpcgen.definition;

/**
 * Thrown when a name must be dereferenced during generation, but no matching
 * definition exists.
 */
@SuppressWarnings("serial")
public class UnresolvedTypeReferenceException extends RuntimeException {

	public final String reference;
	public final String referencedFrom;

	public UnresolvedTypeReferenceException(String reference, String referencedFrom) {
		super("Unresolved reference '" + reference + "' in '" + referencedFrom + "'");
		this.reference = reference;
		this.referencedFrom = referencedFrom;
	}
}
