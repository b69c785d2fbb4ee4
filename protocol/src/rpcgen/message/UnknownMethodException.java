package rpcgen.message;

/**
 * A wire method was looked up in a dispatch table that has no entry for it.
 */
@SuppressWarnings("serial")
public class UnknownMethodException extends RuntimeException {

	public final Role role;
	public final String method;

	public UnknownMethodException(Role role, String method) {
		super("No handler for method '" + method + "' in " + role.className);
		this.role = role;
		this.method = method;
	}
}
