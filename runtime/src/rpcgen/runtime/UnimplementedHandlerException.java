package rpcgen.runtime;

import rpcgen.message.Role;

@SuppressWarnings("serial")
public class UnimplementedHandlerException extends RuntimeException {

	public final Role role;
	public final String handlerId;
	public final String method;

	public UnimplementedHandlerException(Role role, String handlerId, String method) {
		super(role.className + "." + handlerId + " (for '" + method + "') is not implemented");
		this.role = role;
		this.handlerId = handlerId;
		this.method = method;
	}
}
