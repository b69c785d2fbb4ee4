package rpcgen.defaults;

import rpcgen.compile.TypeExpr;

@SuppressWarnings("serial")
public class UnsupportedTypeDefaultException extends RuntimeException {

	public UnsupportedTypeDefaultException(String message) {
		super(message);
	}

	public UnsupportedTypeDefaultException(TypeExpr type, String reason) {
		this("Unable to get default value for " + type + ": " + reason);
	}
}
