package rpcgen.message;

/**
 * The two symmetric peers of the protocol. Either may send or receive,
 * depending on each message's direction.
 */
public enum Role {
	INITIATOR("Initiator"), RESPONDER("Responder");

	public final String className;

	private Role(String className) {
		this.className = className;
	}

	public Role opposite() {
		return this == INITIATOR ? RESPONDER : INITIATOR;
	}
}
