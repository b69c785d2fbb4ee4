package rpcgen.model;

import org.json.JSONException;

/**
 * Which role(s) may send a message. The receiving side must handle it.
 */
public enum MessageDirection {
	INITIATOR_TO_RESPONDER("clientToServer"), RESPONDER_TO_INITIATOR("serverToClient"), BOTH("both");

	public final String jsonName;

	private MessageDirection(String jsonName) {
		this.jsonName = jsonName;
	}

	public boolean initiatorSends() {
		return this != RESPONDER_TO_INITIATOR;
	}

	public boolean responderSends() {
		return this != INITIATOR_TO_RESPONDER;
	}

	public static MessageDirection fromJsonName(String jsonName) {
		for (MessageDirection d : values()) {
			if (d.jsonName.equals(jsonName)) {
				return d;
			}
		}
		throw new JSONException("Unknown message direction '" + jsonName + "'");
	}
}
