package rpcgen.model;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

public class Notification extends Message {

	public Notification(String method, String typeName, Type params, MessageDirection direction,
			String documentation) {
		super(method, typeName, params, direction, documentation);
	}

	public Notification(String method, String typeName, Type params, MessageDirection direction) {
		this(method, typeName, params, direction, null);
	}

	public static Notification fromJSON(JSONObject obj) {
		return new Notification( //
				obj.getString("method"), //
				obj.getString("typeName"), //
				paramsFromJSON(obj), //
				MessageDirection.fromJsonName(obj.getString("messageDirection")), //
				JsonUtil.optString(obj, "documentation"));
	}
}
