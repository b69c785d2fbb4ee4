package rpcgen.model;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

public class Request extends Message {

	public final Type result;

	public Request(String method, String typeName, Type params, Type result, MessageDirection direction,
			String documentation) {
		super(method, typeName, params, direction, documentation);
		this.result = result;
	}

	public Request(String method, String typeName, Type params, Type result, MessageDirection direction) {
		this(method, typeName, params, result, direction, null);
	}

	public static Request fromJSON(JSONObject obj) {
		return new Request( //
				obj.getString("method"), //
				obj.getString("typeName"), //
				paramsFromJSON(obj), //
				Type.fromJSON(obj.getJSONObject("result")), //
				MessageDirection.fromJsonName(obj.getString("messageDirection")), //
				JsonUtil.optString(obj, "documentation"));
	}
}
