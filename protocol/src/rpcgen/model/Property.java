package rpcgen.model;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

public class Property {

	public final String name;
	public final Type type;
	public final boolean optional;
	public final String documentation;

	public Property(String name, Type type, boolean optional, String documentation) {
		this.name = name;
		this.type = type;
		this.optional = optional;
		this.documentation = documentation;
	}

	public Property(String name, Type type) {
		this(name, type, false, null);
	}

	public static Property fromJSON(JSONObject obj) {
		return new Property( //
				obj.getString("name"), //
				Type.fromJSON(obj.getJSONObject("type")), //
				obj.optBoolean("optional", false), //
				JsonUtil.optString(obj, "documentation"));
	}

	@Override
	public String toString() {
		return name + (optional ? "?" : "");
	}
}
