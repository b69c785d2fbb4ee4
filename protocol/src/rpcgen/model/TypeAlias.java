package rpcgen.model;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

public class TypeAlias {

	public final String name;
	public final Type type;
	public final String documentation;

	public TypeAlias(String name, Type type, String documentation) {
		this.name = name;
		this.type = type;
		this.documentation = documentation;
	}

	public TypeAlias(String name, Type type) {
		this(name, type, null);
	}

	public static TypeAlias fromJSON(JSONObject obj) {
		return new TypeAlias(obj.getString("name"), Type.fromJSON(obj.getJSONObject("type")),
				JsonUtil.optString(obj, "documentation"));
	}
}
