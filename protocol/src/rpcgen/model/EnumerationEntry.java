package rpcgen.model;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

public class EnumerationEntry {

	public final String name;

	/**
	 * Either a {@link String} or a {@link Number}, exactly as it appeared in the
	 * protocol description.
	 */
	public final Object value;
	public final String documentation;

	public EnumerationEntry(String name, Object value, String documentation) {
		this.name = name;
		this.value = value;
		this.documentation = documentation;
	}

	public EnumerationEntry(String name, Object value) {
		this(name, value, null);
	}

	public static EnumerationEntry fromJSON(JSONObject obj) {
		return new EnumerationEntry(obj.getString("name"), obj.get("value"), JsonUtil.optString(obj, "documentation"));
	}
}
