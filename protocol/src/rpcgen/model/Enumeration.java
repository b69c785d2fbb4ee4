package rpcgen.model;

import java.util.Collections;
import java.util.List;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

public class Enumeration {

	public final String name;
	public final EnumerationKind kind;
	public final List<EnumerationEntry> values;
	public final boolean supportsCustomValues;
	public final String documentation;

	public Enumeration(String name, EnumerationKind kind, List<EnumerationEntry> values, boolean supportsCustomValues,
			String documentation) {
		this.name = name;
		this.kind = kind;
		this.values = Collections.unmodifiableList(values);
		this.supportsCustomValues = supportsCustomValues;
		this.documentation = documentation;
	}

	public Enumeration(String name, EnumerationKind kind, List<EnumerationEntry> values) {
		this(name, kind, values, false, null);
	}

	public static Enumeration fromJSON(JSONObject obj) {
		return new Enumeration( //
				obj.getString("name"), //
				EnumerationKind.fromJsonName(obj.getJSONObject("type").getString("name")), //
				JsonUtil.mapArr(obj.getJSONArray("values"), (arr, idx) -> EnumerationEntry.fromJSON(arr.getJSONObject(idx))), //
				obj.optBoolean("supportsCustomValues", false), //
				JsonUtil.optString(obj, "documentation"));
	}
}
