package rpcgen.model;

import java.util.Collections;
import java.util.List;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

public class StructureLiteral {

	public final List<Property> properties;
	public final String documentation;

	public StructureLiteral(List<Property> properties, String documentation) {
		this.properties = Collections.unmodifiableList(properties);
		this.documentation = documentation;
	}

	public static StructureLiteral fromJSON(JSONObject obj) {
		return new StructureLiteral( //
				JsonUtil.mapOptArr(obj, "properties", (arr, idx) -> Property.fromJSON(arr.getJSONObject(idx))), //
				JsonUtil.optString(obj, "documentation"));
	}
}
