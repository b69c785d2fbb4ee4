package rpcgen.model;

import java.util.Collections;
import java.util.List;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

public class OrType extends Type {

	public final List<Type> items;

	public OrType(List<Type> items) {
		super(Kind.OR);
		this.items = Collections.unmodifiableList(items);
	}

	public static OrType fromJSON(JSONObject obj) {
		return new OrType(JsonUtil.mapArr(obj.getJSONArray("items"), (arr, idx) -> Type.fromJSON(arr.getJSONObject(idx))));
	}
}
