package rpcgen.model;

import java.util.Collections;
import java.util.List;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

public class AndType extends Type {

	public final List<Type> items;

	public AndType(List<Type> items) {
		super(Kind.AND);
		this.items = Collections.unmodifiableList(items);
	}

	public static AndType fromJSON(JSONObject obj) {
		return new AndType(JsonUtil.mapArr(obj.getJSONArray("items"), (arr, idx) -> Type.fromJSON(arr.getJSONObject(idx))));
	}
}
