package rpcgen.model;

import java.util.Collections;
import java.util.List;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

public class TupleType extends Type {

	public final List<Type> items;

	public TupleType(List<Type> items) {
		super(Kind.TUPLE);
		this.items = Collections.unmodifiableList(items);
	}

	public static TupleType fromJSON(JSONObject obj) {
		return new TupleType(JsonUtil.mapArr(obj.getJSONArray("items"), (arr, idx) -> Type.fromJSON(arr.getJSONObject(idx))));
	}
}
