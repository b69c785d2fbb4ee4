package rpcgen.model;

import org.json.JSONObject;

public class ArrayType extends Type {

	public final Type element;

	public ArrayType(Type element) {
		super(Kind.ARRAY);
		this.element = element;
	}

	public static ArrayType fromJSON(JSONObject obj) {
		return new ArrayType(Type.fromJSON(obj.getJSONObject("element")));
	}
}
