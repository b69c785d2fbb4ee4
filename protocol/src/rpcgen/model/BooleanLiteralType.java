package rpcgen.model;

import org.json.JSONObject;

public class BooleanLiteralType extends Type {

	public final boolean value;

	public BooleanLiteralType(boolean value) {
		super(Kind.BOOLEAN_LITERAL);
		this.value = value;
	}

	public static BooleanLiteralType fromJSON(JSONObject obj) {
		return new BooleanLiteralType(obj.getBoolean("value"));
	}
}
