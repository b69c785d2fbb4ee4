package rpcgen.model;

import org.json.JSONObject;

public class IntegerLiteralType extends Type {

	public final long value;

	public IntegerLiteralType(long value) {
		super(Kind.INTEGER_LITERAL);
		this.value = value;
	}

	public static IntegerLiteralType fromJSON(JSONObject obj) {
		return new IntegerLiteralType(obj.getLong("value"));
	}
}
