package rpcgen.model;

import org.json.JSONObject;

public class StringLiteralType extends Type {

	public final String value;

	public StringLiteralType(String value) {
		super(Kind.STRING_LITERAL);
		this.value = value;
	}

	public static StringLiteralType fromJSON(JSONObject obj) {
		return new StringLiteralType(obj.getString("value"));
	}
}
