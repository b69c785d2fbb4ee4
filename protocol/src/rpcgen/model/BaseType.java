package rpcgen.model;

import org.json.JSONObject;

/**
 * A base scalar like <code>string</code> or <code>DocumentUri</code>. The name
 * is kept as a plain string since unknown base names pass through compilation
 * unchanged.
 */
public class BaseType extends Type {

	public static final String URI = "URI";
	public static final String DOCUMENT_URI = "DocumentUri";
	public static final String INTEGER = "integer";
	public static final String UINTEGER = "uinteger";
	public static final String DECIMAL = "decimal";
	public static final String REGEXP = "RegExp";
	public static final String STRING = "string";
	public static final String BOOLEAN = "boolean";
	public static final String NULL = "null";

	public final String name;

	public BaseType(String name) {
		super(Kind.BASE);
		this.name = name;
	}

	public static BaseType fromJSON(JSONObject obj) {
		return new BaseType(obj.getString("name"));
	}

	@Override
	public String toString() {
		return name;
	}
}
