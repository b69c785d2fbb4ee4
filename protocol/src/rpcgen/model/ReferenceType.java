package rpcgen.model;

import org.json.JSONObject;

/**
 * A reference to a structure, enumeration or type alias by name.
 */
public class ReferenceType extends Type {

	public final String name;

	public ReferenceType(String name) {
		super(Kind.REFERENCE);
		this.name = name;
	}

	public static ReferenceType fromJSON(JSONObject obj) {
		return new ReferenceType(obj.getString("name"));
	}

	@Override
	public String toString() {
		return "ref:" + name;
	}
}
