package rpcgen.model;

import org.json.JSONObject;

/**
 * An inline anonymous record, e.g. <code>{ start: uinteger; end: uinteger }</code>.
 */
public class StructureLiteralType extends Type {

	public final StructureLiteral value;

	public StructureLiteralType(StructureLiteral value) {
		super(Kind.STRUCTURE_LITERAL);
		this.value = value;
	}

	public static StructureLiteralType fromJSON(JSONObject obj) {
		return new StructureLiteralType(StructureLiteral.fromJSON(obj.getJSONObject("value")));
	}
}
