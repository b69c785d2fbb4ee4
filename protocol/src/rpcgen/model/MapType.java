package rpcgen.model;

import org.json.JSONObject;

/**
 * A JSON object map. The key is expected to be a {@link BaseType} of kind URI,
 * DocumentUri, string or integer, or a {@link ReferenceType} resolving to one of
 * those. The restriction is not verified.
 */
public class MapType extends Type {

	public final Type key;
	public final Type value;

	public MapType(Type key, Type value) {
		super(Kind.MAP);
		this.key = key;
		this.value = value;
	}

	public static MapType fromJSON(JSONObject obj) {
		return new MapType(Type.fromJSON(obj.getJSONObject("key")), Type.fromJSON(obj.getJSONObject("value")));
	}
}
