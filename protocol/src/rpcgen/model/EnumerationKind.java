package rpcgen.model;

import org.json.JSONException;

/**
 * The scalar kind backing an {@link Enumeration}.
 */
public enum EnumerationKind {
	STRING("string"), INTEGER("integer"), UINTEGER("uinteger");

	public final String jsonName;

	private EnumerationKind(String jsonName) {
		this.jsonName = jsonName;
	}

	public static EnumerationKind fromJsonName(String jsonName) {
		for (EnumerationKind k : values()) {
			if (k.jsonName.equals(jsonName)) {
				return k;
			}
		}
		throw new JSONException("Unknown enumeration type '" + jsonName + "'");
	}
}
