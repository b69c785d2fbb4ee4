package rpcgen.model;

import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Common parts of {@link Request} and {@link Notification}.
 */
public abstract class Message {

	/**
	 * The wire identifier, e.g. <code>textDocument/hover</code>.
	 */
	public final String method;
	public final String typeName;

	/**
	 * Parameter type, or <code>null</code> if the message has no parameters.
	 */
	public final Type params;
	public final MessageDirection direction;
	public final String documentation;

	protected Message(String method, String typeName, Type params, MessageDirection direction,
			String documentation) {
		this.method = method;
		this.typeName = typeName;
		this.params = params;
		this.direction = direction;
		this.documentation = documentation;
	}

	protected static Type paramsFromJSON(JSONObject obj) {
		final Object raw = obj.opt("params");
		if (raw == null || raw == JSONObject.NULL) {
			return null;
		}
		if (raw instanceof JSONArray) {
			final JSONArray arr = (JSONArray) raw;
			final List<Type> items = new ArrayList<>();
			for (int i = 0; i < arr.length(); ++i) {
				items.add(Type.fromJSON(arr.getJSONObject(i)));
			}
			return new TupleType(items);
		}
		return Type.fromJSON(obj.getJSONObject("params"));
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "<" + method + ">";
	}
}
