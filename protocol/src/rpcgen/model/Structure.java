package rpcgen.model;

import java.util.Collections;
import java.util.List;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

/**
 * A named record type.
 * <p>
 * {@link #parents} (the <code>extends</code> list) form a polymorphic type
 * hierarchy. {@link #mixins} do not: the properties declared directly on each
 * mixin are copied into this structure.
 */
public class Structure {

	public final String name;
	public final List<Type> parents;
	public final List<Type> mixins;
	public final List<Property> properties;
	public final String documentation;

	public Structure(String name, List<Type> parents, List<Type> mixins, List<Property> properties,
			String documentation) {
		this.name = name;
		this.parents = Collections.unmodifiableList(parents);
		this.mixins = Collections.unmodifiableList(mixins);
		this.properties = Collections.unmodifiableList(properties);
		this.documentation = documentation;
	}

	public Structure(String name, List<Property> properties) {
		this(name, Collections.emptyList(), Collections.emptyList(), properties, null);
	}

	public static Structure fromJSON(JSONObject obj) {
		return new Structure( //
				obj.getString("name"), //
				JsonUtil.mapOptArr(obj, "extends", (arr, idx) -> Type.fromJSON(arr.getJSONObject(idx))), //
				JsonUtil.mapOptArr(obj, "mixins", (arr, idx) -> Type.fromJSON(arr.getJSONObject(idx))), //
				JsonUtil.mapOptArr(obj, "properties", (arr, idx) -> Property.fromJSON(arr.getJSONObject(idx))), //
				JsonUtil.optString(obj, "documentation"));
	}

	@Override
	public String toString() {
		return "Structure<" + name + ">";
	}
}
