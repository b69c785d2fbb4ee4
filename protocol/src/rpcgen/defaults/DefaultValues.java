package rpcgen.defaults;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONObject;

import rpcgen.compile.Field;
import rpcgen.compile.TypeExpr;
import rpcgen.definition.AliasDefinition;
import rpcgen.definition.Definition;
import rpcgen.definition.EnumerationDefinition;
import rpcgen.definition.RecordDefinition;
import rpcgen.model.EnumerationEntry;

/**
 * Synthesizes default JSON values for records of the types artifact.
 * <p>
 * Atomic types get their zero value, collections are empty, unions take the
 * default of their first branch and literals their only value. Nested records
 * are only expanded on request, otherwise they become a {@link MissingValue}.
 */
public class DefaultValues {

	public static final String VALUE_SET_FIELD = "valueSet";

	private final Map<String, Definition> definitions = new HashMap<>();

	public DefaultValues(Collection<Definition> definitions) {
		for (Definition d : definitions) {
			this.definitions.putIfAbsent(d.name, d);
		}
	}

	/**
	 * @param recordName   name of a record definition
	 * @param onlyRequired skip fields whose presence is optional
	 * @param recursive    expand record-typed fields instead of producing
	 *                     {@link MissingValue}
	 */
	public JSONObject defaultFor(String recordName, boolean onlyRequired, boolean recursive) {
		final Definition def = definitions.get(recordName);
		if (def == null || def.kind != Definition.Kind.RECORD) {
			throw new UnsupportedTypeDefaultException("'" + recordName + "' is not a known record");
		}
		return new Expansion(onlyRequired, recursive).record((RecordDefinition) def);
	}

	private class Expansion {
		private final boolean onlyRequired;
		private final boolean recursive;
		private final Set<String> expanding = new HashSet<>();

		Expansion(boolean onlyRequired, boolean recursive) {
			this.onlyRequired = onlyRequired;
			this.recursive = recursive;
		}

		JSONObject record(RecordDefinition rec) {
			enter(rec.name);
			final JSONObject data = new JSONObject();
			for (Field f : flatten(rec).values()) {
				if (onlyRequired && f.isOptional()) {
					continue;
				}
				final TypeExpr type = f.isOptional() ? ((TypeExpr.OptionalField) f.type).inner : f.type;
				if (VALUE_SET_FIELD.equals(f.name)) {
					data.put(f.name, valueSet(type));
				} else {
					data.put(f.name, value(type));
				}
			}
			expanding.remove(rec.name);
			return data;
		}

		/**
		 * Inherited fields first, so that a redeclared field keeps its first position
		 * but gets the most derived type.
		 */
		private Map<String, Field> flatten(RecordDefinition rec) {
			final Map<String, Field> ret = new LinkedHashMap<>();
			for (String parentName : rec.parentNames()) {
				final Definition parent = definitions.get(parentName);
				if (parent == null || parent.kind != Definition.Kind.RECORD) {
					throw new UnsupportedTypeDefaultException(
							"Parent '" + parentName + "' of '" + rec.name + "' is not a known record");
				}
				enter(parentName);
				ret.putAll(flatten((RecordDefinition) parent));
				expanding.remove(parentName);
			}
			for (Field f : rec.fields) {
				ret.put(f.name, f);
			}
			return ret;
		}

		private void enter(String name) {
			if (!expanding.add(name)) {
				throw new UnsupportedTypeDefaultException("'" + name + "' refers to itself while being expanded");
			}
		}

		Object value(TypeExpr type) {
			switch (type.kind) {
			case PRIMITIVE:
				switch (((TypeExpr.Primitive) type).primitiveKind) {
				case STRING:
					return "";
				case INTEGER:
					return 0;
				case FLOAT:
					return 0.0;
				case BOOLEAN:
					return false;
				case OBJECT:
					return new JSONObject();
				case NULL:
				default:
					return JSONObject.NULL;
				}
			case SEQUENCE:
				return new JSONArray();
			case ASSOCIATIVE:
				return new JSONObject();
			case UNION: {
				final TypeExpr.Union union = (TypeExpr.Union) type;
				if (union.items.isEmpty()) {
					throw new UnsupportedTypeDefaultException(type, "union without branches");
				}
				return value(union.items.get(0));
			}
			case TUPLE: {
				final JSONArray ret = new JSONArray();
				for (TypeExpr item : ((TypeExpr.Tuple) type).items) {
					ret.put(value(item));
				}
				return ret;
			}
			case LITERAL:
				return ((TypeExpr.Literal) type).value;
			case OPTIONAL_FIELD:
				return value(((TypeExpr.OptionalField) type).inner);
			case NAMED:
				return named(type, ((TypeExpr.Named) type).name);
			case FORWARD_REFERENCE:
				return named(type, ((TypeExpr.ForwardReference) type).name);
			default:
				throw new UnsupportedTypeDefaultException(type, "unknown kind " + type.kind);
			}
		}

		private Object named(TypeExpr type, String name) {
			final Definition def = definitions.get(name);
			if (def == null) {
				throw new UnsupportedTypeDefaultException(type, "unresolved name");
			}
			switch (def.kind) {
			case RECORD:
				return recursive ? record((RecordDefinition) def) : new MissingValue(name);
			case ALIAS: {
				enter(name);
				final Object ret = value(((AliasDefinition) def).bound);
				expanding.remove(name);
				return ret;
			}
			case ENUMERATION:
			default:
				throw new UnsupportedTypeDefaultException(type, "enumerations have no default");
			}
		}

		private JSONArray valueSet(TypeExpr type) {
			if (type.kind == TypeExpr.Kind.SEQUENCE) {
				final TypeExpr element = ((TypeExpr.Sequence) type).element;
				if (element.kind == TypeExpr.Kind.NAMED) {
					final Definition def = definitions.get(((TypeExpr.Named) element).name);
					if (def != null && def.kind == Definition.Kind.ENUMERATION) {
						final JSONArray ret = new JSONArray();
						for (EnumerationEntry entry : ((EnumerationDefinition) def).entries) {
							ret.put(entry.value);
						}
						return ret;
					}
				}
			}
			throw new UnsupportedTypeDefaultException(type, "'" + VALUE_SET_FIELD + "' must be a sequence of an enumeration");
		}
	}
}
