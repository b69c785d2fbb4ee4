package rpcgen.model;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * A type expression in the metamodel. This is a closed tagged union; consumers
 * dispatch on {@link #kind} and cast to the matching subclass.
 */
public abstract class Type {

	public static enum Kind {
		BASE("base"), REFERENCE("reference"), ARRAY("array"), MAP("map"), AND("and"), OR("or"), TUPLE("tuple"),
		STRUCTURE_LITERAL("literal"), STRING_LITERAL("stringLiteral"), INTEGER_LITERAL("integerLiteral"),
		BOOLEAN_LITERAL("booleanLiteral");

		public final String jsonName;

		private Kind(String jsonName) {
			this.jsonName = jsonName;
		}

		public static Kind fromJsonName(String jsonName) {
			for (Kind k : values()) {
				if (k.jsonName.equals(jsonName)) {
					return k;
				}
			}
			throw new JSONException("Unknown type kind '" + jsonName + "'");
		}
	}

	public final Kind kind;

	protected Type(Kind kind) {
		this.kind = kind;
	}

	public static Type fromJSON(JSONObject obj) {
		switch (Kind.fromJsonName(obj.getString("kind"))) {
		case BASE:
			return BaseType.fromJSON(obj);
		case REFERENCE:
			return ReferenceType.fromJSON(obj);
		case ARRAY:
			return ArrayType.fromJSON(obj);
		case MAP:
			return MapType.fromJSON(obj);
		case AND:
			return AndType.fromJSON(obj);
		case OR:
			return OrType.fromJSON(obj);
		case TUPLE:
			return TupleType.fromJSON(obj);
		case STRUCTURE_LITERAL:
			return StructureLiteralType.fromJSON(obj);
		case STRING_LITERAL:
			return StringLiteralType.fromJSON(obj);
		case INTEGER_LITERAL:
			return IntegerLiteralType.fromJSON(obj);
		case BOOLEAN_LITERAL:
			return BooleanLiteralType.fromJSON(obj);
		default:
			throw new JSONException("Unhandled type kind " + obj.getString("kind"));
		}
	}
}
