package rpcgen.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import rpcgen.compile.TypeExpr.PrimitiveKind;
import rpcgen.model.AndType;
import rpcgen.model.ArrayType;
import rpcgen.model.BaseType;
import rpcgen.model.BooleanLiteralType;
import rpcgen.model.IntegerLiteralType;
import rpcgen.model.MapType;
import rpcgen.model.OrType;
import rpcgen.model.Property;
import rpcgen.model.ReferenceType;
import rpcgen.model.StringLiteralType;
import rpcgen.model.StructureLiteral;
import rpcgen.model.StructureLiteralType;
import rpcgen.model.TupleType;
import rpcgen.model.Type;

/**
 * Turns metamodel {@link Type} trees into {@link TypeExpr} trees. Pure and
 * total: names are never resolved here.
 */
public class TypeExprCompiler {

	/**
	 * Compile a type. <code>null</code> (e.g. a message without params) compiles
	 * to the null primitive.
	 */
	public TypeExpr compile(Type type) {
		if (type == null) {
			return TypeExpr.primitive(PrimitiveKind.NULL);
		}
		switch (type.kind) {
		case BASE:
			return compileBase((BaseType) type);
		case REFERENCE:
			return TypeExpr.named(((ReferenceType) type).name);
		case ARRAY:
			return TypeExpr.sequenceOf(compile(((ArrayType) type).element));
		case MAP: {
			final MapType map = (MapType) type;
			return TypeExpr.associativeOf(compile(map.key), compile(map.value));
		}
		case AND:
			return TypeExpr.union(compileAll(((AndType) type).items));
		case OR:
			return TypeExpr.union(compileAll(((OrType) type).items));
		case TUPLE:
			return TypeExpr.tuple(compileAll(((TupleType) type).items));
		case STRUCTURE_LITERAL:
			return TypeExpr.literal(literalText(((StructureLiteralType) type).value));
		case STRING_LITERAL:
			return TypeExpr.literal(((StringLiteralType) type).value);
		case INTEGER_LITERAL:
			return TypeExpr.literal(((IntegerLiteralType) type).value);
		case BOOLEAN_LITERAL:
			return TypeExpr.literal(((BooleanLiteralType) type).value);
		default:
			throw new IllegalArgumentException("Unknown type kind " + type.kind);
		}
	}

	public Field compileProperty(Property property) {
		TypeExpr type = compile(property.type);
		if (property.optional) {
			type = TypeExpr.optionalField(type);
		}
		return new Field(property.name, type, property.documentation);
	}

	private List<TypeExpr> compileAll(List<Type> items) {
		final List<TypeExpr> ret = new ArrayList<>();
		for (Type item : items) {
			ret.add(compile(item));
		}
		return ret;
	}

	private TypeExpr compileBase(BaseType type) {
		switch (type.name) {
		case BaseType.STRING:
			return TypeExpr.primitive(PrimitiveKind.STRING);
		case BaseType.INTEGER:
			return TypeExpr.primitive(PrimitiveKind.INTEGER);
		case BaseType.DECIMAL:
			return TypeExpr.primitive(PrimitiveKind.FLOAT);
		case BaseType.BOOLEAN:
			return TypeExpr.primitive(PrimitiveKind.BOOLEAN);
		case BaseType.NULL:
			return TypeExpr.primitive(PrimitiveKind.NULL);
		default:
			// uinteger, URI, DocumentUri, RegExp and anything unknown. The first four are
			// bound by the base scalar aliases in the types artifact.
			return TypeExpr.named(type.name);
		}
	}

	/**
	 * Inline records are not expanded into nested definitions. Instead the field
	 * list is echoed back as the text of a literal type.
	 */
	private String literalText(StructureLiteral literal) {
		return literal.properties.stream() //
				.map(p -> compileProperty(p).toString()) //
				.collect(Collectors.joining("\n"));
	}
}
