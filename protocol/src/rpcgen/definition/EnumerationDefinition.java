package rpcgen.definition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import rpcgen.compile.TypeExpr;
import rpcgen.compile.TypeExpr.PrimitiveKind;
import rpcgen.model.BaseType;
import rpcgen.model.EnumerationEntry;
import rpcgen.model.EnumerationKind;

public class EnumerationDefinition extends Definition {

	public final EnumerationKind backing;

	/**
	 * Entries in declared order. Values are the exact objects from the metamodel.
	 */
	public final List<EnumerationEntry> entries;

	public EnumerationDefinition(String name, EnumerationKind backing, List<EnumerationEntry> entries,
			String documentation) {
		super(Kind.ENUMERATION, name, documentation);
		this.backing = backing;
		this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
	}

	public TypeExpr backingType() {
		switch (backing) {
		case INTEGER:
			return TypeExpr.primitive(PrimitiveKind.INTEGER);
		case UINTEGER:
			return TypeExpr.named(BaseType.UINTEGER);
		case STRING:
		default:
			return TypeExpr.primitive(PrimitiveKind.STRING);
		}
	}

	@Override
	public List<TypeExpr> annotations() {
		return Collections.singletonList(backingType());
	}
}
