package rpcgen.compile;

import java.util.Objects;

/**
 * A compiled record field. Optional properties have their type wrapped in
 * {@link TypeExpr.OptionalField}.
 */
public class Field {

	public final String name;
	public final TypeExpr type;
	public final String documentation;

	public Field(String name, TypeExpr type, String documentation) {
		this.name = name;
		this.type = type;
		this.documentation = documentation;
	}

	public Field(String name, TypeExpr type) {
		this(name, type, null);
	}

	public boolean isOptional() {
		return type.kind == TypeExpr.Kind.OPTIONAL_FIELD;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Field other = (Field) obj;
		return Objects.equals(name, other.name) && Objects.equals(type, other.type);
	}

	@Override
	public String toString() {
		return name + ": " + type;
	}
}
