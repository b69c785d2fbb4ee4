package rpcgen.defaults;

import java.util.Objects;

/**
 * Placeholder for a record-typed value that was not expanded, because recursive
 * expansion was not requested.
 */
public class MissingValue {

	public final String typeName;

	public MissingValue(String typeName) {
		this.typeName = typeName;
	}

	@Override
	public int hashCode() {
		return Objects.hash(typeName);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof MissingValue && ((MissingValue) obj).typeName.equals(typeName);
	}

	@Override
	public String toString() {
		return "MissingValue(" + typeName + ")";
	}
}
