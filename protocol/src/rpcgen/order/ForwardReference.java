package rpcgen.order;

import java.util.Objects;

/**
 * A reference that could not be placed after its target, because the target
 * was still being placed when the reference was seen, i.e. the two are part of
 * a cycle. <code>from == to</code> for self references.
 */
public class ForwardReference {

	public final String from;
	public final String to;

	public ForwardReference(String from, String to) {
		this.from = from;
		this.to = to;
	}

	public boolean isSelfReference() {
		return from.equals(to);
	}

	@Override
	public int hashCode() {
		return Objects.hash(from, to);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ForwardReference other = (ForwardReference) obj;
		return from.equals(other.from) && to.equals(other.to);
	}

	@Override
	public String toString() {
		return from + " -> " + to;
	}
}
