package rpcgen.compile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import org.json.JSONObject;

/**
 * A compiled, target-neutral type expression. Instances are immutable and
 * compare structurally.
 * <p>
 * {@link #toString()} yields a canonical notation used in diagnostics and for
 * the text of inline record literals; target syntax is the emitter's business.
 */
public abstract class TypeExpr {

	public static enum Kind {
		PRIMITIVE, NAMED, SEQUENCE, ASSOCIATIVE, UNION, TUPLE, LITERAL, OPTIONAL_FIELD, FORWARD_REFERENCE
	}

	public static enum PrimitiveKind {
		STRING("string"), INTEGER("integer"), FLOAT("float"), BOOLEAN("boolean"), NULL("null"), OBJECT("object");

		public final String canonicalName;

		private PrimitiveKind(String canonicalName) {
			this.canonicalName = canonicalName;
		}
	}

	public final Kind kind;

	protected TypeExpr(Kind kind) {
		this.kind = kind;
	}

	public List<TypeExpr> children() {
		return Collections.emptyList();
	}

	protected abstract Object[] getComparisonStuff();

	/**
	 * Report every name this expression mentions, left to right, duplicates
	 * included.
	 */
	public void collectNames(Consumer<String> dst) {
		for (TypeExpr child : children()) {
			child.collectNames(dst);
		}
	}

	public List<String> referencedNames() {
		final Set<String> ret = new LinkedHashSet<>();
		collectNames(ret::add);
		return new ArrayList<>(ret);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, Arrays.hashCode(getComparisonStuff()));
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TypeExpr && obj.getClass() == this.getClass()
				&& Arrays.equals(getComparisonStuff(), ((TypeExpr) obj).getComparisonStuff());
	}

	public static Primitive primitive(PrimitiveKind primitiveKind) {
		return new Primitive(primitiveKind);
	}

	public static Named named(String name) {
		return new Named(name);
	}

	public static Sequence sequenceOf(TypeExpr element) {
		return new Sequence(element);
	}

	public static Associative associativeOf(TypeExpr key, TypeExpr value) {
		return new Associative(key, value);
	}

	public static Union union(List<TypeExpr> items) {
		return new Union(items);
	}

	public static Union union(TypeExpr... items) {
		return new Union(Arrays.asList(items));
	}

	public static Tuple tuple(List<TypeExpr> items) {
		return new Tuple(items);
	}

	public static Literal literal(Object value) {
		return new Literal(value);
	}

	public static OptionalField optionalField(TypeExpr inner) {
		return new OptionalField(inner);
	}

	public static ForwardReference forwardReference(String name) {
		return new ForwardReference(name);
	}

	private static String joinChildren(List<TypeExpr> items) {
		return items.stream().map(TypeExpr::toString).collect(Collectors.joining(", "));
	}

	public static class Primitive extends TypeExpr {
		public final PrimitiveKind primitiveKind;

		private Primitive(PrimitiveKind primitiveKind) {
			super(Kind.PRIMITIVE);
			this.primitiveKind = primitiveKind;
		}

		@Override
		protected Object[] getComparisonStuff() {
			return new Object[] { primitiveKind };
		}

		@Override
		public String toString() {
			return primitiveKind.canonicalName;
		}
	}

	/**
	 * A name that is opaque to the compiler. Usually refers to a definition, but
	 * whether it resolves is only checked by consumers that dereference it.
	 */
	public static class Named extends TypeExpr {
		public final String name;

		private Named(String name) {
			super(Kind.NAMED);
			this.name = name;
		}

		@Override
		public void collectNames(Consumer<String> dst) {
			dst.accept(name);
		}

		@Override
		protected Object[] getComparisonStuff() {
			return new Object[] { name };
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public static class Sequence extends TypeExpr {
		public final TypeExpr element;

		private Sequence(TypeExpr element) {
			super(Kind.SEQUENCE);
			this.element = element;
		}

		@Override
		public List<TypeExpr> children() {
			return Collections.singletonList(element);
		}

		@Override
		protected Object[] getComparisonStuff() {
			return new Object[] { element };
		}

		@Override
		public String toString() {
			return "sequence<" + element + ">";
		}
	}

	public static class Associative extends TypeExpr {
		public final TypeExpr key;
		public final TypeExpr value;

		private Associative(TypeExpr key, TypeExpr value) {
			super(Kind.ASSOCIATIVE);
			this.key = key;
			this.value = value;
		}

		@Override
		public List<TypeExpr> children() {
			return Arrays.asList(key, value);
		}

		@Override
		protected Object[] getComparisonStuff() {
			return new Object[] { key, value };
		}

		@Override
		public String toString() {
			return "map<" + key + ", " + value + ">";
		}
	}

	/**
	 * Also the compiled form of intersections; the target has no structural
	 * intersection type.
	 */
	public static class Union extends TypeExpr {
		public final List<TypeExpr> items;

		private Union(List<TypeExpr> items) {
			super(Kind.UNION);
			this.items = Collections.unmodifiableList(new ArrayList<>(items));
		}

		@Override
		public List<TypeExpr> children() {
			return items;
		}

		@Override
		protected Object[] getComparisonStuff() {
			return new Object[] { items };
		}

		@Override
		public String toString() {
			return "union<" + joinChildren(items) + ">";
		}
	}

	public static class Tuple extends TypeExpr {
		public final List<TypeExpr> items;

		private Tuple(List<TypeExpr> items) {
			super(Kind.TUPLE);
			this.items = Collections.unmodifiableList(new ArrayList<>(items));
		}

		@Override
		public List<TypeExpr> children() {
			return items;
		}

		@Override
		protected Object[] getComparisonStuff() {
			return new Object[] { items };
		}

		@Override
		public String toString() {
			return "tuple<" + joinChildren(items) + ">";
		}
	}

	/**
	 * A type inhabited by exactly one value: a {@link String}, {@link Long} or
	 * {@link Boolean}.
	 */
	public static class Literal extends TypeExpr {
		public final Object value;

		private Literal(Object value) {
			super(Kind.LITERAL);
			this.value = value;
		}

		@Override
		protected Object[] getComparisonStuff() {
			return new Object[] { value };
		}

		@Override
		public String toString() {
			return "literal<" + (value instanceof String ? JSONObject.quote((String) value) : String.valueOf(value))
					+ ">";
		}
	}

	/**
	 * Marks a record field whose presence is optional. This is distinct from the
	 * field's value being nullable.
	 */
	public static class OptionalField extends TypeExpr {
		public final TypeExpr inner;

		private OptionalField(TypeExpr inner) {
			super(Kind.OPTIONAL_FIELD);
			this.inner = inner;
		}

		@Override
		public List<TypeExpr> children() {
			return Collections.singletonList(inner);
		}

		@Override
		protected Object[] getComparisonStuff() {
			return new Object[] { inner };
		}

		@Override
		public String toString() {
			return "optional<" + inner + ">";
		}
	}

	/**
	 * A reference that may be used before its target definition is complete.
	 */
	public static class ForwardReference extends TypeExpr {
		public final String name;

		private ForwardReference(String name) {
			super(Kind.FORWARD_REFERENCE);
			this.name = name;
		}

		@Override
		public void collectNames(Consumer<String> dst) {
			dst.accept(name);
		}

		@Override
		protected Object[] getComparisonStuff() {
			return new Object[] { name };
		}

		@Override
		public String toString() {
			return "forward<" + name + ">";
		}
	}
}
