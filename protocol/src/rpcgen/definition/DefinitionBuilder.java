package rpcgen.definition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import rpcgen.compile.Field;
import rpcgen.compile.TypeExpr;
import rpcgen.compile.TypeExpr.PrimitiveKind;
import rpcgen.compile.TypeExprCompiler;
import rpcgen.model.BaseType;
import rpcgen.model.Enumeration;
import rpcgen.model.MetaModel;
import rpcgen.model.Property;
import rpcgen.model.ReferenceType;
import rpcgen.model.Structure;
import rpcgen.model.Type;
import rpcgen.model.TypeAlias;

/**
 * Builds {@link Definition Definitions} from the structures, enumerations and
 * type aliases of a {@link MetaModel}.
 */
public class DefinitionBuilder {

	/**
	 * Aliases that refer to themselves (or each other), and so must be referenced
	 * before their own definition completes.
	 */
	public static final Set<String> DEFAULT_FORWARD_REFERENCED_ALIASES = Collections
			.unmodifiableSet(new LinkedHashSet<>(Arrays.asList("LSPObject", "LSPArray")));

	private final TypeExprCompiler compiler;
	private final Set<String> forwardReferencedAliases;

	public DefinitionBuilder(TypeExprCompiler compiler, Set<String> forwardReferencedAliases) {
		this.compiler = compiler;
		this.forwardReferencedAliases = forwardReferencedAliases;
	}

	public DefinitionBuilder(TypeExprCompiler compiler) {
		this(compiler, DEFAULT_FORWARD_REFERENCED_ALIASES);
	}

	/**
	 * Aliases for the base scalars that compile to names rather than primitives.
	 * They go first in the types artifact.
	 */
	public static List<Definition> baseAliases() {
		final TypeExpr integer = TypeExpr.primitive(PrimitiveKind.INTEGER);
		final TypeExpr string = TypeExpr.primitive(PrimitiveKind.STRING);
		return Arrays.asList( //
				new AliasDefinition(BaseType.UINTEGER, integer, null), //
				new AliasDefinition(BaseType.URI, string, null), //
				new AliasDefinition(BaseType.DOCUMENT_URI, string, null), //
				new AliasDefinition(BaseType.REGEXP, string, null));
	}

	/**
	 * Enumerations first, then structures, then type aliases; each group in
	 * declared order.
	 */
	public List<Definition> build(MetaModel model) {
		final Map<String, Structure> structuresByName = new HashMap<>();
		for (Structure s : model.structures) {
			structuresByName.putIfAbsent(s.name, s);
		}

		final List<Definition> ret = new ArrayList<>();
		for (Enumeration e : model.enumerations) {
			ret.add(buildEnumeration(e));
		}
		for (Structure s : model.structures) {
			ret.add(buildStructure(s, structuresByName));
		}
		for (TypeAlias alias : model.typeAliases) {
			ret.add(buildAlias(alias));
		}
		return ret;
	}

	public EnumerationDefinition buildEnumeration(Enumeration enumeration) {
		return new EnumerationDefinition(enumeration.name, enumeration.kind, enumeration.values,
				enumeration.documentation);
	}

	public RecordDefinition buildStructure(Structure structure, Map<String, Structure> structuresByName) {
		final List<TypeExpr> parents = new ArrayList<>();
		for (Type parent : structure.parents) {
			parents.add(compiler.compile(parent));
		}

		final List<Property> properties = new ArrayList<>(structure.properties);
		for (Type mixin : structure.mixins) {
			// One level only: the mixin's own mixins are not followed
			properties.addAll(resolveMixin(mixin, structure, structuresByName).properties);
		}

		final List<Field> fields = new ArrayList<>();
		for (Property p : properties) {
			fields.add(compiler.compileProperty(p));
		}
		return new RecordDefinition(structure.name, parents, fields, structure.documentation);
	}

	public AliasDefinition buildAlias(TypeAlias alias) {
		return new AliasDefinition(alias.name, markForwardReferences(compiler.compile(alias.type)),
				alias.documentation);
	}

	private Structure resolveMixin(Type mixin, Structure owner, Map<String, Structure> structuresByName) {
		if (mixin.kind != Type.Kind.REFERENCE) {
			throw new UnresolvedTypeReferenceException(String.valueOf(mixin), owner.name);
		}
		final String name = ((ReferenceType) mixin).name;
		final Structure resolved = structuresByName.get(name);
		if (resolved == null) {
			throw new UnresolvedTypeReferenceException(name, owner.name);
		}
		return resolved;
	}

	private TypeExpr markForwardReferences(TypeExpr expr) {
		switch (expr.kind) {
		case NAMED: {
			final String name = ((TypeExpr.Named) expr).name;
			return forwardReferencedAliases.contains(name) ? TypeExpr.forwardReference(name) : expr;
		}
		case SEQUENCE:
			return TypeExpr.sequenceOf(markForwardReferences(((TypeExpr.Sequence) expr).element));
		case ASSOCIATIVE: {
			final TypeExpr.Associative assoc = (TypeExpr.Associative) expr;
			return TypeExpr.associativeOf(markForwardReferences(assoc.key), markForwardReferences(assoc.value));
		}
		case UNION:
			return TypeExpr.union(markAll(((TypeExpr.Union) expr).items));
		case TUPLE:
			return TypeExpr.tuple(markAll(((TypeExpr.Tuple) expr).items));
		case OPTIONAL_FIELD:
			return TypeExpr.optionalField(markForwardReferences(((TypeExpr.OptionalField) expr).inner));
		default:
			return expr;
		}
	}

	private List<TypeExpr> markAll(List<TypeExpr> items) {
		final List<TypeExpr> ret = new ArrayList<>();
		for (TypeExpr item : items) {
			ret.add(markForwardReferences(item));
		}
		return ret;
	}
}
