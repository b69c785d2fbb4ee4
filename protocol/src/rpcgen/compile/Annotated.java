package rpcgen.compile;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Something that mentions type expressions: parents, field types, argument
 * types or return types.
 */
public interface Annotated {

	/**
	 * Every type expression mentioned, in the order a reader would encounter them.
	 */
	List<TypeExpr> annotations();

	default List<String> referencedNames() {
		final Set<String> ret = new LinkedHashSet<>();
		for (TypeExpr annotation : annotations()) {
			annotation.collectNames(ret::add);
		}
		return new ArrayList<>(ret);
	}
}
