package rpcgen.imports;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import rpcgen.compile.Annotated;
import rpcgen.compile.TypeExpr;

/**
 * Computes which names from the types artifact a consumer artifact must
 * import: exactly the defined names that its annotations mention, in first-seen
 * order.
 */
public class ImportResolver {

	private final Set<String> definedNames;

	public ImportResolver(Collection<String> definedNames) {
		this.definedNames = new HashSet<>(definedNames);
	}

	public List<String> resolve(Annotated... consumers) {
		final Set<String> imports = new LinkedHashSet<>();
		for (Annotated consumer : consumers) {
			for (TypeExpr annotation : consumer.annotations()) {
				annotation.collectNames(name -> {
					if (definedNames.contains(name)) {
						imports.add(name);
					}
				});
			}
		}
		return new ArrayList<>(imports);
	}
}
