package rpcgen.order;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import rpcgen.definition.Definition;

public class OrderedDefinitions {

	public final List<Definition> definitions;

	/**
	 * References accepted ahead of their target, in the order they were found.
	 */
	public final List<ForwardReference> forwardReferences;

	public OrderedDefinitions(List<Definition> definitions, List<ForwardReference> forwardReferences) {
		this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
		this.forwardReferences = Collections.unmodifiableList(new ArrayList<>(forwardReferences));
	}

	public Set<String> names() {
		final Set<String> ret = new LinkedHashSet<>();
		for (Definition d : definitions) {
			ret.add(d.name);
		}
		return ret;
	}

	public int indexOf(String name) {
		for (int i = 0; i < definitions.size(); i++) {
			if (definitions.get(i).name.equals(name)) {
				return i;
			}
		}
		return -1;
	}

	public Definition get(String name) {
		final int idx = indexOf(name);
		return idx == -1 ? null : definitions.get(idx);
	}
}
