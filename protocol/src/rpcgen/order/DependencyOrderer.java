package rpcgen.order;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import rpcgen.definition.Definition;
import rpcgen.definition.RecordDefinition;

/**
 * Orders definitions so that every name a definition references (parents,
 * field types, alias targets) comes before it.
 * <p>
 * Placement is depth first in declaration order, so unrelated definitions keep
 * their relative order. The traversal keeps an explicit stack of definitions
 * currently being placed. Meeting one of those again means a cycle; the
 * reference is then accepted as a {@link ForwardReference} instead of being
 * followed.
 * <p>
 * Base classes cannot be referenced ahead of their definition, only field and
 * alias types can. A cycle is therefore never broken on a parent edge: a field
 * reference to a definition that inherits from something still in progress is
 * recorded as the forward reference, and that definition is placed later.
 */
public class DependencyOrderer {

	private static class Frame {
		final Definition definition;
		final List<String> references;
		final Set<String> strict;
		int nextReference;

		Frame(Definition definition) {
			this.definition = definition;
			this.references = definition.referencedNames();
			this.strict = new HashSet<>(strictReferences(definition));
		}

		boolean hasNext() {
			return nextReference < references.size();
		}

		String next() {
			return references.get(nextReference++);
		}
	}

	public OrderedDefinitions order(List<Definition> definitions) {
		final Map<String, Definition> byName = new LinkedHashMap<>();
		for (Definition d : definitions) {
			// Names are expected to be unique; the first declaration wins
			byName.putIfAbsent(d.name, d);
		}

		final List<Definition> ordered = new ArrayList<>();
		final List<ForwardReference> forwardReferences = new ArrayList<>();
		final Set<String> placed = new HashSet<>();
		final Set<String> inProgress = new HashSet<>();
		final Deque<Frame> stack = new ArrayDeque<>();

		for (Definition root : byName.values()) {
			if (placed.contains(root.name)) {
				continue;
			}
			inProgress.add(root.name);
			stack.push(new Frame(root));

			while (!stack.isEmpty()) {
				final Frame top = stack.peek();
				if (top.hasNext()) {
					final String ref = top.next();
					final Definition dep = byName.get(ref);
					if (dep == null || placed.contains(ref)) {
						continue;
					}
					if (inProgress.contains(ref) || (!top.strict.contains(ref)
							&& inheritsFromAny(dep, byName, inProgress))) {
						forwardReferences.add(new ForwardReference(top.definition.name, ref));
						continue;
					}
					inProgress.add(ref);
					stack.push(new Frame(dep));
				} else {
					stack.pop();
					inProgress.remove(top.definition.name);
					placed.add(top.definition.name);
					ordered.add(top.definition);
				}
			}
		}
		return new OrderedDefinitions(ordered, forwardReferences);
	}

	/**
	 * Names that must be defined before <code>def</code> itself: parents of a
	 * record and the backing type of an enumeration.
	 */
	private static List<String> strictReferences(Definition def) {
		switch (def.kind) {
		case RECORD:
			return ((RecordDefinition) def).parentNames();
		case ENUMERATION:
			return def.referencedNames();
		default:
			return Collections.emptyList();
		}
	}

	private static boolean inheritsFromAny(Definition def, Map<String, Definition> byName, Set<String> names) {
		final Set<String> seen = new HashSet<>();
		final Deque<Definition> work = new ArrayDeque<>();
		work.push(def);
		while (!work.isEmpty()) {
			for (String parent : strictReferences(work.pop())) {
				if (names.contains(parent)) {
					return true;
				}
				final Definition parentDef = byName.get(parent);
				if (parentDef != null && seen.add(parent)) {
					work.push(parentDef);
				}
			}
		}
		return false;
	}
}
