package rpcgen.message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-role mapping from wire method to handler identifier. Tables are only
 * obtainable through {@link Builder#build()} and cannot be changed afterwards.
 * <p>
 * Each entry also has a slot index (its registration position), so callers can
 * resolve the wire string once and dispatch on an int afterwards.
 */
public class DispatchTable {

	public final Role role;
	private final Map<String, String> handlers;
	private final Map<String, Integer> slots;
	private final List<String> methods;

	private DispatchTable(Role role, LinkedHashMap<String, String> handlers) {
		this.role = role;
		this.handlers = Collections.unmodifiableMap(handlers);
		this.methods = Collections.unmodifiableList(new ArrayList<>(handlers.keySet()));
		final Map<String, Integer> slots = new HashMap<>();
		for (int i = 0; i < methods.size(); i++) {
			slots.put(methods.get(i), i);
		}
		this.slots = slots;
	}

	/**
	 * Wire methods in registration order.
	 */
	public List<String> methods() {
		return methods;
	}

	public Map<String, String> entries() {
		return handlers;
	}

	public int size() {
		return methods.size();
	}

	public boolean contains(String method) {
		return handlers.containsKey(method);
	}

	public String handlerFor(String method) {
		final String ret = handlers.get(method);
		if (ret == null) {
			throw new UnknownMethodException(role, method);
		}
		return ret;
	}

	public int slotOf(String method) {
		final Integer ret = slots.get(method);
		if (ret == null) {
			throw new UnknownMethodException(role, method);
		}
		return ret;
	}

	public String handlerAt(int slot) {
		return handlers.get(methods.get(slot));
	}

	@Override
	public String toString() {
		return role.className + handlers;
	}

	public static Builder builder(Role role) {
		return new Builder(role);
	}

	public static class Builder {
		private final Role role;
		private LinkedHashMap<String, String> handlers = new LinkedHashMap<>();

		private Builder(Role role) {
			this.role = role;
		}

		public Builder register(String method, String handler) {
			if (handlers == null) {
				throw new IllegalStateException("Dispatch table for " + role.className + " is already built");
			}
			final String prev = handlers.putIfAbsent(method, handler);
			if (prev != null && !prev.equals(handler)) {
				throw new IllegalStateException("Method '" + method + "' is already bound to '" + prev + "' in "
						+ role.className + ", cannot also bind it to '" + handler + "'");
			}
			return this;
		}

		public DispatchTable build() {
			if (handlers == null) {
				throw new IllegalStateException("Dispatch table for " + role.className + " is already built");
			}
			final DispatchTable ret = new DispatchTable(role, handlers);
			handlers = null;
			return ret;
		}
	}
}
