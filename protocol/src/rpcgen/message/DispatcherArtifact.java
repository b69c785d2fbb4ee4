package rpcgen.message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import rpcgen.compile.Annotated;
import rpcgen.compile.TypeExpr;

/**
 * One role's compiled dispatcher: sender methods, handler stubs, the frozen
 * dispatch table and the <code>handle(method, payload)</code> entry point.
 */
public class DispatcherArtifact implements Annotated {

	public static final String ENTRY_POINT_NAME = "handle";

	public final Role role;

	/**
	 * All methods in generation order. The entry point is last.
	 */
	public final List<Method> methods;
	public final DispatchTable table;

	private DispatcherArtifact(Role role, List<Method> methods, DispatchTable table) {
		this.role = role;
		this.methods = Collections.unmodifiableList(methods);
		this.table = table;
	}

	public Method entryPoint() {
		return methods.get(methods.size() - 1);
	}

	public List<Method> senders() {
		final List<Method> ret = new ArrayList<>();
		for (Method m : methods) {
			if (m.kind.isSender()) {
				ret.add(m);
			}
		}
		return ret;
	}

	public List<Method> stubs() {
		final List<Method> ret = new ArrayList<>();
		for (Method m : methods) {
			if (m.isStub()) {
				ret.add(m);
			}
		}
		return ret;
	}

	/**
	 * Find a method by name and kind, or <code>null</code>.
	 */
	public Method findMethod(String name, Method.Kind kind) {
		for (Method m : methods) {
			if (m.name.equals(name) && m.kind == kind) {
				return m;
			}
		}
		return null;
	}

	@Override
	public List<TypeExpr> annotations() {
		final List<TypeExpr> ret = new ArrayList<>();
		for (Method m : methods) {
			for (Argument arg : m.arguments) {
				ret.add(arg.type);
			}
			if (m.returns != null) {
				ret.add(m.returns);
			}
		}
		return ret;
	}

	@Override
	public String toString() {
		return "Dispatcher<" + role.className + ", " + methods.size() + " methods>";
	}

	static class Builder {
		private final Role role;
		private final List<Method> methods = new ArrayList<>();
		private final DispatchTable.Builder table;

		Builder(Role role) {
			this.role = role;
			this.table = DispatchTable.builder(role);
		}

		void add(Method method) {
			methods.add(method);
			if (method.kind.isDispatched()) {
				table.register(method.wireMethod, method.name);
			}
		}

		DispatcherArtifact build(TypeExpr payloadType) {
			methods.add(new Method(ENTRY_POINT_NAME, Method.Kind.ENTRY_POINT, //
					Arrays.asList(new Argument("method", TypeExpr.primitive(TypeExpr.PrimitiveKind.STRING)),
							new Argument("payload", payloadType)), //
					null, null, null));
			return new DispatcherArtifact(role, new ArrayList<>(methods), table.build());
		}
	}
}
