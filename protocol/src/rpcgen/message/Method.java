package rpcgen.message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import rpcgen.compile.TypeExpr;

/**
 * A method on a dispatcher artifact.
 */
public class Method {

	public static enum Kind {
		/**
		 * Issues <code>request(method, params)</code> on the transport.
		 */
		REQUEST_SENDER,

		/**
		 * Issues <code>notify(method, params)</code> on the transport.
		 */
		NOTIFICATION_SENDER,

		/**
		 * Receives the result of a request this role sent. Stub.
		 */
		RESULT_HANDLER,

		/**
		 * Answers an incoming request. Stub, registered in the dispatch table.
		 */
		REQUEST_HANDLER,

		/**
		 * Receives an incoming notification. Stub, registered in the dispatch table.
		 */
		NOTIFICATION_HANDLER,

		/**
		 * <code>handle(method, payload)</code>.
		 */
		ENTRY_POINT;

		public boolean isSender() {
			return this == REQUEST_SENDER || this == NOTIFICATION_SENDER;
		}

		public boolean isStub() {
			switch (this) {
			case RESULT_HANDLER:
			case REQUEST_HANDLER:
			case NOTIFICATION_HANDLER:
				return true;
			default:
				return false;
			}
		}

		public boolean isDispatched() {
			return this == REQUEST_HANDLER || this == NOTIFICATION_HANDLER;
		}
	}

	public final String name;
	public final Kind kind;
	public final List<Argument> arguments;

	/**
	 * Return type, or <code>null</code> for methods that return nothing.
	 */
	public final TypeExpr returns;

	/**
	 * The wire method this method sends or handles, <code>null</code> for the
	 * entry point.
	 */
	public final String wireMethod;
	public final String documentation;

	public Method(String name, Kind kind, List<Argument> arguments, TypeExpr returns, String wireMethod,
			String documentation) {
		this.name = name;
		this.kind = kind;
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
		this.returns = returns;
		this.wireMethod = wireMethod;
		this.documentation = documentation;
	}

	public boolean isStub() {
		return kind.isStub();
	}

	@Override
	public String toString() {
		return kind + "<" + name + arguments + (returns != null ? " -> " + returns : "") + ">";
	}
}
