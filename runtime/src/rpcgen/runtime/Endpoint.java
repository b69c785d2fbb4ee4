package rpcgen.runtime;

import java.util.HashMap;
import java.util.Map;

import org.json.JSONObject;

import rpcgen.message.DispatchTable;
import rpcgen.message.DispatcherArtifact;
import rpcgen.message.Method;
import rpcgen.message.UnknownMethodException;

/**
 * Executes one role of a compiled dispatcher. Stubs are overridden with
 * {@link #bind(String, MessageHandler)}; incoming messages enter through
 * {@link #handle(String, Object)} and outgoing ones leave through
 * {@link #send(String, Object)}. Results of sent requests arrive through
 * {@link #handleResult(String, Object)}.
 */
public class Endpoint {

	public static final boolean DEBUG = Boolean.getBoolean("rpcgen.debug");

	private final DispatcherArtifact dispatcher;
	private final Transport transport;

	// Indexed by dispatch table slot
	private final MessageHandler[] slots;
	// Result handlers by wire method, these are never dispatched through the table
	private final Map<String, MessageHandler> resultHandlers = new HashMap<>();

	public Endpoint(DispatcherArtifact dispatcher, Transport transport) {
		this.dispatcher = dispatcher;
		this.transport = transport;
		this.slots = new MessageHandler[dispatcher.table.size()];
	}

	public DispatcherArtifact getDispatcher() {
		return dispatcher;
	}

	public Endpoint bind(String handlerId, MessageHandler handler) {
		boolean found = false;
		for (Method m : dispatcher.methods) {
			if (!m.isStub() || !m.name.equals(handlerId)) {
				continue;
			}
			found = true;
			if (m.kind.isDispatched()) {
				slots[dispatcher.table.slotOf(m.wireMethod)] = handler;
			} else {
				resultHandlers.put(m.wireMethod, handler);
			}
		}
		if (!found) {
			throw new IllegalArgumentException(
					"'" + handlerId + "' is not a handler stub of " + dispatcher.role.className);
		}
		return this;
	}

	public Object handle(String method, Object payload) {
		final long start = System.nanoTime();
		final DispatchTable table = dispatcher.table;
		final int slot = table.slotOf(method);
		final MessageHandler handler = slots[slot];
		if (handler == null) {
			throw new UnimplementedHandlerException(dispatcher.role, table.handlerAt(slot), method);
		}
		final Object ret = handler.handle(new JSONObject(), payload);
		if (DEBUG) {
			System.out.printf("Handled '%s' in %.2fms%n", method, (System.nanoTime() - start) / 1_000_000.0);
		}
		return ret;
	}

	/**
	 * Deliver the result of a request this endpoint sent to the bound result
	 * handler.
	 */
	public Object handleResult(String method, Object result) {
		final Method stub = findResultHandler(method);
		final MessageHandler handler = resultHandlers.get(method);
		if (handler == null) {
			throw new UnimplementedHandlerException(dispatcher.role, stub.name, method);
		}
		return handler.handle(new JSONObject(), result);
	}

	private Method findResultHandler(String method) {
		for (Method m : dispatcher.methods) {
			if (m.kind == Method.Kind.RESULT_HANDLER && m.wireMethod.equals(method)) {
				return m;
			}
		}
		throw new UnknownMethodException(dispatcher.role, method);
	}

	/**
	 * Invoke a sender method. Requests and notifications alike are handed to the
	 * transport without waiting for a response.
	 */
	public void send(String senderName, Object params) {
		for (Method m : dispatcher.senders()) {
			if (!m.name.equals(senderName)) {
				continue;
			}
			if (m.kind == Method.Kind.NOTIFICATION_SENDER) {
				transport.notify(m.wireMethod, params);
			} else {
				transport.request(m.wireMethod, params);
			}
			return;
		}
		throw new IllegalArgumentException("'" + senderName + "' is not a sender of " + dispatcher.role.className);
	}
}
