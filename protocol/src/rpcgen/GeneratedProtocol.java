package rpcgen;

import java.util.Collections;
import java.util.List;

import rpcgen.message.CompiledDispatchers;
import rpcgen.message.DispatcherArtifact;
import rpcgen.message.Role;
import rpcgen.order.OrderedDefinitions;

/**
 * Everything produced from one metamodel: the ordered type definitions and
 * both dispatchers, each with the type names it must import.
 */
public class GeneratedProtocol {

	public final String version;
	public final OrderedDefinitions types;
	public final CompiledDispatchers dispatchers;
	public final List<String> initiatorImports;
	public final List<String> responderImports;

	public GeneratedProtocol(String version, OrderedDefinitions types, CompiledDispatchers dispatchers,
			List<String> initiatorImports, List<String> responderImports) {
		this.version = version;
		this.types = types;
		this.dispatchers = dispatchers;
		this.initiatorImports = Collections.unmodifiableList(initiatorImports);
		this.responderImports = Collections.unmodifiableList(responderImports);
	}

	public DispatcherArtifact dispatcher(Role role) {
		return dispatchers.get(role);
	}

	public List<String> importsFor(Role role) {
		return role == Role.INITIATOR ? initiatorImports : responderImports;
	}
}
