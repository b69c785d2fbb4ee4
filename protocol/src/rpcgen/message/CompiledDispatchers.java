package rpcgen.message;

public class CompiledDispatchers {

	public final DispatcherArtifact initiator;
	public final DispatcherArtifact responder;

	public CompiledDispatchers(DispatcherArtifact initiator, DispatcherArtifact responder) {
		this.initiator = initiator;
		this.responder = responder;
	}

	public DispatcherArtifact get(Role role) {
		return role == Role.INITIATOR ? initiator : responder;
	}
}
