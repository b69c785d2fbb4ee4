package rpcgen.runtime;

/**
 * The connection to the remote endpoint. Framing, ids and correlation of
 * responses are the implementation's business. Results of requests come back
 * through {@link Endpoint#handleResult(String, Object)}.
 */
public interface Transport {

	void request(String method, Object params);

	void notify(String method, Object params);
}
