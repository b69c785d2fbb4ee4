package rpcgen.runtime;

import org.json.JSONObject;

@FunctionalInterface
public interface MessageHandler {

	/**
	 * @param context fresh per invocation, handlers may use it as scratch space
	 * @param payload the params of an incoming message, or the result of a request
	 *                this endpoint sent
	 * @return the response for requests, ignored for notifications
	 */
	Object handle(JSONObject context, Object payload);
}
