package rpcgen.message;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

import rpcgen.compile.TypeExpr;
import rpcgen.compile.TypeExpr.PrimitiveKind;
import rpcgen.compile.TypeExprCompiler;
import rpcgen.model.MetaModel;
import rpcgen.model.Notification;
import rpcgen.model.Request;

/**
 * Compiles requests and notifications into the two dispatcher artifacts.
 * <p>
 * The sending role of a message gets a sender method. The receiving role gets a
 * handler stub and a dispatch table entry. For requests, the sending role also
 * gets a stub receiving the result. Messages with direction
 * {@link rpcgen.model.MessageDirection#BOTH BOTH} are compiled once per
 * direction.
 */
public class MessageCompiler {

	public static final String HANDLER_PREFIX = "handle_";
	public static final String RESULT_HANDLER_SUFFIX = "_result";

	private static final Pattern CASE_BOUNDARY = Pattern.compile("([^A-Z])([A-Z])");

	private final TypeExprCompiler compiler;
	private final TypeExpr contextType = TypeExpr.primitive(PrimitiveKind.OBJECT);
	private final TypeExpr payloadType = TypeExpr.primitive(PrimitiveKind.OBJECT);

	public MessageCompiler(TypeExprCompiler compiler) {
		this.compiler = compiler;
	}

	/**
	 * <code>DidChangeTextDocument</code> becomes
	 * <code>did_change_text_document</code>.
	 */
	public static String methodIdentifier(String typeName) {
		return CASE_BOUNDARY.matcher(typeName).replaceAll("$1_$2").toLowerCase(Locale.ENGLISH);
	}

	public static String handlerIdentifier(String typeName) {
		return HANDLER_PREFIX + methodIdentifier(typeName);
	}

	public static String resultHandlerIdentifier(String typeName) {
		return handlerIdentifier(typeName) + RESULT_HANDLER_SUFFIX;
	}

	public CompiledDispatchers compile(MetaModel model) {
		final DispatcherArtifact.Builder initiator = new DispatcherArtifact.Builder(Role.INITIATOR);
		final DispatcherArtifact.Builder responder = new DispatcherArtifact.Builder(Role.RESPONDER);

		for (Request req : model.requests) {
			if (req.direction.initiatorSends()) {
				compileRequest(req, initiator, responder);
			}
			if (req.direction.responderSends()) {
				compileRequest(req, responder, initiator);
			}
		}
		for (Notification notification : model.notifications) {
			if (notification.direction.initiatorSends()) {
				compileNotification(notification, initiator, responder);
			}
			if (notification.direction.responderSends()) {
				compileNotification(notification, responder, initiator);
			}
		}
		return new CompiledDispatchers(initiator.build(payloadType), responder.build(payloadType));
	}

	private void compileRequest(Request req, DispatcherArtifact.Builder sender, DispatcherArtifact.Builder receiver) {
		final TypeExpr params = compiler.compile(req.params);
		final TypeExpr result = compiler.compile(req.result);

		sender.add(new Method(methodIdentifier(req.typeName), Method.Kind.REQUEST_SENDER, //
				Arrays.asList(new Argument("params", params)), //
				null, req.method, req.documentation));
		sender.add(new Method(resultHandlerIdentifier(req.typeName), Method.Kind.RESULT_HANDLER, //
				Arrays.asList(new Argument("context", contextType), new Argument("result", result)), //
				null, req.method, null));
		receiver.add(new Method(handlerIdentifier(req.typeName), Method.Kind.REQUEST_HANDLER, //
				Arrays.asList(new Argument("context", contextType), new Argument("params", params)), //
				result, req.method, null));
	}

	private void compileNotification(Notification notification, DispatcherArtifact.Builder sender,
			DispatcherArtifact.Builder receiver) {
		final TypeExpr params = compiler.compile(notification.params);

		sender.add(new Method(methodIdentifier(notification.typeName), Method.Kind.NOTIFICATION_SENDER, //
				Arrays.asList(new Argument("params", params)), //
				null, notification.method, notification.documentation));
		receiver.add(new Method(handlerIdentifier(notification.typeName), Method.Kind.NOTIFICATION_HANDLER, //
				Arrays.asList(new Argument("context", contextType), new Argument("params", params)), //
				null, notification.method, null));
	}
}
