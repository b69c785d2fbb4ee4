package rpcgen.message;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import rpcgen.Fixtures;
import rpcgen.compile.TypeExpr;
import rpcgen.compile.TypeExpr.PrimitiveKind;
import rpcgen.compile.TypeExprCompiler;
import rpcgen.model.BaseType;
import rpcgen.model.MessageDirection;
import rpcgen.model.MetaModel;
import rpcgen.model.Notification;
import rpcgen.model.ReferenceType;
import rpcgen.model.Request;

public class TestMessageCompiler {

	private final MessageCompiler compiler = new MessageCompiler(new TypeExprCompiler());

	private static MetaModel messagesOnly(Request[] requests, Notification... notifications) {
		return new MetaModel(null, Arrays.asList(requests), Arrays.asList(notifications), Collections.emptyList(),
				Collections.emptyList(), Collections.emptyList());
	}

	@Test
	public void testMethodIdentifier() {
		assertEquals("hover", MessageCompiler.methodIdentifier("Hover"));
		assertEquals("did_change_text_document", MessageCompiler.methodIdentifier("DidChangeTextDocument"));
		assertEquals("handle_hover_request", MessageCompiler.handlerIdentifier("HoverRequest"));
		assertEquals("handle_hover_request_result", MessageCompiler.resultHandlerIdentifier("HoverRequest"));
	}

	@Test
	public void testHoverEndToEnd() {
		final Request hover = new Request("textDocument/hover", "Hover", new ReferenceType("HoverParams"),
				new ReferenceType("Hover"), MessageDirection.INITIATOR_TO_RESPONDER, "Hover docs");
		final CompiledDispatchers compiled = compiler.compile(messagesOnly(new Request[] { hover }));

		final DispatcherArtifact initiator = compiled.initiator;
		final Method sender = initiator.findMethod("hover", Method.Kind.REQUEST_SENDER);
		assertNotNull(sender);
		assertEquals(1, sender.arguments.size());
		assertEquals("params", sender.arguments.get(0).name);
		assertEquals(TypeExpr.named("HoverParams"), sender.arguments.get(0).type);
		assertNull(sender.returns);
		assertEquals("textDocument/hover", sender.wireMethod);
		assertEquals("Hover docs", sender.documentation);

		final Method resultHandler = initiator.findMethod("handle_hover_result", Method.Kind.RESULT_HANDLER);
		assertNotNull(resultHandler);
		assertEquals(TypeExpr.named("Hover"), resultHandler.arguments.get(1).type);
		assertNull(resultHandler.returns);
		assertEquals(0, initiator.table.size());

		final DispatcherArtifact responder = compiled.responder;
		assertEquals(Collections.singletonMap("textDocument/hover", "handle_hover"), responder.table.entries());
		final Method handler = responder.findMethod("handle_hover", Method.Kind.REQUEST_HANDLER);
		assertNotNull(handler);
		assertEquals("context", handler.arguments.get(0).name);
		assertEquals(TypeExpr.primitive(PrimitiveKind.OBJECT), handler.arguments.get(0).type);
		assertEquals(TypeExpr.named("HoverParams"), handler.arguments.get(1).type);
		assertEquals(TypeExpr.named("Hover"), handler.returns);
		assertTrue(handler.isStub());
		assertTrue(responder.senders().isEmpty());
	}

	@Test
	public void testBothNotification() {
		final Notification progress = new Notification("$/progress", "ProgressNotification",
				new ReferenceType("ProgressParams"), MessageDirection.BOTH);
		final CompiledDispatchers compiled = compiler.compile(messagesOnly(new Request[0], progress));

		for (Role role : Role.values()) {
			final DispatcherArtifact d = compiled.get(role);
			assertEquals(1, d.senders().size());
			assertEquals(1, d.stubs().size());
			assertEquals(Method.Kind.NOTIFICATION_SENDER, d.senders().get(0).kind);
			assertNull(d.senders().get(0).returns);
			assertNull(d.stubs().get(0).returns);
			assertEquals(Arrays.asList("$/progress"), d.table.methods());
			assertEquals("handle_progress_notification", d.table.handlerFor("$/progress"));
		}
	}

	@Test
	public void testBothRequest() {
		final Request req = new Request("x/both", "BothRequest", null, new ReferenceType("R"), MessageDirection.BOTH);
		final CompiledDispatchers compiled = compiler.compile(messagesOnly(new Request[] { req }));
		for (Role role : Role.values()) {
			final DispatcherArtifact d = compiled.get(role);
			assertNotNull(d.findMethod("both_request", Method.Kind.REQUEST_SENDER));
			assertNotNull(d.findMethod("handle_both_request_result", Method.Kind.RESULT_HANDLER));
			assertNotNull(d.findMethod("handle_both_request", Method.Kind.REQUEST_HANDLER));
			assertEquals(1, d.table.size());
		}
	}

	@Test
	public void testMissingParamsCompileToNull() {
		final Request shutdown = new Request("shutdown", "ShutdownRequest", null,
				new BaseType("null"), MessageDirection.INITIATOR_TO_RESPONDER);
		final CompiledDispatchers compiled = compiler.compile(messagesOnly(new Request[] { shutdown }));
		final Method handler = compiled.responder.findMethod("handle_shutdown_request", Method.Kind.REQUEST_HANDLER);
		assertEquals(TypeExpr.primitive(PrimitiveKind.NULL), handler.arguments.get(1).type);
		assertEquals(TypeExpr.primitive(PrimitiveKind.NULL), handler.returns);
	}

	@Test
	public void testEntryPointIsLast() {
		final CompiledDispatchers compiled = compiler.compile(Fixtures.loadMetaModel());
		for (Role role : Role.values()) {
			final DispatcherArtifact d = compiled.get(role);
			final Method entry = d.entryPoint();
			assertEquals(DispatcherArtifact.ENTRY_POINT_NAME, entry.name);
			assertEquals(Method.Kind.ENTRY_POINT, entry.kind);
			assertEquals(Arrays.asList("method", "payload"),
					Arrays.asList(entry.arguments.get(0).name, entry.arguments.get(1).name));
			assertFalse(entry.isStub());
		}
	}

	@Test
	public void testFixtureTables() {
		final CompiledDispatchers compiled = compiler.compile(Fixtures.loadMetaModel());
		assertEquals(Arrays.asList("workspace/configuration", "$/progress", "window/logMessage"),
				compiled.initiator.table.methods());
		assertEquals(Arrays.asList("textDocument/hover", "shutdown", "initialized", "$/progress"),
				compiled.responder.table.methods());
		assertEquals("handle_log_message_notification", compiled.initiator.table.handlerFor("window/logMessage"));
	}

	@Test
	public void testUnknownMethod() {
		final CompiledDispatchers compiled = compiler.compile(Fixtures.loadMetaModel());
		try {
			compiled.responder.table.handlerFor("window/logMessage");
			fail("Expected lookup failure");
		} catch (UnknownMethodException e) {
			assertEquals(Role.RESPONDER, e.role);
			assertEquals("window/logMessage", e.method);
		}
	}
}
