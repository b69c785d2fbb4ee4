package rpcgen.runtime;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.json.JSONObject;
import org.junit.Test;

import rpcgen.compile.TypeExprCompiler;
import rpcgen.message.CompiledDispatchers;
import rpcgen.message.MessageCompiler;
import rpcgen.message.UnknownMethodException;
import rpcgen.model.MessageDirection;
import rpcgen.model.MetaModel;
import rpcgen.model.Notification;
import rpcgen.model.ReferenceType;
import rpcgen.model.Request;

public class TestEndpoint {

	private static class RecordingTransport implements Transport {
		final List<String> sent = new ArrayList<>();

		@Override
		public void request(String method, Object params) {
			sent.add("request " + method + " " + params);
		}

		@Override
		public void notify(String method, Object params) {
			sent.add("notify " + method + " " + params);
		}
	}

	private static CompiledDispatchers compile() {
		final Request hover = new Request("textDocument/hover", "HoverRequest", new ReferenceType("HoverParams"),
				new ReferenceType("Hover"), MessageDirection.INITIATOR_TO_RESPONDER);
		final Notification progress = new Notification("$/progress", "ProgressNotification",
				new ReferenceType("ProgressParams"), MessageDirection.BOTH);
		final Notification exit = new Notification("exit", "ExitNotification", null,
				MessageDirection.INITIATOR_TO_RESPONDER);
		final MetaModel model = new MetaModel("1.0", Arrays.asList(hover), Arrays.asList(progress, exit),
				Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
		return new MessageCompiler(new TypeExprCompiler()).compile(model);
	}

	@Test
	public void testHandleDispatchesToBoundHandler() {
		final Endpoint responder = new Endpoint(compile().responder, new RecordingTransport());
		responder.bind("handle_hover_request", (ctx, params) -> {
			assertEquals(0, ctx.length());
			return new JSONObject().put("contents", "Docs for " + ((JSONObject) params).getString("word"));
		});
		final Object res = responder.handle("textDocument/hover", new JSONObject().put("word", "foo"));
		assertEquals("Docs for foo", ((JSONObject) res).getString("contents"));
	}

	@Test
	public void testFreshContextPerCall() {
		final Endpoint responder = new Endpoint(compile().responder, new RecordingTransport());
		final List<JSONObject> contexts = new ArrayList<>();
		responder.bind("handle_exit_notification", (ctx, params) -> {
			contexts.add(ctx);
			ctx.put("seen", true);
			return null;
		});
		responder.handle("exit", null);
		responder.handle("exit", null);
		assertEquals(2, contexts.size());
		assertTrue(contexts.get(0) != contexts.get(1));
	}

	@Test
	public void testUnknownMethod() {
		final Endpoint responder = new Endpoint(compile().responder, new RecordingTransport());
		try {
			responder.handle("textDocument/unknown", null);
			fail("Expected lookup failure");
		} catch (UnknownMethodException e) {
			assertEquals("textDocument/unknown", e.method);
		}
	}

	@Test
	public void testUnboundStub() {
		final Endpoint responder = new Endpoint(compile().responder, new RecordingTransport());
		try {
			responder.handle("$/progress", new JSONObject());
			fail("Expected unimplemented handler");
		} catch (UnimplementedHandlerException e) {
			assertEquals("handle_progress_notification", e.handlerId);
			assertEquals("$/progress", e.method);
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBindUnknownHandler() {
		new Endpoint(compile().initiator, new RecordingTransport()).bind("handle_hover_request", (ctx, p) -> null);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSendersCannotBeBound() {
		new Endpoint(compile().initiator, new RecordingTransport()).bind("hover_request", (ctx, p) -> null);
	}

	@Test
	public void testSendNotification() {
		final RecordingTransport transport = new RecordingTransport();
		final Endpoint initiator = new Endpoint(compile().initiator, transport);
		initiator.send("exit_notification", "bye");
		assertEquals(Arrays.asList("notify exit bye"), transport.sent);
	}

	@Test
	public void testSendRequestDoesNotWaitForResult() {
		final RecordingTransport transport = new RecordingTransport();
		final Endpoint initiator = new Endpoint(compile().initiator, transport);
		initiator.bind("handle_hover_request_result", (ctx, result) -> {
			fail("Result handler must only run when a result arrives");
			return null;
		});
		initiator.send("hover_request", "p");
		assertEquals(Arrays.asList("request textDocument/hover p"), transport.sent);
	}

	@Test
	public void testResultGoesToResultHandler() {
		final Endpoint initiator = new Endpoint(compile().initiator, new RecordingTransport());
		final List<Object> results = new ArrayList<>();
		initiator.bind("handle_hover_request_result", (ctx, result) -> results.add(result));
		initiator.handleResult("textDocument/hover", "contents");
		assertEquals(Arrays.asList("contents"), results);
	}

	@Test
	public void testUnboundResultHandler() {
		final Endpoint initiator = new Endpoint(compile().initiator, new RecordingTransport());
		try {
			initiator.handleResult("textDocument/hover", "contents");
			fail("Expected unimplemented result handler");
		} catch (UnimplementedHandlerException e) {
			assertEquals("handle_hover_request_result", e.handlerId);
		}
	}

	@Test(expected = UnknownMethodException.class)
	public void testResultForNotification() {
		new Endpoint(compile().initiator, new RecordingTransport()).handleResult("exit", null);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSendUnknown() {
		new Endpoint(compile().responder, new RecordingTransport()).send("hover_request", null);
	}

	@Test
	public void testBothDirections() {
		final CompiledDispatchers compiled = compile();
		final RecordingTransport transport = new RecordingTransport();
		final Endpoint initiator = new Endpoint(compiled.initiator, transport);
		final Endpoint responder = new Endpoint(compiled.responder, transport);
		final List<Object> received = new ArrayList<>();
		initiator.bind("handle_progress_notification", (ctx, p) -> received.add(p));
		responder.bind("handle_progress_notification", (ctx, p) -> received.add(p));

		initiator.handle("$/progress", "from responder");
		responder.handle("$/progress", "from initiator");
		responder.send("progress_notification", 50);
		assertEquals(Arrays.asList("from responder", "from initiator"), received);
		assertEquals(Arrays.asList("notify $/progress 50"), transport.sent);
	}
}
