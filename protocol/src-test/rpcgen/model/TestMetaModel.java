package rpcgen.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.junit.Test;

import rpcgen.Fixtures;

public class TestMetaModel {

	private static Structure structure(MetaModel model, String name) {
		for (Structure s : model.structures) {
			if (s.name.equals(name)) {
				return s;
			}
		}
		throw new AssertionError("No structure " + name);
	}

	@Test
	public void testLoadCounts() {
		final MetaModel model = Fixtures.loadMetaModel();
		assertEquals("3.17.0", model.version);
		assertEquals(3, model.requests.size());
		assertEquals(3, model.notifications.size());
		assertEquals(15, model.structures.size());
		assertEquals(3, model.enumerations.size());
		assertEquals(4, model.typeAliases.size());
	}

	@Test
	public void testEmptyModel() {
		final MetaModel model = MetaModel.fromJSON(new JSONObject());
		assertNull(model.version);
		assertTrue(model.requests.isEmpty());
		assertTrue(model.structures.isEmpty());
	}

	@Test
	public void testExtendsAndMixins() {
		final Structure hoverParams = structure(Fixtures.loadMetaModel(), "HoverParams");
		assertEquals(1, hoverParams.parents.size());
		assertEquals("TextDocumentPositionParams", ((ReferenceType) hoverParams.parents.get(0)).name);
		assertEquals(1, hoverParams.mixins.size());
		assertEquals("WorkDoneProgressParams", ((ReferenceType) hoverParams.mixins.get(0)).name);
		assertTrue(hoverParams.properties.isEmpty());
	}

	@Test
	public void testOptionalProperty() {
		final Structure hover = structure(Fixtures.loadMetaModel(), "Hover");
		assertFalse(hover.properties.get(0).optional);
		assertTrue(hover.properties.get(1).optional);
		assertEquals("An optional range.", hover.properties.get(1).documentation);
	}

	@Test
	public void testMessages() {
		final MetaModel model = Fixtures.loadMetaModel();
		final Request hover = model.requests.get(0);
		assertEquals("textDocument/hover", hover.method);
		assertEquals("HoverRequest", hover.typeName);
		assertEquals(MessageDirection.INITIATOR_TO_RESPONDER, hover.direction);
		assertEquals(Type.Kind.OR, hover.result.kind);

		final Request shutdown = model.requests.get(2);
		assertNull(shutdown.params);

		final Notification progress = model.notifications.get(1);
		assertEquals(MessageDirection.BOTH, progress.direction);
		assertTrue(progress.direction.initiatorSends());
		assertTrue(progress.direction.responderSends());
		assertEquals(MessageDirection.RESPONDER_TO_INITIATOR, model.notifications.get(2).direction);
	}

	@Test
	public void testParamsArrayIsTuple() {
		final Notification n = Notification.fromJSON(new JSONObject() //
				.put("method", "x/y") //
				.put("typeName", "XYNotification") //
				.put("messageDirection", "clientToServer") //
				.put("params", new JSONArray() //
						.put(new JSONObject().put("kind", "base").put("name", "string")) //
						.put(new JSONObject().put("kind", "base").put("name", "integer"))));
		assertEquals(Type.Kind.TUPLE, n.params.kind);
		assertEquals(2, ((TupleType) n.params).items.size());
	}

	@Test
	public void testEnumerationValues() {
		final MetaModel model = Fixtures.loadMetaModel();
		final Enumeration messageType = model.enumerations.get(1);
		assertEquals(EnumerationKind.UINTEGER, messageType.kind);
		assertEquals(1, ((Number) messageType.values.get(0).value).intValue());
		assertEquals("An error message.", messageType.values.get(0).documentation);

		final Enumeration control = model.enumerations.get(2);
		assertTrue(control.supportsCustomValues);
		final EnumerationEntry escape = control.values.get(0);
		assertEquals("Escape", escape.name);
		assertEquals("\u001b", escape.value);
		assertEquals(1, ((String) escape.value).length());
	}

	@Test
	public void testStructureLiteral() {
		final Structure support = structure(Fixtures.loadMetaModel(), "MarkupKindSupport");
		final Type resolve = support.properties.get(1).type;
		assertEquals(Type.Kind.STRUCTURE_LITERAL, resolve.kind);
		assertEquals("properties", ((StructureLiteralType) resolve).value.properties.get(0).name);
	}

	@Test(expected = JSONException.class)
	public void testUnknownTypeKind() {
		Type.fromJSON(new JSONObject().put("kind", "intersection"));
	}
}
