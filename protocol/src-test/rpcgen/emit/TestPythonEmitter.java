package rpcgen.emit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import rpcgen.Fixtures;
import rpcgen.GeneratedProtocol;
import rpcgen.Generator;
import rpcgen.compile.Field;
import rpcgen.compile.TypeExpr;
import rpcgen.compile.TypeExpr.PrimitiveKind;
import rpcgen.definition.RecordDefinition;
import rpcgen.message.Role;
import rpcgen.model.ArrayType;
import rpcgen.model.MetaModel;
import rpcgen.model.Property;
import rpcgen.model.ReferenceType;
import rpcgen.model.Structure;
import rpcgen.model.Type;

public class TestPythonEmitter {

	private final PythonEmitter emitter = new PythonEmitter("protocol");

	private static GeneratedProtocol fixture() {
		return new Generator().generate(Fixtures.loadMetaModel());
	}

	private static void assertContains(String expected, String actual) {
		assertTrue("Expected to find:\n" + expected + "\n--- in ---\n" + actual, actual.contains(expected));
	}

	@Test
	public void testRenderType() {
		assertEquals("str", emitter.renderType(TypeExpr.primitive(PrimitiveKind.STRING)));
		assertEquals("dict", emitter.renderType(TypeExpr.primitive(PrimitiveKind.OBJECT)));
		assertEquals("List[Dict[str, float]]", emitter.renderType(TypeExpr.sequenceOf(TypeExpr.associativeOf(
				TypeExpr.primitive(PrimitiveKind.STRING), TypeExpr.primitive(PrimitiveKind.FLOAT)))));
		assertEquals("Union[Hover, None]", emitter.renderType(
				TypeExpr.union(TypeExpr.named("Hover"), TypeExpr.primitive(PrimitiveKind.NULL))));
		assertEquals("Tuple[int, bool]", emitter.renderType(TypeExpr.tuple(Arrays.asList(
				TypeExpr.primitive(PrimitiveKind.INTEGER), TypeExpr.primitive(PrimitiveKind.BOOLEAN)))));
		assertEquals("Literal['full']", emitter.renderType(TypeExpr.literal("full")));
		assertEquals("Literal[True]", emitter.renderType(TypeExpr.literal(true)));
		assertEquals("NotRequired[\"LSPObject\"]",
				emitter.renderType(TypeExpr.optionalField(TypeExpr.forwardReference("LSPObject"))));
	}

	@Test
	public void testPyRepr() {
		assertEquals("'plain'", PythonEmitter.pyRepr("plain"));
		assertEquals("\"it's\"", PythonEmitter.pyRepr("it's"));
		assertEquals("'a\\'b\"c'", PythonEmitter.pyRepr("a'b\"c"));
		assertEquals("'\\x1b'", PythonEmitter.pyRepr("\u001b"));
		assertEquals("'line\\nbreak\\\\'", PythonEmitter.pyRepr("line\nbreak\\"));
		assertEquals("'åäö'", PythonEmitter.pyRepr("åäö"));
	}

	@Test
	public void testDocstring() {
		assertEquals("\"\"\"Plain.\"\"\"", PythonEmitter.docstring("Plain."));
		assertEquals("r\"\"\"Has \\n escape.\"\"\"", PythonEmitter.docstring("Has \\n escape."));
	}

	@Test
	public void testDocstringQuotes() {
		assertEquals("\"\"\"Kind is \"markdown\\\"\"\"\"", PythonEmitter.docstring("Kind is \"markdown\""));
		assertEquals("\"\"\"Say \\\"\\\"\\\"hi\\\"\\\"\\\" once\"\"\"",
				PythonEmitter.docstring("Say \"\"\"hi\"\"\" once"));
		assertEquals("\"\"\"Two \"\"\"\"\"", PythonEmitter.docstring("Two \"\""));
		// Backslashes can no longer be written raw, so they are escaped
		assertEquals("\"\"\"Match \\\\d+ in \"x\\\"\"\"\"", PythonEmitter.docstring("Match \\d+ in \"x\""));
		assertEquals("\"\"\"Ends with \\\\\"\"\"", PythonEmitter.docstring("Ends with \\"));
	}

	@Test
	public void testSafeName() {
		assertEquals("type_", PythonEmitter.safeName("type"));
		assertEquals("None_", PythonEmitter.safeName("None"));
		assertEquals("kind", PythonEmitter.safeName("kind"));
	}

	@Test
	public void testRecord() {
		final GeneratedProtocol protocol = fixture();
		assertEquals("class Position(TypedDict):\n" //
				+ "\tline: uinteger\n" //
				+ "\tcharacter: uinteger\n", emitter.emitDefinition(protocol.types.get("Position")));
		assertEquals("class Hover(TypedDict):\n" //
				+ "\tcontents: MarkupContent\n" //
				+ "\trange: NotRequired[Range]\n" //
				+ "\t\"\"\"An optional range.\"\"\"\n", emitter.emitDefinition(protocol.types.get("Hover")));
	}

	@Test
	public void testRecordWithParentAndKeywordField() {
		final GeneratedProtocol protocol = fixture();
		assertEquals("class HoverParams(TextDocumentPositionParams):\n" //
				+ "\tworkDoneToken: NotRequired[ProgressToken]\n", emitter.emitDefinition(protocol.types.get("HoverParams")));
		assertContains("\ttype_: MessageType\n", emitter.emitDefinition(protocol.types.get("LogMessageParams")));
	}

	@Test
	public void testSelfReferenceIsQuoted() {
		assertContains("\tparent: NotRequired[\"SelectionRange\"]\n",
				emitter.emitDefinition(fixture().types.get("SelectionRange")));
	}

	@Test
	public void testCycleThroughParentStillImports() {
		final Structure tree = new Structure("Tree", Arrays.asList(
				new Property("children", new ArrayType(new ReferenceType("Leaf")))));
		final Structure leaf = new Structure("Leaf", Arrays.<Type>asList(new ReferenceType("Tree")),
				Collections.emptyList(), Collections.emptyList(), null);
		final MetaModel model = new MetaModel(null, Collections.emptyList(), Collections.emptyList(),
				Arrays.asList(tree, leaf), Collections.emptyList(), Collections.emptyList());
		final String types = emitter.emitTypes(new Generator().generate(model));

		assertContains("class Tree(TypedDict):\n\tchildren: List[\"Leaf\"]\n", types);
		assertContains("class Leaf(Tree):\n", types);
		assertTrue(types.indexOf("class Tree(") < types.indexOf("class Leaf("));
	}

	@Test
	public void testEmptyRecord() {
		final RecordDefinition empty = new RecordDefinition("Empty", Collections.emptyList(),
				Collections.<Field>emptyList(), null);
		assertEquals("class Empty(TypedDict):\n\t\"\"\"\"\"\"", emitter.emitDefinition(empty));
	}

	@Test
	public void testEnumerations() {
		final GeneratedProtocol protocol = fixture();
		assertEquals("class ControlCharacter(str, Enum):\n" //
				+ "\tEscape = '\\x1b'\n" //
				+ "\tNone_ = ''\n", emitter.emitDefinition(protocol.types.get("ControlCharacter")));
		assertEquals("class MessageType(uinteger, Enum):\n" //
				+ "\tError = 1\n" //
				+ "\t\"\"\"An error message.\"\"\"\n" //
				+ "\tWarning = 2\n", emitter.emitDefinition(protocol.types.get("MessageType")));
	}

	@Test
	public void testAliases() {
		final GeneratedProtocol protocol = fixture();
		assertEquals("uinteger: TypeAlias = int", emitter.emitDefinition(protocol.types.get("uinteger")));
		assertEquals("LSPAny: TypeAlias = Union[\"LSPObject\", \"LSPArray\", str, int, uinteger, float, bool, None]\n"
				+ "\"\"\"The LSP any type.\"\"\"", emitter.emitDefinition(protocol.types.get("LSPAny")));
	}

	@Test
	public void testTypesArtifact() {
		final String types = emitter.emitTypes(fixture());
		assertTrue(types.startsWith(
				"# Automatically generated by rpcgen from protocol version 3.17.0. Do not edit.\n\n"
						+ "from __future__ import annotations\n\n" //
						+ "from enum import Enum\n\n" //
						+ "from typing import (\n\tList,\n"));
		// Placed before LSPAny, so the reference back to it is deferred
		assertContains("LSPObject: TypeAlias = Dict[str, \"LSPAny\"]", types);
		assertContains("LSPArray: TypeAlias = List[\"LSPAny\"]", types);
		assertTrue(types.indexOf("class Position(") < types.indexOf("class Range("));
		assertTrue(types.endsWith("\n"));
	}

	@Test
	public void testInitiator() {
		final String initiator = emitter.emitDispatcher(fixture(), Role.INITIATOR);
		assertContains("from typing import List, Union\n\n", initiator);
		assertContains("from .protocol import (\n" //
				+ "\tHoverParams,\n" //
				+ "\tHover,\n" //
				+ "\tConfigurationParams,\n" //
				+ "\tLSPAny,\n" //
				+ "\tInitializedParams,\n" //
				+ "\tProgressParams,\n" //
				+ "\tLogMessageParams\n" //
				+ ")\n\nclass Initiator:\n", initiator);
		assertContains("\tdef hover_request(self, params: HoverParams) -> None:\n" //
				+ "\t\t\"\"\"Request hover information at a given text document position.\"\"\"\n" //
				+ "\t\tself.request(method='textDocument/hover', params=params)\n", initiator);
		assertContains("\tdef handle_hover_request_result(self, context: dict, result: Union[Hover, None]) -> None:\n" //
				+ "\t\traise NotImplementedError('handle_hover_request_result')\n", initiator);
		assertContains(
				"\tdef handle_configuration_request(self, context: dict, params: ConfigurationParams) -> List[LSPAny]:\n",
				initiator);
		assertContains("\tdef progress_notification(self, params: ProgressParams) -> None:\n" //
				+ "\t\tself.notify(method='$/progress', params=params)\n", initiator);
		assertContains("\tdef handle(self, method: str, payload: dict) -> None:\n" //
				+ "\t\thandle_map = {\n" //
				+ "\t\t\t'workspace/configuration': self.handle_configuration_request,\n" //
				+ "\t\t\t'$/progress': self.handle_progress_notification,\n" //
				+ "\t\t\t'window/logMessage': self.handle_log_message_notification,\n" //
				+ "\t\t}\n" //
				+ "\t\treturn handle_map[method]({}, payload)\n", initiator);
	}

	@Test
	public void testResponder() {
		final String responder = emitter.emitDispatcher(fixture(), Role.RESPONDER);
		assertContains("class Responder:\n", responder);
		assertContains("\tdef log_message_notification(self, params: LogMessageParams) -> None:\n" //
				+ "\t\tr\"\"\"Log a message in the client.\\nThe message is shown as is.\"\"\"\n", responder);
		assertContains("\tdef handle_shutdown_request(self, context: dict, params: None) -> None:\n", responder);
	}
}
