package rpcgen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Test;

import rpcgen.emit.PythonEmitter;
import rpcgen.message.Role;

public class TestGenerator {

	@Test
	public void testTypesStartWithBaseAliases() {
		final GeneratedProtocol protocol = new Generator().generate(Fixtures.loadMetaModel());
		assertEquals("3.17.0", protocol.version);
		assertEquals(Arrays.asList("uinteger", "URI", "DocumentUri", "RegExp"),
				new ArrayList<>(protocol.types.names()).subList(0, 4));
	}

	@Test
	public void testImports() {
		final GeneratedProtocol protocol = new Generator().generate(Fixtures.loadMetaModel());
		assertEquals(Arrays.asList("HoverParams", "Hover", "ConfigurationParams", "LSPAny", "InitializedParams",
				"ProgressParams", "LogMessageParams"), protocol.importsFor(Role.INITIATOR));
		assertEquals(protocol.initiatorImports, protocol.importsFor(Role.INITIATOR));
		assertEquals(protocol.responderImports, protocol.importsFor(Role.RESPONDER));
		for (String name : protocol.responderImports) {
			assertTrue(protocol.types.names().contains(name));
		}
	}

	@Test
	public void testDeterministic() {
		final PythonEmitter emitter = new PythonEmitter(GenAll.TYPES_MODULE);
		final GeneratedProtocol first = new Generator().generate(Fixtures.loadMetaModel());
		final GeneratedProtocol second = new Generator().generate(Fixtures.loadMetaModel());
		assertEquals(emitter.emitTypes(first), emitter.emitTypes(second));
		for (Role role : Role.values()) {
			assertEquals(emitter.emitDispatcher(first, role), emitter.emitDispatcher(second, role));
		}
	}
}
