package rpcgen.order;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import rpcgen.Fixtures;
import rpcgen.compile.Field;
import rpcgen.compile.TypeExpr;
import rpcgen.compile.TypeExprCompiler;
import rpcgen.definition.AliasDefinition;
import rpcgen.definition.Definition;
import rpcgen.definition.DefinitionBuilder;
import rpcgen.definition.RecordDefinition;

public class TestDependencyOrderer {

	private final DependencyOrderer orderer = new DependencyOrderer();

	private static Definition record(String name, String... fieldTypes) {
		final List<Field> fields = new ArrayList<>();
		for (int i = 0; i < fieldTypes.length; i++) {
			fields.add(new Field("f" + i, TypeExpr.named(fieldTypes[i])));
		}
		return new RecordDefinition(name, Collections.emptyList(), fields, null);
	}

	private static Definition child(String name, String parent) {
		return new RecordDefinition(name, Arrays.asList(TypeExpr.named(parent)), Collections.emptyList(), null);
	}

	private static List<String> order(DependencyOrderer orderer, Definition... defs) {
		return new ArrayList<>(orderer.order(Arrays.asList(defs)).names());
	}

	@Test
	public void testUnrelatedKeepDeclarationOrder() {
		assertEquals(Arrays.asList("C", "A", "B"), order(orderer, record("C"), record("A"), record("B")));
	}

	@Test
	public void testDependencyFirst() {
		assertEquals(Arrays.asList("Position", "Range"), order(orderer, record("Range", "Position", "Position"),
				record("Position")));
		assertEquals(Arrays.asList("Base", "Derived"), order(orderer, child("Derived", "Base"), record("Base")));
	}

	@Test
	public void testDiamond() {
		final OrderedDefinitions ordered = orderer.order(Arrays.asList( //
				record("Top", "Left", "Right"), //
				record("Left", "Bottom"), //
				record("Right", "Bottom"), //
				record("Bottom")));
		assertEquals(Arrays.asList("Bottom", "Left", "Right", "Top"), new ArrayList<>(ordered.names()));
		assertTrue(ordered.forwardReferences.isEmpty());
	}

	@Test
	public void testUnknownNamesIgnored() {
		assertEquals(Arrays.asList("A"), order(orderer, record("A", "NotDefinedAnywhere")));
	}

	@Test
	public void testSelfReference() {
		final OrderedDefinitions ordered = orderer.order(Arrays.asList(record("Node", "Node")));
		assertEquals(1, ordered.definitions.size());
		assertEquals(Arrays.asList(new ForwardReference("Node", "Node")), ordered.forwardReferences);
		assertTrue(ordered.forwardReferences.get(0).isSelfReference());
	}

	@Test
	public void testMutualReference() {
		final OrderedDefinitions ordered = orderer.order(Arrays.asList(record("A", "B"), record("B", "A")));
		assertEquals(Arrays.asList("B", "A"), new ArrayList<>(ordered.names()));
		assertEquals(Arrays.asList(new ForwardReference("B", "A")), ordered.forwardReferences);
	}

	@Test
	public void testCycleThroughParentIsBrokenOnField() {
		final Definition tree = new RecordDefinition("Tree", Collections.emptyList(),
				Arrays.asList(new Field("children", TypeExpr.sequenceOf(TypeExpr.named("Leaf")))), null);
		final OrderedDefinitions ordered = orderer.order(Arrays.asList(tree, child("Leaf", "Tree")));
		assertEquals(Arrays.asList("Tree", "Leaf"), new ArrayList<>(ordered.names()));
		assertEquals(Arrays.asList(new ForwardReference("Tree", "Leaf")), ordered.forwardReferences);
	}

	@Test
	public void testCycleThroughGrandparent() {
		final OrderedDefinitions ordered = orderer.order(Arrays.asList( //
				record("Root", "Middle"), //
				record("Middle", "Leaf"), //
				child("Leaf", "Base"), //
				child("Base", "Root")));
		assertEquals(Arrays.asList("Root", "Middle", "Base", "Leaf"), new ArrayList<>(ordered.names()));
		assertEquals(Arrays.asList(new ForwardReference("Middle", "Leaf")), ordered.forwardReferences);
	}

	@Test
	public void testParentDeclaredLaterInCycle() {
		final Definition tree = new RecordDefinition("Tree", Collections.emptyList(),
				Arrays.asList(new Field("children", TypeExpr.sequenceOf(TypeExpr.named("Leaf")))), null);
		final OrderedDefinitions ordered = orderer.order(Arrays.asList(child("Leaf", "Tree"), tree));
		assertEquals(Arrays.asList("Tree", "Leaf"), new ArrayList<>(ordered.names()));
		assertEquals(Arrays.asList(new ForwardReference("Tree", "Leaf")), ordered.forwardReferences);
	}

	@Test
	public void testFirstDeclarationWins() {
		final Definition first = record("A");
		final OrderedDefinitions ordered = orderer
				.order(Arrays.asList(first, new AliasDefinition("A", TypeExpr.named("B"), null), record("B")));
		assertEquals(Arrays.asList("A", "B"), new ArrayList<>(ordered.names()));
		assertTrue(ordered.get("A") == first);
	}

	@Test
	public void testLongAcyclicChain() {
		final List<Definition> defs = new ArrayList<>();
		final int length = 20_000;
		for (int i = 0; i < length; i++) {
			defs.add(i + 1 < length ? record("T" + i, "T" + (i + 1)) : record("T" + i));
		}
		final OrderedDefinitions ordered = orderer.order(defs);
		assertEquals(length, ordered.definitions.size());
		assertTrue(ordered.forwardReferences.isEmpty());
		assertEquals("T" + (length - 1), ordered.definitions.get(0).name);
		assertEquals("T0", ordered.definitions.get(length - 1).name);
	}

	@Test
	public void testFixture() {
		final List<Definition> all = new ArrayList<>(DefinitionBuilder.baseAliases());
		all.addAll(new DefinitionBuilder(new TypeExprCompiler()).build(Fixtures.loadMetaModel()));
		final OrderedDefinitions ordered = orderer.order(all);

		assertEquals(26, ordered.definitions.size());
		assertEquals(Arrays.asList("uinteger", "URI", "DocumentUri", "RegExp", "MarkupKind", "MessageType",
				"ControlCharacter", "TextDocumentIdentifier", "Position", "TextDocumentPositionParams",
				"ProgressToken", "HoverParams"), new ArrayList<>(ordered.names()).subList(0, 12));
		assertEquals(Arrays.asList( //
				new ForwardReference("SelectionRange", "SelectionRange"), //
				new ForwardReference("LSPObject", "LSPAny"), //
				new ForwardReference("LSPArray", "LSPAny")), ordered.forwardReferences);

		// Every reference outside a cycle points backwards
		for (Definition d : ordered.definitions) {
			for (String ref : d.referencedNames()) {
				if (ordered.get(ref) == null || ordered.forwardReferences.contains(new ForwardReference(d.name, ref))) {
					continue;
				}
				assertTrue(ref + " should precede " + d.name, ordered.indexOf(ref) < ordered.indexOf(d.name));
			}
		}
	}
}
