package rpcgen.definition;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import rpcgen.Fixtures;
import rpcgen.compile.Field;
import rpcgen.compile.TypeExpr;
import rpcgen.compile.TypeExpr.PrimitiveKind;
import rpcgen.compile.TypeExprCompiler;
import rpcgen.model.BaseType;
import rpcgen.model.EnumerationKind;
import rpcgen.model.MetaModel;
import rpcgen.model.Property;
import rpcgen.model.ReferenceType;
import rpcgen.model.Structure;
import rpcgen.model.Type;

public class TestDefinitionBuilder {

	private final DefinitionBuilder builder = new DefinitionBuilder(new TypeExprCompiler());

	private static Definition find(List<Definition> defs, String name) {
		for (Definition d : defs) {
			if (d.name.equals(name)) {
				return d;
			}
		}
		throw new AssertionError("No definition " + name);
	}

	private static List<String> fieldNames(RecordDefinition rec) {
		final List<String> ret = new ArrayList<>();
		for (Field f : rec.fields) {
			ret.add(f.name);
		}
		return ret;
	}

	private static MetaModel structuresOnly(Structure... structures) {
		return new MetaModel(null, Collections.emptyList(), Collections.emptyList(), Arrays.asList(structures),
				Collections.emptyList(), Collections.emptyList());
	}

	@Test
	public void testGroupOrder() {
		final List<Definition> defs = builder.build(Fixtures.loadMetaModel());
		assertEquals(3 + 15 + 4, defs.size());
		assertEquals("MarkupKind", defs.get(0).name);
		assertEquals(Definition.Kind.ENUMERATION, defs.get(2).kind);
		assertEquals("HoverParams", defs.get(3).name);
		assertEquals(Definition.Kind.RECORD, defs.get(17).kind);
		assertEquals("ProgressToken", defs.get(18).name);
		assertEquals(Definition.Kind.ALIAS, defs.get(21).kind);
	}

	@Test
	public void testParentsKeepDeclaredOrder() {
		final Structure s = new Structure("C", Arrays.<Type>asList(new ReferenceType("B"), new ReferenceType("A")),
				Collections.emptyList(), Collections.emptyList(), null);
		final RecordDefinition rec = (RecordDefinition) builder.build(structuresOnly(s)).get(0);
		assertEquals(Arrays.asList("B", "A"), rec.parentNames());
	}

	@Test
	public void testMixinFieldsFollowOwnFields() {
		final Structure inner = new Structure("Inner", Collections.emptyList(), Collections.emptyList(),
				Arrays.asList(new Property("deep", new BaseType("string"))), null);
		final Structure m1 = new Structure("M1", Collections.emptyList(),
				Arrays.<Type>asList(new ReferenceType("Inner")),
				Arrays.asList(new Property("a", new BaseType("string")), new Property("b", new BaseType("integer"))),
				null);
		final Structure m2 = new Structure("M2",
				Arrays.asList(new Property("a", new BaseType("boolean"))));
		final Structure s = new Structure("S", Collections.emptyList(),
				Arrays.<Type>asList(new ReferenceType("M1"), new ReferenceType("M2")),
				Arrays.asList(new Property("own", new BaseType("string"))), null);

		final List<Definition> defs = builder.build(structuresOnly(inner, m1, m2, s));
		final RecordDefinition rec = (RecordDefinition) find(defs, "S");
		// One level only, and no de-duplication by name
		assertEquals(Arrays.asList("own", "a", "b", "a"), fieldNames(rec));
		assertEquals(TypeExpr.primitive(PrimitiveKind.BOOLEAN), rec.fields.get(3).type);
		assertEquals(Collections.emptyList(), rec.parents);
	}

	@Test
	public void testFixtureMixin() {
		final RecordDefinition hoverParams = (RecordDefinition) find(builder.build(Fixtures.loadMetaModel()),
				"HoverParams");
		assertEquals(Arrays.asList("TextDocumentPositionParams"), hoverParams.parentNames());
		assertEquals(Arrays.asList("workDoneToken"), fieldNames(hoverParams));
		assertEquals(TypeExpr.optionalField(TypeExpr.named("ProgressToken")), hoverParams.fields.get(0).type);
	}

	@Test
	public void testUnresolvedMixin() {
		final Structure s = new Structure("S", Collections.emptyList(),
				Arrays.<Type>asList(new ReferenceType("Missing")), Collections.emptyList(), null);
		try {
			builder.build(structuresOnly(s));
			fail("Expected unresolved mixin to fail");
		} catch (UnresolvedTypeReferenceException e) {
			assertEquals("Missing", e.reference);
			assertEquals("S", e.referencedFrom);
		}
	}

	@Test
	public void testForwardReferencedAliases() {
		final List<Definition> defs = builder.build(Fixtures.loadMetaModel());
		final AliasDefinition lspAny = (AliasDefinition) find(defs, "LSPAny");
		final TypeExpr.Union bound = (TypeExpr.Union) lspAny.bound;
		assertEquals(TypeExpr.forwardReference("LSPObject"), bound.items.get(0));
		assertEquals(TypeExpr.forwardReference("LSPArray"), bound.items.get(1));
		assertEquals(TypeExpr.named("uinteger"), bound.items.get(4));
		assertEquals("The LSP any type.", lspAny.documentation);

		// Only names in the configured set are marked
		final AliasDefinition lspObject = (AliasDefinition) find(defs, "LSPObject");
		assertEquals("map<string, LSPAny>", lspObject.bound.toString());
	}

	@Test
	public void testCustomForwardReferencedAliases() {
		final DefinitionBuilder custom = new DefinitionBuilder(new TypeExprCompiler(),
				Collections.singleton("LSPAny"));
		final AliasDefinition lspObject = (AliasDefinition) find(custom.build(Fixtures.loadMetaModel()),
				"LSPObject");
		assertEquals("map<string, forward<LSPAny>>", lspObject.bound.toString());
	}

	@Test
	public void testEnumerationBacking() {
		final List<Definition> defs = builder.build(Fixtures.loadMetaModel());
		final EnumerationDefinition markupKind = (EnumerationDefinition) find(defs, "MarkupKind");
		assertEquals(EnumerationKind.STRING, markupKind.backing);
		assertEquals(TypeExpr.primitive(PrimitiveKind.STRING), markupKind.backingType());
		assertNull(markupKind.documentation);

		final EnumerationDefinition messageType = (EnumerationDefinition) find(defs, "MessageType");
		assertEquals(TypeExpr.named("uinteger"), messageType.backingType());
		assertEquals(Arrays.asList("uinteger"), messageType.referencedNames());
	}

	@Test
	public void testBaseAliases() {
		final List<Definition> base = DefinitionBuilder.baseAliases();
		assertEquals(4, base.size());
		assertEquals("uinteger", base.get(0).name);
		assertEquals(TypeExpr.primitive(PrimitiveKind.INTEGER), ((AliasDefinition) base.get(0)).bound);
		for (Definition d : base.subList(1, 4)) {
			assertEquals(TypeExpr.primitive(PrimitiveKind.STRING), ((AliasDefinition) d).bound);
		}
	}
}
