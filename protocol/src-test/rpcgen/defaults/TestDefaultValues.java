package rpcgen.defaults;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Test;

import rpcgen.Fixtures;
import rpcgen.compile.Field;
import rpcgen.compile.TypeExpr;
import rpcgen.compile.TypeExprCompiler;
import rpcgen.definition.Definition;
import rpcgen.definition.DefinitionBuilder;
import rpcgen.definition.RecordDefinition;

public class TestDefaultValues {

	private static DefaultValues fixtureDefaults() {
		final List<Definition> all = new ArrayList<>(DefinitionBuilder.baseAliases());
		all.addAll(new DefinitionBuilder(new TypeExprCompiler()).build(Fixtures.loadMetaModel()));
		return new DefaultValues(all);
	}

	@Test
	public void testScalars() {
		final JSONObject position = fixtureDefaults().defaultFor("Position", false, false);
		// uinteger resolves through its base alias
		assertEquals(0, position.get("line"));
		assertEquals(0, position.get("character"));
		assertEquals(2, position.length());

		final JSONObject identifier = fixtureDefaults().defaultFor("TextDocumentIdentifier", false, false);
		assertEquals("", identifier.get("uri"));
	}

	@Test
	public void testNestedRecordsNotExpanded() {
		final JSONObject range = fixtureDefaults().defaultFor("Range", false, false);
		assertEquals(new MissingValue("Position"), range.get("start"));
		assertEquals(new MissingValue("Position"), range.get("end"));
	}

	@Test
	public void testNestedRecordsExpanded() {
		final JSONObject range = fixtureDefaults().defaultFor("Range", false, true);
		assertEquals(0, range.getJSONObject("start").get("line"));
		assertEquals(0, range.getJSONObject("end").get("character"));
	}

	@Test
	public void testInheritedFieldsComeFirst() {
		final JSONObject params = fixtureDefaults().defaultFor("HoverParams", false, true);
		assertEquals(3, params.length());
		assertTrue(params.has("textDocument"));
		assertTrue(params.has("position"));
		// Optional union of integer and string takes its first branch
		assertEquals(0, params.get("workDoneToken"));
	}

	@Test
	public void testOnlyRequired() {
		final JSONObject params = fixtureDefaults().defaultFor("HoverParams", true, false);
		assertFalse(params.has("workDoneToken"));
		assertEquals(new MissingValue("TextDocumentIdentifier"), params.get("textDocument"));

		final JSONObject item = fixtureDefaults().defaultFor("ConfigurationItem", true, false);
		assertEquals(0, item.length());
	}

	@Test
	public void testCollections() {
		final JSONObject params = fixtureDefaults().defaultFor("ConfigurationParams", false, false);
		assertEquals(0, params.getJSONArray("items").length());
	}

	@Test
	public void testValueSet() {
		final JSONObject support = fixtureDefaults().defaultFor("MarkupKindSupport", true, false);
		final JSONArray valueSet = support.getJSONArray("valueSet");
		assertEquals(2, valueSet.length());
		assertEquals("plaintext", valueSet.get(0));
		assertEquals("markdown", valueSet.get(1));
	}

	@Test
	public void testStructureLiteralDefaultsToItsText() {
		final JSONObject support = fixtureDefaults().defaultFor("MarkupKindSupport", false, false);
		assertEquals("properties: sequence<string>", support.get("resolve"));
	}

	@Test
	public void testEnumerationFieldUnsupported() {
		try {
			fixtureDefaults().defaultFor("MarkupContent", false, false);
			fail("Expected enumeration field to be unsupported");
		} catch (UnsupportedTypeDefaultException e) {
			// Expected
		}
	}

	@Test
	public void testRecursiveSelfReferenceUnsupported() {
		final DefaultValues defaults = fixtureDefaults();
		// Without recursion the self reference is only a placeholder
		final JSONObject shallow = defaults.defaultFor("SelectionRange", false, false);
		assertEquals(new MissingValue("SelectionRange"), shallow.get("parent"));
		try {
			defaults.defaultFor("SelectionRange", false, true);
			fail("Expected cyclic expansion to fail");
		} catch (UnsupportedTypeDefaultException e) {
			// Expected
		}
	}

	@Test
	public void testTuple() {
		final RecordDefinition rec = new RecordDefinition("Span", Collections.emptyList(), Arrays.asList(new Field(
				"bounds", TypeExpr.tuple(Arrays.asList(TypeExpr.primitive(TypeExpr.PrimitiveKind.INTEGER),
						TypeExpr.primitive(TypeExpr.PrimitiveKind.BOOLEAN))))),
				null);
		final JSONArray bounds = new DefaultValues(Arrays.asList(rec)).defaultFor("Span", false, false)
				.getJSONArray("bounds");
		assertEquals(0, bounds.get(0));
		assertEquals(false, bounds.get(1));
	}

	@Test(expected = UnsupportedTypeDefaultException.class)
	public void testUnknownRecord() {
		fixtureDefaults().defaultFor("MarkupKind", false, false);
	}
}
