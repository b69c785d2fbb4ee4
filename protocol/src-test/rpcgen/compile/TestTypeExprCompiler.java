package rpcgen.compile;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import rpcgen.compile.TypeExpr.PrimitiveKind;
import rpcgen.model.AndType;
import rpcgen.model.ArrayType;
import rpcgen.model.BaseType;
import rpcgen.model.BooleanLiteralType;
import rpcgen.model.IntegerLiteralType;
import rpcgen.model.MapType;
import rpcgen.model.OrType;
import rpcgen.model.Property;
import rpcgen.model.ReferenceType;
import rpcgen.model.StringLiteralType;
import rpcgen.model.StructureLiteral;
import rpcgen.model.StructureLiteralType;
import rpcgen.model.TupleType;
import rpcgen.model.Type;

public class TestTypeExprCompiler {

	private final TypeExprCompiler compiler = new TypeExprCompiler();

	private String compile(Type type) {
		return compiler.compile(type).toString();
	}

	@Test
	public void testBaseTypes() {
		assertEquals("string", compile(new BaseType("string")));
		assertEquals("integer", compile(new BaseType("integer")));
		assertEquals("float", compile(new BaseType("decimal")));
		assertEquals("boolean", compile(new BaseType("boolean")));
		assertEquals("null", compile(new BaseType("null")));
	}

	@Test
	public void testAliasedBaseTypesStayNamed() {
		assertEquals(TypeExpr.named("uinteger"), compiler.compile(new BaseType("uinteger")));
		assertEquals(TypeExpr.named("DocumentUri"), compiler.compile(new BaseType("DocumentUri")));
		assertEquals(TypeExpr.named("URI"), compiler.compile(new BaseType("URI")));
		assertEquals(TypeExpr.named("RegExp"), compiler.compile(new BaseType("RegExp")));
	}

	@Test
	public void testMissingTypeIsNull() {
		assertEquals(TypeExpr.primitive(PrimitiveKind.NULL), compiler.compile(null));
	}

	@Test
	public void testComposites() {
		assertEquals("sequence<Position>", compile(new ArrayType(new ReferenceType("Position"))));
		assertEquals("map<string, LSPAny>",
				compile(new MapType(new BaseType("string"), new ReferenceType("LSPAny"))));
		assertEquals("union<Hover, null>",
				compile(new OrType(Arrays.asList(new ReferenceType("Hover"), new BaseType("null")))));
		assertEquals("tuple<integer, integer>",
				compile(new TupleType(Arrays.asList(new BaseType("integer"), new BaseType("integer")))));
	}

	@Test
	public void testIntersectionCompilesLikeUnion() {
		final TypeExpr and = compiler.compile(new AndType(Arrays.asList(new ReferenceType("A"), new ReferenceType("B"))));
		final TypeExpr or = compiler.compile(new OrType(Arrays.asList(new ReferenceType("A"), new ReferenceType("B"))));
		assertEquals(or, and);
	}

	@Test
	public void testLiterals() {
		assertEquals("literal<\"full\">", compile(new StringLiteralType("full")));
		assertEquals("literal<3>", compile(new IntegerLiteralType(3)));
		assertEquals("literal<true>", compile(new BooleanLiteralType(true)));
	}

	@Test
	public void testStructureLiteralIsEchoedAsText() {
		final StructureLiteral literal = new StructureLiteral(Arrays.asList( //
				new Property("labelOffsetSupport", new BaseType("boolean"), true, null), //
				new Property("uri", new BaseType("DocumentUri"))), null);
		final TypeExpr compiled = compiler.compile(new StructureLiteralType(literal));
		assertEquals(TypeExpr.Kind.LITERAL, compiled.kind);
		assertEquals("labelOffsetSupport: optional<boolean>\nuri: DocumentUri", ((TypeExpr.Literal) compiled).value);

		// Text is opaque, names inside it are never reported
		assertTrue(compiled.referencedNames().isEmpty());
	}

	@Test
	public void testEmptyStructureLiteral() {
		final TypeExpr compiled = compiler
				.compile(new StructureLiteralType(new StructureLiteral(Collections.emptyList(), null)));
		assertEquals("", ((TypeExpr.Literal) compiled).value);
	}

	@Test
	public void testOptionalProperty() {
		final Field required = compiler.compileProperty(new Property("range", new ReferenceType("Range")));
		assertFalse(required.isOptional());
		assertEquals("range: Range", required.toString());

		final Field optional = compiler
				.compileProperty(new Property("range", new ReferenceType("Range"), true, "The range"));
		assertTrue(optional.isOptional());
		assertEquals("range: optional<Range>", optional.toString());
		assertEquals("The range", optional.documentation);
	}

	@Test
	public void testReferencedNames() {
		final TypeExpr expr = compiler.compile(new OrType(Arrays.asList( //
				new ArrayType(new ReferenceType("Location")), //
				new MapType(new BaseType("DocumentUri"), new ReferenceType("Location")), //
				new BaseType("null"))));
		assertEquals(Arrays.asList("Location", "DocumentUri"), expr.referencedNames());
	}
}
