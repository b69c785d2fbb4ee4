package rpcgen.imports;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import rpcgen.compile.Annotated;
import rpcgen.compile.TypeExpr;
import rpcgen.compile.TypeExpr.PrimitiveKind;

public class TestImportResolver {

	private static Annotated annotated(TypeExpr... annotations) {
		final List<TypeExpr> list = Arrays.asList(annotations);
		return () -> list;
	}

	@Test
	public void testFirstSeenOrderWithoutDuplicates() {
		final ImportResolver resolver = new ImportResolver(Arrays.asList("A", "B", "C", "D"));
		final List<String> imports = resolver.resolve(annotated( //
				TypeExpr.named("C"), //
				TypeExpr.sequenceOf(TypeExpr.named("A")), //
				TypeExpr.union(TypeExpr.named("C"), TypeExpr.named("B"))));
		assertEquals(Arrays.asList("C", "A", "B"), imports);
	}

	@Test
	public void testOnlyDefinedNames() {
		final ImportResolver resolver = new ImportResolver(Arrays.asList("Defined"));
		assertEquals(Arrays.asList("Defined"), resolver.resolve(annotated( //
				TypeExpr.associativeOf(TypeExpr.named("Undefined"), TypeExpr.named("Defined")), //
				TypeExpr.primitive(PrimitiveKind.STRING))));
	}

	@Test
	public void testLiteralTextIsNotScanned() {
		final ImportResolver resolver = new ImportResolver(Arrays.asList("Range"));
		assertTrue(resolver.resolve(annotated(TypeExpr.literal("range: Range"))).isEmpty());
	}

	@Test
	public void testForwardReferencesAreImported() {
		final ImportResolver resolver = new ImportResolver(Arrays.asList("LSPObject"));
		assertEquals(Arrays.asList("LSPObject"),
				resolver.resolve(annotated(TypeExpr.optionalField(TypeExpr.forwardReference("LSPObject")))));
	}

	@Test
	public void testSeveralConsumers() {
		final ImportResolver resolver = new ImportResolver(Arrays.asList("A", "B"));
		assertEquals(Arrays.asList("B", "A"),
				resolver.resolve(annotated(TypeExpr.named("B")), annotated(TypeExpr.named("A"), TypeExpr.named("B"))));
	}
}
