package rpcgen.message;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

public class TestDispatchTable {

	@Test
	public void testSlotsFollowRegistrationOrder() {
		final DispatchTable table = DispatchTable.builder(Role.RESPONDER) //
				.register("initialize", "handle_initialize") //
				.register("shutdown", "handle_shutdown") //
				.build();
		assertEquals(Arrays.asList("initialize", "shutdown"), table.methods());
		assertEquals(0, table.slotOf("initialize"));
		assertEquals(1, table.slotOf("shutdown"));
		assertEquals("handle_shutdown", table.handlerAt(1));
		assertTrue(table.contains("shutdown"));
		assertFalse(table.contains("exit"));
	}

	@Test
	public void testIdenticalRegistrationIsIgnored() {
		final DispatchTable table = DispatchTable.builder(Role.INITIATOR) //
				.register("a", "handle_a") //
				.register("a", "handle_a") //
				.build();
		assertEquals(1, table.size());
	}

	@Test(expected = IllegalStateException.class)
	public void testConflictingRegistration() {
		DispatchTable.builder(Role.INITIATOR) //
				.register("a", "handle_a") //
				.register("a", "handle_b");
	}

	@Test
	public void testFrozenAfterBuild() {
		final DispatchTable.Builder builder = DispatchTable.builder(Role.INITIATOR).register("a", "handle_a");
		final DispatchTable table = builder.build();
		try {
			builder.register("b", "handle_b");
			fail("Expected frozen builder");
		} catch (IllegalStateException e) {
			// Expected
		}
		assertEquals(1, table.size());
		try {
			table.entries().put("b", "handle_b");
			fail("Expected unmodifiable entries");
		} catch (UnsupportedOperationException e) {
			// Expected
		}
	}

	@Test(expected = UnknownMethodException.class)
	public void testUnknownSlot() {
		DispatchTable.builder(Role.INITIATOR).build().slotOf("nope");
	}
}
