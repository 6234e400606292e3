package org.metricshub.dumblang.ext;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.dumblang.util.DslSettings;

public class BuiltinTableTest {

	@Test
	public void testBuilder() {
		Builtin one = arguments -> 1.0;
		Builtin two = arguments -> 2.0;
		BuiltinTable table = BuiltinTable.builder().add("a", one).add("b", one).add("a", two).build();
		assertEquals(2, table.size());
		assertEquals(Arrays.asList("a", "b"), Arrays.asList(table.names().toArray()));
		assertEquals(2.0, table.get("a").call());
		assertNull(table.get("c"));
		assertFalse(table.contains("c"));
	}

	@Test
	public void testToBuilderLeavesOriginalUnchanged() {
		BuiltinTable original = BuiltinTable.of(Collections.<String, Builtin>singletonMap("a", arguments -> 1.0));
		BuiltinTable extended = original.toBuilder().add("b", arguments -> 2.0).build();
		assertEquals(1, original.size());
		assertEquals(2, extended.size());
		assertTrue(BuiltinTable.empty().names().isEmpty());
	}

	@Test
	public void testInvalidEntries() {
		assertThrows(IllegalArgumentException.class, () -> BuiltinTable.builder().add("", arguments -> null));
		assertThrows(IllegalArgumentException.class, () -> BuiltinTable.builder().add("x", null));
		Map<String, Builtin> names = new LinkedHashMap<String, Builtin>();
		names.put(null, arguments -> null);
		assertThrows(IllegalArgumentException.class, () -> BuiltinTable.of(names));
	}

	@Test
	public void testCoreExtension() {
		CoreExtension core = new CoreExtension();
		core.init(new DslSettings());
		BuiltinTable table = BuiltinTable.builder().addExtension(core).build();
		assertEquals(4, table.size());
		assertTrue(table.names().containsAll(Arrays.asList("print", "inpstr", "inpnum", "sqrt")));
		assertEquals(Double.valueOf(5), table.get("sqrt").call(25.0));
	}
}
