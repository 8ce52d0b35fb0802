package com.github.workflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class MetaTest {

  @Test
  public void testOrderedLookupAndEnumeration() {
    final Map<Object, Object> source = new LinkedHashMap<>();
    source.put("zeta", 1);
    source.put("alpha", "two");
    source.put(3, Boolean.TRUE);
    final Meta meta = Meta.of(source);

    assertEquals(3, meta.size());
    assertFalse(meta.isEmpty());
    assertEquals(1, meta.get("zeta"));
    assertEquals("two", meta.get("alpha", String.class));
    assertEquals(Boolean.TRUE, meta.get(3));
    assertTrue(meta.containsKey("alpha"));
    assertNull(meta.get("missing"));
    assertEquals("fallback", meta.getOrDefault("missing", "fallback"));

    final List<Object> keys = new ArrayList<>();
    for (final Map.Entry<Object, Object> entry : meta) {
      keys.add(entry.getKey());
    }
    assertEquals(Arrays.asList("zeta", "alpha", 3), keys);
    assertEquals(keys, new ArrayList<>(meta.keys()));

    // a snapshot, later changes to the source do not leak in
    source.put("late", "value");
    assertFalse(meta.containsKey("late"));
  }

  @Test(expected = ClassCastException.class)
  public void testTypedLookupRejectsWrongType() {
    final Map<String, Object> source = new LinkedHashMap<>();
    source.put("count", 5);
    Meta.of(source).get("count", String.class);
  }

  @Test
  public void testEmpty() {
    assertTrue(Meta.empty().isEmpty());
    assertSame(Meta.empty(), Meta.empty());
    assertFalse(Meta.empty().iterator().hasNext());
  }
}
