package com.gentoro.hierarchy.loader;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.hierarchy.HierarchyEngine;
import com.gentoro.hierarchy.exception.SchemaException;
import com.gentoro.hierarchy.exception.StateException;
import java.util.ArrayDeque;
import java.util.Deque;
import org.junit.jupiter.api.Test;

class ReloadableHierarchyEngineTest {

  private static String schema(String tree) {
    return "{\"hierarchy\": {\"levels\": [{\"name\": \"system\", \"type\": \"tree\"},"
        + " {\"name\": \"signal\", \"type\": \"tree\"}], \"naming_pattern\": \"{system}:{signal}\"},"
        + " \"tree\": "
        + tree
        + "}";
  }

  @Test
  void notLoadedUntilFirstReload() {
    ReloadableHierarchyEngine holder =
        new ReloadableHierarchyEngine(() -> HierarchyEngine.fromJson(schema("{\"A\": {\"B\": {}}}")));
    assertFalse(holder.isLoaded());
    assertThrows(StateException.class, holder::current);

    HierarchyEngine engine = holder.reload();
    assertTrue(holder.isLoaded());
    assertSame(engine, holder.current());
  }

  @Test
  void failedReloadKeepsThePreviousEngine() {
    Deque<String> documents = new ArrayDeque<>();
    documents.add(schema("{\"A\": {\"B\": {}}}"));
    documents.add("{\"hierarchy\": {\"levels\": [], \"naming_pattern\": \"{x}\"}, \"tree\": {}}");
    documents.add(schema("{\"A\": {\"B\": {}, \"C\": {}}}"));
    ReloadableHierarchyEngine holder =
        new ReloadableHierarchyEngine(() -> HierarchyEngine.fromJson(documents.poll()));

    HierarchyEngine first = holder.reload();
    assertThrows(SchemaException.class, holder::reload);
    assertSame(first, holder.current());
    assertTrue(first.validateChannel("A:B"));

    HierarchyEngine third = holder.reload();
    assertSame(third, holder.current());
    assertEquals(2, third.getChannelCount());
  }

  @Test
  void forLocationReadsTheSchemaOnEveryReload() {
    ReloadableHierarchyEngine holder =
        ReloadableHierarchyEngine.forLocation("classpath:schemas/legacy_dipoles.json");
    HierarchyEngine a = holder.reload();
    HierarchyEngine b = holder.reload();
    assertNotSame(a, b);
    assertEquals(a.getChannelCount(), b.getChannelCount());
  }
}
