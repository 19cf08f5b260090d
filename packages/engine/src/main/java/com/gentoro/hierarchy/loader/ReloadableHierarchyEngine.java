package com.gentoro.hierarchy.loader;

import com.gentoro.hierarchy.HierarchyEngine;
import com.gentoro.hierarchy.exception.StateException;
import com.gentoro.hierarchy.logging.LoggingService;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds the active {@link HierarchyEngine} and replaces it on reload. A reload builds a complete new
 * engine first; readers keep using the previous one until the swap, and a failed reload leaves the
 * previous engine in place.
 */
public final class ReloadableHierarchyEngine {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(ReloadableHierarchyEngine.class);

  private final Supplier<HierarchyEngine> factory;
  private final AtomicReference<HierarchyEngine> current = new AtomicReference<>();

  public ReloadableHierarchyEngine(Supplier<HierarchyEngine> factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /** Engine backed by a schema location, see {@link SchemaLoader}. */
  public static ReloadableHierarchyEngine forLocation(String location) {
    SchemaLoader loader = new SchemaLoader();
    return new ReloadableHierarchyEngine(
        () -> HierarchyEngine.fromDocument(loader.read(location)));
  }

  public HierarchyEngine current() {
    HierarchyEngine engine = current.get();
    if (engine == null) {
      throw new StateException("ReloadableHierarchyEngine", "No hierarchy loaded yet. Call reload() first.");
    }
    return engine;
  }

  public boolean isLoaded() {
    return current.get() != null;
  }

  /**
   * Build a fresh engine and make it current.
   *
   * @return the new engine
   * @throws RuntimeException whatever the build raised; the previous engine stays current
   */
  public HierarchyEngine reload() {
    HierarchyEngine next;
    try {
      next = factory.get();
    } catch (RuntimeException e) {
      log.error(
          "Hierarchy reload failed; {}",
          isLoaded() ? "keeping the previously loaded hierarchy" : "no hierarchy is loaded",
          e);
      throw e;
    }
    HierarchyEngine previous = current.getAndSet(next);
    log.info(
        "Hierarchy reloaded: {} channels (previously {})",
        next.getChannelCount(),
        previous == null ? "none" : previous.getChannelCount());
    return next;
  }
}
