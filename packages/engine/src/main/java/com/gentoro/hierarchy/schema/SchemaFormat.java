package com.gentoro.hierarchy.schema;

/** Layout of the hierarchy section of a schema document. */
public enum SchemaFormat {
  /** {@code hierarchy.levels} array plus {@code hierarchy.naming_pattern}. */
  LEVELS,
  /** {@code hierarchy_definition} list plus a {@code hierarchy_config.levels} map. */
  HIERARCHY_CONFIG,
  /** {@code hierarchy_definition} only; level types are inferred from their names. */
  LEGACY
}
