package com.gentoro.hierarchy.schema;

/**
 * A level as written in the schema document, before its type has been checked.
 *
 * @param type raw type name, {@code null} when the document omits it
 */
public record LevelDeclaration(String name, String type, boolean optional, String container) {}
