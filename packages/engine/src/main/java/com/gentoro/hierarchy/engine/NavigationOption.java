package com.gentoro.hierarchy.engine;

/** A selectable value at a hierarchy level. */
public record NavigationOption(String name, String description, OptionKind kind) {

  public boolean isDirectSignal() {
    return kind == OptionKind.DIRECT_SIGNAL;
  }
}
