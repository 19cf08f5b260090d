package com.gentoro.hierarchy.engine;

/** Whether choosing an option leads to further levels or already names a channel. */
public enum OptionKind {
  CONTAINER,
  DIRECT_SIGNAL
}
