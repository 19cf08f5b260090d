package com.gentoro.hierarchy.utility;

import com.gentoro.hierarchy.exception.HierarchyException;

/** Console output of the command line front end. */
public final class StdoutUtility {
  private static final String red = "\u001B[31m";
  private static final String reset = "\u001B[0m";

  private StdoutUtility() {}

  public static void printLine(String message) {
    System.out.println(message);
  }

  /** Print an error and its cause chain to stderr, one line per cause. */
  public static void printError(String message, Throwable cause) {
    System.err.printf("%s%s%s%n", red, message, reset);
    for (Throwable t = cause; t != null; t = t.getCause()) {
      String code = t instanceof HierarchyException he ? " [" + he.getCode() + "]" : "";
      System.err.printf(
          "  %s%s%s: %s%s%n", red, t.getClass().getSimpleName(), code, t.getMessage(), reset);
      if (t.getCause() == t) break;
    }
  }
}
