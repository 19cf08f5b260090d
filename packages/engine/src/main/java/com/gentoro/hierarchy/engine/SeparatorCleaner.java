package com.gentoro.hierarchy.engine;

/**
 * Removes separator artifacts left behind by empty placeholders: repeated separators collapse to
 * the first one, and a single leading or trailing separator is dropped.
 */
public final class SeparatorCleaner {
  private static final String SEPARATORS = ":-_";

  public static boolean isSeparator(char c) {
    return SEPARATORS.indexOf(c) >= 0;
  }

  public String clean(String raw) {
    if (raw == null || raw.isEmpty()) return "";
    StringBuilder sb = new StringBuilder(raw.length());
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (isSeparator(c) && sb.length() > 0 && isSeparator(sb.charAt(sb.length() - 1))) {
        continue;
      }
      sb.append(c);
    }
    if (sb.length() > 0 && isSeparator(sb.charAt(sb.length() - 1))) {
      sb.setLength(sb.length() - 1);
    }
    if (sb.length() > 0 && isSeparator(sb.charAt(0))) {
      sb.deleteCharAt(0);
    }
    return sb.toString();
  }
}
