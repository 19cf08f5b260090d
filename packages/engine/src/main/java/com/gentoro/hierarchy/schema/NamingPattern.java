package com.gentoro.hierarchy.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Identifier template such as {@code "{system}:{device}_{signal}"}, compiled once into literal and
 * placeholder tokens. {@code {{} and {@code }}} produce literal braces.
 */
public final class NamingPattern {

  /** A piece of the compiled template. */
  public sealed interface Token permits Literal, Placeholder {}

  public record Literal(String text) implements Token {}

  public record Placeholder(String level) implements Token {}

  private final String source;
  private final List<Token> tokens;
  private final Set<String> placeholders;

  private NamingPattern(String source, List<Token> tokens) {
    this.source = source;
    this.tokens = List.copyOf(tokens);
    Set<String> names = new LinkedHashSet<>();
    for (Token t : tokens) {
      if (t instanceof Placeholder p) names.add(p.level());
    }
    this.placeholders = Collections.unmodifiableSet(names);
  }

  /**
   * Compile a naming pattern.
   *
   * @throws IllegalArgumentException on unbalanced braces, empty placeholders or placeholders that
   *     carry a format specification
   */
  public static NamingPattern compile(String pattern) {
    if (pattern == null) throw new IllegalArgumentException("naming pattern must not be null");
    List<Token> tokens = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < pattern.length()) {
      char c = pattern.charAt(i);
      if (c == '{' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '{') {
        literal.append('{');
        i += 2;
      } else if (c == '}' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '}') {
        literal.append('}');
        i += 2;
      } else if (c == '{') {
        int close = pattern.indexOf('}', i);
        if (close < 0) {
          throw new IllegalArgumentException("Unclosed '{' at position " + i + " in '" + pattern + "'");
        }
        String name = pattern.substring(i + 1, close).trim();
        if (name.isEmpty()) {
          throw new IllegalArgumentException(
              "Empty placeholder at position " + i + " in '" + pattern + "'");
        }
        if (name.indexOf(':') >= 0 || name.indexOf('!') >= 0 || name.indexOf('{') >= 0) {
          throw new IllegalArgumentException(
              "Placeholder '{"
                  + name
                  + "}' must be a plain level name; format specifications are not supported");
        }
        if (literal.length() > 0) {
          tokens.add(new Literal(literal.toString()));
          literal.setLength(0);
        }
        tokens.add(new Placeholder(name));
        i = close + 1;
      } else if (c == '}') {
        throw new IllegalArgumentException("Single '}' at position " + i + " in '" + pattern + "'");
      } else {
        literal.append(c);
        i++;
      }
    }
    if (literal.length() > 0) tokens.add(new Literal(literal.toString()));
    return new NamingPattern(pattern, tokens);
  }

  public String source() {
    return source;
  }

  public List<Token> tokens() {
    return tokens;
  }

  /** Placeholder names in order of first appearance. */
  public Set<String> placeholders() {
    return placeholders;
  }

  public boolean references(String level) {
    return placeholders.contains(level);
  }

  /**
   * Substitute values into the template. Missing values render as empty strings. The result is not
   * cleaned of separator artifacts.
   *
   * <p>When {@code separatorOverrides} holds an entry for a level whose value is non-empty, the
   * literals that follow that value are held back; the override is written instead, right before
   * the next non-empty value. If no further value is written, the held literals are emitted as is.
   */
  public String render(Map<String, String> values, Map<String, String> separatorOverrides) {
    StringBuilder out = new StringBuilder();
    StringBuilder held = null;
    String pending = null;
    for (Token token : tokens) {
      if (token instanceof Literal l) {
        (pending != null ? held : out).append(l.text());
        continue;
      }
      String level = ((Placeholder) token).level();
      String value = values.getOrDefault(level, "");
      if (value == null || value.isEmpty()) continue;
      if (pending != null) {
        out.append(pending);
        pending = null;
        held = null;
      }
      out.append(value);
      String override = separatorOverrides.get(level);
      if (override != null) {
        pending = override;
        held = new StringBuilder();
      }
    }
    if (held != null) out.append(held);
    return out.toString();
  }

  public String render(Map<String, String> values) {
    return render(values, Map.of());
  }

  @Override
  public String toString() {
    return source;
  }
}
