package com.gentoro.hierarchy.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compiled instance-name pattern for range expansions, e.g. {@code "D{:02d}"} or {@code
 * "BPM{:>3}"}.
 *
 * <p>Literal text is copied as is ({@code {{} and {@code }}} stand for single braces). Every
 * replacement field receives the same integer index and accepts the usual format specification
 * {@code [[fill]align][sign][#][0][width][type]} where align is one of {@code < > ^ =} and type is
 * one of {@code d x X o b}.
 */
public final class IndexPattern {
  private final String source;
  private final List<Object> parts;

  private IndexPattern(String source, List<Object> parts) {
    this.source = source;
    this.parts = parts;
  }

  /**
   * Compile a pattern.
   *
   * @throws IllegalArgumentException if the pattern is malformed
   */
  public static IndexPattern compile(String pattern) {
    if (pattern == null) throw new IllegalArgumentException("pattern must not be null");
    List<Object> parts = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < pattern.length()) {
      char c = pattern.charAt(i);
      if (c == '{') {
        if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '{') {
          literal.append('{');
          i += 2;
          continue;
        }
        int close = pattern.indexOf('}', i);
        if (close < 0) {
          throw new IllegalArgumentException("Unclosed '{' in pattern '" + pattern + "'");
        }
        if (literal.length() > 0) {
          parts.add(literal.toString());
          literal.setLength(0);
        }
        parts.add(Field.parse(pattern.substring(i + 1, close), pattern));
        i = close + 1;
      } else if (c == '}') {
        if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '}') {
          literal.append('}');
          i += 2;
          continue;
        }
        throw new IllegalArgumentException("Single '}' in pattern '" + pattern + "'");
      } else {
        literal.append(c);
        i++;
      }
    }
    if (literal.length() > 0) parts.add(literal.toString());
    return new IndexPattern(pattern, List.copyOf(parts));
  }

  public String format(long index) {
    StringBuilder sb = new StringBuilder();
    for (Object part : parts) {
      if (part instanceof Field f) {
        f.appendTo(sb, index);
      } else {
        sb.append((String) part);
      }
    }
    return sb.toString();
  }

  public String source() {
    return source;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof IndexPattern other && source.equals(other.source);
  }

  @Override
  public int hashCode() {
    return source.hashCode();
  }

  @Override
  public String toString() {
    return source;
  }

  private record Field(char fill, char align, char sign, boolean alternate, int width, char type) {

    static Field parse(String body, String pattern) {
      int colon = body.indexOf(':');
      String argument = colon < 0 ? body : body.substring(0, colon);
      if (!argument.isEmpty() && !argument.equals("0")) {
        throw new IllegalArgumentException(
            "Pattern '" + pattern + "' may only reference the instance index, found '{" + body + "}'");
      }
      String spec = colon < 0 ? "" : body.substring(colon + 1);

      char fill = ' ';
      char align = 0;
      char sign = '-';
      boolean alternate = false;
      int width = 0;
      char type = 'd';
      int p = 0;

      if (spec.length() >= 2 && isAlign(spec.charAt(1))) {
        fill = spec.charAt(0);
        align = spec.charAt(1);
        p = 2;
      } else if (!spec.isEmpty() && isAlign(spec.charAt(0))) {
        align = spec.charAt(0);
        p = 1;
      }
      if (p < spec.length() && "+- ".indexOf(spec.charAt(p)) >= 0) {
        sign = spec.charAt(p++);
      }
      if (p < spec.length() && spec.charAt(p) == '#') {
        alternate = true;
        p++;
      }
      if (p < spec.length() && spec.charAt(p) == '0') {
        if (align == 0) {
          fill = '0';
          align = '=';
        }
        p++;
      }
      int widthStart = p;
      while (p < spec.length() && Character.isDigit(spec.charAt(p))) p++;
      if (p > widthStart) width = Integer.parseInt(spec.substring(widthStart, p));
      if (p < spec.length()) {
        type = spec.charAt(p++);
        if ("dxXob".indexOf(type) < 0) {
          throw new IllegalArgumentException(
              "Unsupported format type '" + type + "' in pattern '" + pattern + "'");
        }
      }
      if (p != spec.length()) {
        throw new IllegalArgumentException(
            "Invalid format specification '" + spec + "' in pattern '" + pattern + "'");
      }
      return new Field(fill, align == 0 ? '>' : align, sign, alternate, width, type);
    }

    private static boolean isAlign(char c) {
      return c == '<' || c == '>' || c == '^' || c == '=';
    }

    void appendTo(StringBuilder sb, long value) {
      String digits =
          switch (type) {
            case 'x' -> Long.toHexString(Math.abs(value));
            case 'X' -> Long.toHexString(Math.abs(value)).toUpperCase(Locale.ROOT);
            case 'o' -> Long.toOctalString(Math.abs(value));
            case 'b' -> Long.toBinaryString(Math.abs(value));
            default -> Long.toString(Math.abs(value));
          };
      String prefix = "";
      if (value < 0) {
        prefix = "-";
      } else if (sign == '+' || sign == ' ') {
        prefix = String.valueOf(sign);
      }
      if (alternate && type != 'd') {
        prefix += "0" + type;
      }

      int padding = width - prefix.length() - digits.length();
      if (padding <= 0) {
        sb.append(prefix).append(digits);
        return;
      }
      String pad = String.valueOf(fill).repeat(padding);
      switch (align) {
        case '<' -> sb.append(prefix).append(digits).append(pad);
        case '^' -> {
          int left = padding / 2;
          sb.append(String.valueOf(fill).repeat(left))
              .append(prefix)
              .append(digits)
              .append(String.valueOf(fill).repeat(padding - left));
        }
        case '=' -> sb.append(prefix).append(pad).append(digits);
        default -> sb.append(pad).append(prefix).append(digits);
      }
    }
  }
}
