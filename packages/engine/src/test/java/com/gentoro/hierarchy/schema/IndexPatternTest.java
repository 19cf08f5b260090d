package com.gentoro.hierarchy.schema;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IndexPatternTest {

  @Test
  @DisplayName("zero padded and plain fields")
  void zeroPaddedAndPlain() {
    assertEquals("D01", IndexPattern.compile("D{:02d}").format(1));
    assertEquals("D12", IndexPattern.compile("D{:02d}").format(12));
    assertEquals("D123", IndexPattern.compile("D{:02d}").format(123));
    assertEquals("7", IndexPattern.compile("{}").format(7));
    assertEquals("101", IndexPattern.compile("{:03d}").format(101));
    assertEquals("CAV-5", IndexPattern.compile("CAV-{0}").format(5));
  }

  @Test
  @DisplayName("alignment, fill and sign")
  void alignmentAndSign() {
    assertEquals("BPM  7", IndexPattern.compile("BPM{:>3}").format(7));
    assertEquals("7  |", IndexPattern.compile("{:<3}|").format(7));
    assertEquals("*7*", IndexPattern.compile("{:*^3}").format(7));
    assertEquals("+5", IndexPattern.compile("{:+d}").format(5));
    assertEquals("-0003", IndexPattern.compile("{:05d}").format(-3));
  }

  @Test
  @DisplayName("hex, octal and binary types")
  void radixTypes() {
    assertEquals("ff", IndexPattern.compile("{:x}").format(255));
    assertEquals("FF", IndexPattern.compile("{:X}").format(255));
    assertEquals("0xff", IndexPattern.compile("{:#x}").format(255));
    assertEquals("17", IndexPattern.compile("{:o}").format(15));
    assertEquals("0101", IndexPattern.compile("{:04b}").format(5));
  }

  @Test
  @DisplayName("doubled braces are literals")
  void escapedBraces() {
    assertEquals("{}5", IndexPattern.compile("{{}}{}").format(5));
  }

  @Test
  @DisplayName("malformed patterns are rejected")
  void malformed() {
    assertThrows(IllegalArgumentException.class, () -> IndexPattern.compile("D{"));
    assertThrows(IllegalArgumentException.class, () -> IndexPattern.compile("D}"));
    assertThrows(IllegalArgumentException.class, () -> IndexPattern.compile("D{:02q}"));
    assertThrows(IllegalArgumentException.class, () -> IndexPattern.compile("D{1}"));
    assertThrows(IllegalArgumentException.class, () -> IndexPattern.compile(null));
  }

  @Test
  void equalityFollowsSource() {
    assertEquals(IndexPattern.compile("D{:02d}"), IndexPattern.compile("D{:02d}"));
    assertNotEquals(IndexPattern.compile("D{:02d}"), IndexPattern.compile("D{:03d}"));
  }
}
