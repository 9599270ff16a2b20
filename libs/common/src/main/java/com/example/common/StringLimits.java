/*
 * Where: shared utilities
 * What: cuts text to a maximum number of characters before it is persisted
 * Why: error columns have fixed length limits
 */
package com.example.common;

public final class StringLimits {
  private StringLimits() {}

  // counts code points so a surrogate pair is never split
  public static String truncate(String value, int maxLength) {
    if (value == null) {
      return null;
    }
    if (maxLength < 0) {
      throw new IllegalArgumentException("maxLength must be >= 0");
    }
    if (value.codePointCount(0, value.length()) <= maxLength) {
      return value;
    }
    return value.substring(0, value.offsetByCodePoints(0, maxLength));
  }
}
