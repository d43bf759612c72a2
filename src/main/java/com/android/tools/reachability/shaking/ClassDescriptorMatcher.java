// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import static com.android.tools.reachability.utils.DescriptorUtils.DESCRIPTOR_PACKAGE_SEPARATOR;
import static com.android.tools.reachability.utils.DescriptorUtils.JAVA_PACKAGE_SEPARATOR;

/**
 * Matches class descriptor patterns, e.g., {@code Lcom/example/*;}, against class descriptors.
 *
 * <p>A pattern is derived from a keep rule class name by {@link #fromJavaTypePattern}. The
 * wildcards are those of keep rule class names: {@code ?} matches a single character other than
 * the package separator, {@code *} matches any part of a class name not containing the package
 * separator, and {@code **} matches any part of a class name including package separators. A
 * pattern without wildcards matches exactly one descriptor.
 */
public class ClassDescriptorMatcher {

  private final String pattern;
  private final boolean hasWildcards;

  private ClassDescriptorMatcher(String pattern) {
    this.pattern = pattern;
    this.hasWildcards = hasWildcards(pattern);
  }

  public static ClassDescriptorMatcher create(String descriptorPattern) {
    return new ClassDescriptorMatcher(descriptorPattern);
  }

  public static ClassDescriptorMatcher forJavaTypePattern(String javaTypePattern) {
    return new ClassDescriptorMatcher(fromJavaTypePattern(javaTypePattern));
  }

  /** Translates {@code com.example.Foo} into {@code Lcom/example/Foo;}. */
  public static String fromJavaTypePattern(String javaTypePattern) {
    return "L"
        + javaTypePattern.replace(JAVA_PACKAGE_SEPARATOR, DESCRIPTOR_PACKAGE_SEPARATOR)
        + ";";
  }

  public static boolean hasWildcards(String pattern) {
    return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
  }

  public String getPattern() {
    return pattern;
  }

  public boolean hasWildcards() {
    return hasWildcards;
  }

  public boolean matches(String descriptor) {
    return typeMatches(pattern, descriptor, pattern.length(), descriptor.length());
  }

  /**
   * Returns true if the first {@code descriptorLength} characters of {@code descriptor} are matched
   * by the first {@code patternLength} characters of {@code pattern}.
   */
  public static boolean typeMatches(
      String pattern, String descriptor, int patternLength, int descriptorLength) {
    if (!hasWildcards(pattern)) {
      return patternLength == descriptorLength
          && pattern.regionMatches(0, descriptor, 0, patternLength);
    }
    return wildcardMatches(pattern, descriptor, patternLength, descriptorLength);
  }

  // matched[j] is true if the pattern prefix processed so far matches descriptor[0, j).
  private static boolean wildcardMatches(
      String pattern, String descriptor, int patternLength, int descriptorLength) {
    boolean[] matched = new boolean[descriptorLength + 1];
    matched[0] = true;
    int i = 0;
    while (i < patternLength) {
      char c = pattern.charAt(i);
      boolean[] next = new boolean[descriptorLength + 1];
      if (c == '*') {
        boolean crossesPackages = i + 1 < patternLength && pattern.charAt(i + 1) == '*';
        i += crossesPackages ? 2 : 1;
        for (int j = 0; j <= descriptorLength; j++) {
          if (matched[j]) {
            next[j] = true;
          } else if (j > 0
              && next[j - 1]
              && (crossesPackages || descriptor.charAt(j - 1) != DESCRIPTOR_PACKAGE_SEPARATOR)) {
            next[j] = true;
          }
        }
      } else {
        i++;
        for (int j = 1; j <= descriptorLength; j++) {
          if (!matched[j - 1]) {
            continue;
          }
          char d = descriptor.charAt(j - 1);
          next[j] = c == '?' ? d != DESCRIPTOR_PACKAGE_SEPARATOR : c == d;
        }
      }
      matched = next;
    }
    return matched[descriptorLength];
  }

  @Override
  public String toString() {
    return pattern;
  }
}
