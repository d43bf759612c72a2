// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.utils;

public class DescriptorUtils {

  public static final char DESCRIPTOR_PACKAGE_SEPARATOR = '/';
  public static final char JAVA_PACKAGE_SEPARATOR = '.';

  public static boolean isClassDescriptor(String string) {
    return string.length() >= 3
        && string.charAt(0) == 'L'
        && string.charAt(string.length() - 1) == ';'
        && string.indexOf(JAVA_PACKAGE_SEPARATOR) == -1;
  }

  /**
   * Convert a Java class name to a class descriptor, e.g., {@code com.example.Foo} becomes {@code
   * Lcom/example/Foo;}.
   */
  public static String javaTypeToDescriptor(String typeName) {
    return "L" + typeName.replace(JAVA_PACKAGE_SEPARATOR, DESCRIPTOR_PACKAGE_SEPARATOR) + ";";
  }

  /** Returns the class descriptor for a name that is either a descriptor or a Java class name. */
  public static String toClassDescriptor(String name) {
    return isClassDescriptor(name) ? name : javaTypeToDescriptor(name);
  }

  /**
   * Convert a package prefix to a descriptor prefix. A prefix already in descriptor form, e.g.
   * {@code Lcom/example/}, is returned unchanged; {@code com.example.} becomes {@code
   * Lcom/example/}. A prefix without a package separator, e.g. {@code Lib}, is a Java name.
   */
  public static String toDescriptorPrefix(String prefix) {
    if (prefix.startsWith("L")
        && prefix.indexOf(DESCRIPTOR_PACKAGE_SEPARATOR) != -1
        && prefix.indexOf(JAVA_PACKAGE_SEPARATOR) == -1) {
      return prefix;
    }
    return "L" + prefix.replace(JAVA_PACKAGE_SEPARATOR, DESCRIPTOR_PACKAGE_SEPARATOR);
  }
}
