// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.graph;

/** Access flags of a class, method or field, using the class file bit assignment. */
public class AccessFlags {

  public static final int ACC_PUBLIC = 0x0001;
  public static final int ACC_PRIVATE = 0x0002;
  public static final int ACC_PROTECTED = 0x0004;
  public static final int ACC_STATIC = 0x0008;
  public static final int ACC_FINAL = 0x0010;
  public static final int ACC_NATIVE = 0x0100;
  public static final int ACC_INTERFACE = 0x0200;
  public static final int ACC_ABSTRACT = 0x0400;
  public static final int ACC_ANNOTATION = 0x2000;
  public static final int ACC_ENUM = 0x4000;
  public static final int ACC_CONSTRUCTOR = 0x10000;

  private final int flags;

  private AccessFlags(int flags) {
    this.flags = flags;
  }

  public static AccessFlags fromFlags(int flags) {
    return new AccessFlags(flags);
  }

  public static AccessFlags publicFlags() {
    return new AccessFlags(ACC_PUBLIC);
  }

  private boolean isSet(int flag) {
    return (flags & flag) != 0;
  }

  public boolean isPrivate() {
    return isSet(ACC_PRIVATE);
  }

  public boolean isStatic() {
    return isSet(ACC_STATIC);
  }

  public boolean isNative() {
    return isSet(ACC_NATIVE);
  }

  public boolean isConstructor() {
    return isSet(ACC_CONSTRUCTOR);
  }

  @Override
  public String toString() {
    return "0x" + Integer.toHexString(flags);
  }
}
