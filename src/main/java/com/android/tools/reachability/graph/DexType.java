// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.graph;

import com.android.tools.reachability.utils.DescriptorUtils;

/**
 * A class type, identified by its descriptor, e.g., {@code Lcom/example/Foo;}.
 *
 * <p>Types are canonicalized by the {@link DexItemFactory}, so identity equality is type equality.
 */
public class DexType implements Comparable<DexType> {

  private final String descriptor;

  DexType(String descriptor) {
    assert DescriptorUtils.isClassDescriptor(descriptor) : "Malformed descriptor: " + descriptor;
    this.descriptor = descriptor;
  }

  @SuppressWarnings("ReferenceEquality")
  public static boolean identical(DexType t1, DexType t2) {
    return t1 == t2;
  }

  public boolean isIdenticalTo(DexType other) {
    return identical(this, other);
  }

  public String getDescriptor() {
    return descriptor;
  }

  @Override
  public int compareTo(DexType other) {
    return descriptor.compareTo(other.descriptor);
  }

  @Override
  public String toString() {
    return descriptor;
  }
}
