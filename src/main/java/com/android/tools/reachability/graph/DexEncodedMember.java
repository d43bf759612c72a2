// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.graph;

/** A method or field together with the type of the class declaring it. */
public abstract class DexEncodedMember extends DexDefinition {

  private final DexType holder;
  private final String name;

  DexEncodedMember(
      DexType holder, String name, AccessFlags accessFlags, DexAnnotationSet annotations) {
    super(accessFlags, annotations);
    this.holder = holder;
    this.name = name;
  }

  @Override
  public DexType getHolderType() {
    return holder;
  }

  public String getName() {
    return name;
  }

  public boolean isStatic() {
    return getAccessFlags().isStatic();
  }
}
