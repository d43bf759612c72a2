// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.graph;

public class DexEncodedMethod extends DexEncodedMember {

  private final String proto;

  public DexEncodedMethod(
      DexType holder,
      String name,
      String proto,
      AccessFlags accessFlags,
      DexAnnotationSet annotations) {
    super(holder, name, accessFlags, annotations);
    assert proto.startsWith("(") : "Malformed method descriptor: " + proto;
    this.proto = proto;
  }

  public String getProto() {
    return proto;
  }

  public boolean isNative() {
    return getAccessFlags().isNative();
  }

  /** Direct methods are static, private or constructors, and are not virtually dispatched. */
  public boolean isDirectMethod() {
    AccessFlags accessFlags = getAccessFlags();
    return accessFlags.isStatic() || accessFlags.isPrivate() || accessFlags.isConstructor();
  }

  @Override
  public boolean isMethod() {
    return true;
  }

  @Override
  public DexEncodedMethod asMethod() {
    return this;
  }

  @Override
  public String toDescriptorString() {
    return getHolderType().getDescriptor() + "->" + getName() + proto;
  }
}
