// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.graph;

public class DexEncodedField extends DexEncodedMember {

  private final String typeDescriptor;

  public DexEncodedField(
      DexType holder,
      String name,
      String typeDescriptor,
      AccessFlags accessFlags,
      DexAnnotationSet annotations) {
    super(holder, name, accessFlags, annotations);
    this.typeDescriptor = typeDescriptor;
  }

  public String getTypeDescriptor() {
    return typeDescriptor;
  }

  @Override
  public boolean isField() {
    return true;
  }

  @Override
  public DexEncodedField asField() {
    return this;
  }

  @Override
  public String toDescriptorString() {
    return getHolderType().getDescriptor() + "->" + getName() + ":" + typeDescriptor;
  }
}
