// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.graph;

/** Common super class of all program entities: classes, methods and fields. */
public abstract class DexDefinition {

  private final AccessFlags accessFlags;
  private final DexAnnotationSet annotations;

  DexDefinition(AccessFlags accessFlags, DexAnnotationSet annotations) {
    this.accessFlags = accessFlags;
    this.annotations = annotations;
  }

  public AccessFlags getAccessFlags() {
    return accessFlags;
  }

  public DexAnnotationSet annotations() {
    return annotations;
  }

  /** The type of the class that declares this definition, or the class' own type. */
  public abstract DexType getHolderType();

  /** The stable, unique descriptor of this definition within the application. */
  public abstract String toDescriptorString();

  public boolean isProgramClass() {
    return false;
  }

  public DexProgramClass asProgramClass() {
    return null;
  }

  public boolean isMethod() {
    return false;
  }

  public DexEncodedMethod asMethod() {
    return null;
  }

  public boolean isField() {
    return false;
  }

  public DexEncodedField asField() {
    return null;
  }

  @Override
  public String toString() {
    return toDescriptorString();
  }
}
