// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.graph;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/** The annotation types present on a class, method or field. */
public class DexAnnotationSet {

  private static final DexAnnotationSet THE_EMPTY_ANNOTATIONS_SET =
      new DexAnnotationSet(ImmutableList.of());

  private final List<DexType> annotationTypes;

  private DexAnnotationSet(List<DexType> annotationTypes) {
    this.annotationTypes = annotationTypes;
  }

  public static DexAnnotationSet empty() {
    return THE_EMPTY_ANNOTATIONS_SET;
  }

  public static DexAnnotationSet create(Collection<DexType> annotationTypes) {
    return annotationTypes.isEmpty()
        ? empty()
        : new DexAnnotationSet(ImmutableList.copyOf(annotationTypes));
  }

  public boolean isEmpty() {
    return annotationTypes.isEmpty();
  }

  public List<DexType> getAnnotationTypes() {
    return annotationTypes;
  }

  public boolean containsAny(Set<DexType> types) {
    if (types.isEmpty()) {
      return false;
    }
    for (DexType annotationType : annotationTypes) {
      if (types.contains(annotationType)) {
        return true;
      }
    }
    return false;
  }
}
