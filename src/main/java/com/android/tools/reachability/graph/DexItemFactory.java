// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.graph;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Canonicalizes the types of an application. */
public class DexItemFactory {

  private final Map<String, DexType> types = new ConcurrentHashMap<>();

  public DexType createType(String descriptor) {
    return types.computeIfAbsent(descriptor, DexType::new);
  }

  /** Returns the canonical type for the descriptor, or null if no such type was ever created. */
  public DexType lookupType(String descriptor) {
    return types.get(descriptor);
  }
}
