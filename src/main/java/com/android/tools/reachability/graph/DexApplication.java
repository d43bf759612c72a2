// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.graph;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * The program classes under analysis.
 *
 * <p>The iteration order of {@link #classes()} is the order in which classes were added and is
 * stable, so evidence sources that stop at a first match behave deterministically.
 */
public class DexApplication {

  private final DexItemFactory dexItemFactory;
  private final List<DexProgramClass> classes;
  private final Map<DexType, DexProgramClass> definitions;

  private DexApplication(DexItemFactory dexItemFactory, List<DexProgramClass> classes) {
    this.dexItemFactory = dexItemFactory;
    this.classes = ImmutableList.copyOf(classes);
    this.definitions = new IdentityHashMap<>(classes.size());
    for (DexProgramClass clazz : classes) {
      DexProgramClass previous = definitions.put(clazz.getType(), clazz);
      if (previous != null) {
        throw new IllegalArgumentException("Duplicate class: " + clazz.getType());
      }
    }
  }

  public static Builder builder(DexItemFactory dexItemFactory) {
    return new Builder(dexItemFactory);
  }

  public DexItemFactory dexItemFactory() {
    return dexItemFactory;
  }

  public List<DexProgramClass> classes() {
    return classes;
  }

  public int size() {
    return classes.size();
  }

  /** Returns the program class for the type, or null if the type is not defined by the program. */
  public DexProgramClass definitionFor(DexType type) {
    return type == null ? null : definitions.get(type);
  }

  /**
   * Returns the program class for the descriptor, or null if no class of the program has that
   * descriptor. Never creates a type.
   */
  public DexProgramClass definitionForDescriptor(String descriptor) {
    return definitionFor(dexItemFactory.lookupType(descriptor));
  }

  public void forEachMethod(Consumer<? super DexEncodedMethod> consumer) {
    for (DexProgramClass clazz : classes) {
      clazz.forEachMethod(consumer);
    }
  }

  public static class Builder {

    private final DexItemFactory dexItemFactory;
    private final List<DexProgramClass> classes = new ArrayList<>();

    private Builder(DexItemFactory dexItemFactory) {
      this.dexItemFactory = dexItemFactory;
    }

    public DexItemFactory getDexItemFactory() {
      return dexItemFactory;
    }

    public Builder addProgramClass(DexProgramClass clazz) {
      classes.add(clazz);
      return this;
    }

    public Builder addProgramClasses(Iterable<DexProgramClass> programClasses) {
      programClasses.forEach(classes::add);
      return this;
    }

    public DexApplication build() {
      return new DexApplication(dexItemFactory, classes);
    }
  }
}
