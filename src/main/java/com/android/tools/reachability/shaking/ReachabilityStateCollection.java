// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.android.tools.reachability.graph.DexApplication;
import com.android.tools.reachability.graph.DexDefinition;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.utils.InternalOptions;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The reachability state of every class, method and field of an application.
 *
 * <p>This is the interface consulted by optimization passes before removing or renaming an item.
 * The queries on this collection synchronize with marking of the item's class, so they never
 * observe a class mark whose cascade to the members is still in progress.
 */
public class ReachabilityStateCollection {

  private final DexApplication application;
  private final InternalOptions options;
  private final Map<DexDefinition, ReachabilityState> states = new ConcurrentHashMap<>();

  private ReachabilityStateCollection(DexApplication application, InternalOptions options) {
    this.application = application;
    this.options = options;
  }

  public static ReachabilityStateCollection create(
      DexApplication application, InternalOptions options) {
    ReachabilityStateCollection collection =
        new ReachabilityStateCollection(application, options);
    for (DexProgramClass clazz : application.classes()) {
      ReachabilityState classState = new ReachabilityState();
      collection.states.put(clazz, classState);
      clazz.forEachMember(
          member -> collection.states.put(member, new ReachabilityState(classState)));
    }
    return collection;
  }

  public DexApplication getApplication() {
    return application;
  }

  /**
   * Returns the state of the definition. Members added to a class after this collection was
   * created get a fresh state on first access.
   */
  public ReachabilityState get(DexDefinition definition) {
    ReachabilityState state = states.get(definition);
    if (state != null) {
      return state;
    }
    if (definition.isProgramClass()) {
      return states.computeIfAbsent(definition, ignore -> new ReachabilityState());
    }
    DexProgramClass holder = application.definitionFor(definition.getHolderType());
    if (holder == null) {
      return states.computeIfAbsent(definition, ignore -> new ReachabilityState());
    }
    ReachabilityState holderState = get(holder);
    return states.computeIfAbsent(definition, ignore -> new ReachabilityState(holderState));
  }

  public boolean canDelete(DexDefinition definition) {
    ReachabilityState state = get(definition);
    synchronized (state.getLock()) {
      return state.canDelete();
    }
  }

  public boolean canRename(DexDefinition definition) {
    ReachabilityState state = get(definition);
    synchronized (state.getLock()) {
      if (!state.canRename()) {
        return false;
      }
      return options.allowRenamingOfCodeStringReferences || !state.isStringReferencedFromCode();
    }
  }

  public boolean isSeed(DexDefinition definition) {
    ReachabilityState state = get(definition);
    synchronized (state.getLock()) {
      return state.isSeed();
    }
  }

  public int size() {
    return states.size();
  }
}
