// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** The classes that cannot be deleted, cannot be renamed, and that are seeds. */
public class ReachabilityReport {

  private final List<String> cannotDelete;
  private final List<String> cannotRename;
  private final List<String> mustKeep;

  ReachabilityReport(List<String> cannotDelete, List<String> cannotRename, List<String> mustKeep) {
    this.cannotDelete = ImmutableList.copyOf(cannotDelete);
    this.cannotRename = ImmutableList.copyOf(cannotRename);
    this.mustKeep = ImmutableList.copyOf(mustKeep);
  }

  /** Descriptors of the classes that may not be deleted, in application order. */
  public List<String> getCannotDelete() {
    return cannotDelete;
  }

  /** Descriptors of the classes that may not be renamed, in application order. */
  public List<String> getCannotRename() {
    return cannotRename;
  }

  /** Descriptors of the seed classes, in application order. */
  public List<String> getMustKeep() {
    return mustKeep;
  }
}
