// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.utils.InternalOptions;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Computes the reachability report from the final state of the classes. */
public class ReachabilityReporter {

  private final ReachabilityStateCollection states;
  private final InternalOptions options;

  public ReachabilityReporter(ReachabilityStateCollection states, InternalOptions options) {
    this.states = states;
    this.options = options;
  }

  public ReachabilityReport computeReport() {
    List<DexProgramClass> classes = states.getApplication().classes();
    options.trace("Total number of classes: " + classes.size());
    List<String> cannotDelete = new ArrayList<>();
    List<String> cannotRename = new ArrayList<>();
    List<String> mustKeep = new ArrayList<>();
    for (DexProgramClass clazz : classes) {
      String descriptor = clazz.getType().getDescriptor();
      if (!states.canDelete(clazz)) {
        cannotDelete.add(descriptor);
      }
      if (!states.canRename(clazz)) {
        cannotRename.add(descriptor);
      }
      if (states.isSeed(clazz)) {
        mustKeep.add(descriptor);
      }
    }
    return new ReachabilityReport(cannotDelete, cannotRename, mustKeep);
  }

  public void report(ReachabilityReportConsumer consumer) throws IOException {
    consumer.accept(computeReport());
  }
}
