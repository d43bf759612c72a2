// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking.sources;

import com.android.tools.reachability.graph.DexEncodedMethod;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.utils.InternalOptions;
import com.android.tools.reachability.utils.ThreadUtils;
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps every method whose name is listed in the {@code keep_methods} configuration, in any class.
 * Names are compared exactly; only the methods are kept, not their classes.
 */
public class KeepMethodsSource implements ReachabilityEvidenceSource {

  private final Set<String> methodNames;
  private final InternalOptions options;

  public KeepMethodsSource(Iterable<String> methodNames, InternalOptions options) {
    this.methodNames = ImmutableSet.copyOf(methodNames);
    this.options = options;
  }

  @Override
  public String getName() {
    return "keep_methods";
  }

  @Override
  public int evaluate(ReachabilityMarker marker, ExecutorService executorService)
      throws ExecutionException {
    if (methodNames.isEmpty()) {
      return 0;
    }
    AtomicInteger marked = new AtomicInteger();
    ThreadUtils.processItems(
        marker.getApplication().classes(),
        clazz -> marked.addAndGet(keepMethods(clazz, marker)),
        executorService);
    return marked.get();
  }

  private int keepMethods(DexProgramClass clazz, ReachabilityMarker marker) {
    int marked = 0;
    for (DexEncodedMethod method : clazz.directMethods()) {
      marked += keepIfNamed(method, marker);
    }
    for (DexEncodedMethod method : clazz.virtualMethods()) {
      marked += keepIfNamed(method, marker);
    }
    return marked;
  }

  private int keepIfNamed(DexEncodedMethod method, ReachabilityMarker marker) {
    if (!methodNames.contains(method.getName())) {
      return 0;
    }
    options.trace("keep_methods: " + method.toDescriptorString());
    marker.markOnlyByName(method, false);
    return 1;
  }
}
