// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.android.tools.reachability.graph.DexEncodedMethod;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.utils.InternalOptions;
import com.android.tools.reachability.utils.ThreadUtils;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Walks all the code of the application, finding classes that are reachable from code.
 *
 * <p>As code is changed or removed by the optimization passes this information becomes stale, so
 * this should be run again after each pass that changes the program. Marks are never retracted:
 * a class that was reachable from a method that has since been removed stays marked.
 */
public class ReachableFromCodeRecomputer {

  private final ReachabilityMarker marker;
  private final InternalOptions options;

  public ReachableFromCodeRecomputer(ReachabilityMarker marker, InternalOptions options) {
    this.marker = marker;
    this.options = options;
  }

  /**
   * Marks the holders of native methods as referenced by name from code: the runtime binds native
   * methods by the name of the class and the method.
   *
   * @return the number of classes that declare a native method.
   */
  public int recomputeClassesReachableFromCode(ExecutorService executorService)
      throws ExecutionException {
    AtomicInteger classesWithNativeMethods = new AtomicInteger();
    ThreadUtils.processItems(
        marker.getApplication().classes(),
        clazz -> {
          if (markIfDeclaresNativeMethod(clazz)) {
            classesWithNativeMethods.incrementAndGet();
          }
        },
        executorService);
    return classesWithNativeMethods.get();
  }

  private boolean markIfDeclaresNativeMethod(DexProgramClass clazz) {
    for (DexEncodedMethod method : clazz.directMethods()) {
      if (method.isNative()) {
        return markNativeMethodHolder(clazz, method);
      }
    }
    for (DexEncodedMethod method : clazz.virtualMethods()) {
      if (method.isNative()) {
        return markNativeMethodHolder(clazz, method);
      }
    }
    return false;
  }

  private boolean markNativeMethodHolder(DexProgramClass clazz, DexEncodedMethod method) {
    options.trace("native_method: " + method.toDescriptorString());
    marker.markByName(clazz, true);
    return true;
  }
}
