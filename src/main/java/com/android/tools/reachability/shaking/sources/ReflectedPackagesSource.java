// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking.sources;

import com.android.tools.reachability.graph.DexApplication;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.utils.DescriptorUtils;
import com.android.tools.reachability.utils.InternalOptions;
import com.android.tools.reachability.utils.WorkList;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Keeps the classes of packages that are used with complex reflection ({@code keep_packages}),
 * together with all classes that extend from them, also when the subclasses are in other
 * packages.
 *
 * <p>Some of these classes are used by name and others by type, but there is no way to tell them
 * apart, so all of them are marked in the most conservative way: referenced by name from outside
 * the code.
 */
public class ReflectedPackagesSource implements ReachabilityEvidenceSource {

  private final List<String> descriptorPrefixes;
  private final InternalOptions options;

  public ReflectedPackagesSource(Iterable<String> packagePrefixes, InternalOptions options) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (String packagePrefix : packagePrefixes) {
      if (!packagePrefix.isEmpty()) {
        builder.add(DescriptorUtils.toDescriptorPrefix(packagePrefix));
      }
    }
    this.descriptorPrefixes = builder.build();
    this.options = options;
  }

  @Override
  public String getName() {
    return "keep_packages";
  }

  @Override
  public int evaluate(ReachabilityMarker marker, ExecutorService executorService) {
    if (descriptorPrefixes.isEmpty()) {
      return 0;
    }
    DexApplication application = marker.getApplication();
    Set<DexProgramClass> reflectedClasses = computeReflectedClasses(application);
    int marked = 0;
    for (DexProgramClass clazz : application.classes()) {
      if (reflectedClasses.contains(clazz)) {
        options.trace("reflected_package: " + clazz.getType());
        marker.markByName(clazz, false);
        marked++;
      }
    }
    return marked;
  }

  /**
   * Returns the classes in the reflected packages, closed under subclassing.
   *
   * <p>The super class chain of each class is walked iteratively until it reaches a class that is
   * already decided, a class outside the program, or a class seen before on the same walk (a
   * malformed, cyclic hierarchy). All classes on the walk share the outcome.
   */
  Set<DexProgramClass> computeReflectedClasses(DexApplication application) {
    Set<DexProgramClass> reflectedClasses = Sets.newIdentityHashSet();
    for (DexProgramClass clazz : application.classes()) {
      if (isInReflectedPackage(clazz)) {
        reflectedClasses.add(clazz);
      }
    }
    Set<DexProgramClass> nonReflectedClasses = Sets.newIdentityHashSet();
    for (DexProgramClass clazz : application.classes()) {
      if (reflectedClasses.contains(clazz) || nonReflectedClasses.contains(clazz)) {
        continue;
      }
      List<DexProgramClass> chain = new ArrayList<>();
      boolean extendsReflectedClass = false;
      WorkList<DexProgramClass> worklist = WorkList.newIdentityWorkList(clazz);
      while (worklist.hasNext()) {
        DexProgramClass current = worklist.next();
        if (reflectedClasses.contains(current)) {
          extendsReflectedClass = true;
          break;
        }
        if (nonReflectedClasses.contains(current)) {
          break;
        }
        chain.add(current);
        DexProgramClass superClass = application.definitionFor(current.getSuperType());
        if (superClass != null) {
          worklist.addIfNotSeen(superClass);
        }
      }
      if (extendsReflectedClass) {
        reflectedClasses.addAll(chain);
      } else {
        nonReflectedClasses.addAll(chain);
      }
    }
    return reflectedClasses;
  }

  private boolean isInReflectedPackage(DexProgramClass clazz) {
    String descriptor = clazz.getType().getDescriptor();
    for (String descriptorPrefix : descriptorPrefixes) {
      if (descriptor.startsWith(descriptorPrefix)) {
        return true;
      }
    }
    return false;
  }
}
