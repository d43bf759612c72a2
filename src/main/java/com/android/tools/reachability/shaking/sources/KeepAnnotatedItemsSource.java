// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking.sources;

import com.android.tools.reachability.graph.DexApplication;
import com.android.tools.reachability.graph.DexDefinition;
import com.android.tools.reachability.graph.DexItemFactory;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.graph.DexType;
import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.utils.DescriptorUtils;
import com.android.tools.reachability.utils.InternalOptions;
import com.android.tools.reachability.utils.ThreadUtils;
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/** Keeps classes, methods and fields annotated with one of the keep annotations. */
public class KeepAnnotatedItemsSource implements ReachabilityEvidenceSource {

  private final Set<DexType> annotationTypes;
  private final InternalOptions options;

  public KeepAnnotatedItemsSource(Set<DexType> annotationTypes, InternalOptions options) {
    this.annotationTypes = annotationTypes;
    this.options = options;
  }

  /**
   * Creates the source for the given annotation names. Names for which the application has no type
   * cannot occur as annotations and are dropped.
   */
  public static KeepAnnotatedItemsSource create(
      DexApplication application, Iterable<String> annotationNames, InternalOptions options) {
    DexItemFactory factory = application.dexItemFactory();
    ImmutableSet.Builder<DexType> annotationTypes = ImmutableSet.builder();
    for (String annotationName : annotationNames) {
      DexType annotationType =
          factory.lookupType(DescriptorUtils.toClassDescriptor(annotationName));
      if (annotationType != null) {
        annotationTypes.add(annotationType);
      } else {
        options.trace("keep_annotations: unknown annotation type " + annotationName);
      }
    }
    return new KeepAnnotatedItemsSource(annotationTypes.build(), options);
  }

  public Set<DexType> getAnnotationTypes() {
    return annotationTypes;
  }

  @Override
  public String getName() {
    return "keep_annotations";
  }

  @Override
  public int evaluate(ReachabilityMarker marker, ExecutorService executorService)
      throws ExecutionException {
    if (annotationTypes.isEmpty()) {
      return 0;
    }
    AtomicInteger marked = new AtomicInteger();
    ThreadUtils.processItems(
        marker.getApplication().classes(),
        clazz -> marked.addAndGet(keepAnnotatedItems(clazz, marker)),
        executorService);
    return marked.get();
  }

  private int keepAnnotatedItems(DexProgramClass clazz, ReachabilityMarker marker) {
    int[] marked = {0};
    if (keepIfAnnotated(clazz, marker)) {
      marked[0]++;
    }
    clazz.forEachMember(
        member -> {
          if (keepIfAnnotated(member, marker)) {
            marked[0]++;
          }
        });
    return marked[0];
  }

  private boolean keepIfAnnotated(DexDefinition definition, ReachabilityMarker marker) {
    if (definition.annotations().containsAny(annotationTypes)) {
      options.trace("keep_annotations: " + definition.toDescriptorString());
      marker.markOnlyDirectly(definition);
      return true;
    }
    return false;
  }
}
