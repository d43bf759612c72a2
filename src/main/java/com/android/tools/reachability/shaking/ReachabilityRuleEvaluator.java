// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.android.tools.reachability.graph.DexApplication;
import com.android.tools.reachability.shaking.sources.ExternalClassNamesSource;
import com.android.tools.reachability.shaking.sources.KeepAnnotatedItemsSource;
import com.android.tools.reachability.shaking.sources.KeepClassMembersSource;
import com.android.tools.reachability.shaking.sources.KeepMethodsSource;
import com.android.tools.reachability.shaking.sources.ProguardClassRulesSource;
import com.android.tools.reachability.shaking.sources.ReachabilityEvidenceSource;
import com.android.tools.reachability.shaking.sources.ReflectedPackagesSource;
import com.android.tools.reachability.shaking.sources.SeedClassesSource;
import com.android.tools.reachability.utils.InternalOptions;
import com.android.tools.reachability.utils.timing.Timing;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Marks the classes, methods and fields that are reachable in such a way that no optimization pass
 * can make them unreachable, e.g., because they are named in the manifest.
 *
 * <p>The evidence sources run one after the other, in this order:
 *
 * <ol>
 *   <li>items annotated with a keep annotation,
 *   <li>static fields named by {@code keep_class_members},
 *   <li>methods named by {@code keep_methods},
 *   <li>classes named in the manifest, layouts and native libraries,
 *   <li>classes in the reflected packages and their subclasses,
 *   <li>classes named by class keep rules,
 *   <li>seed classes.
 * </ol>
 */
public class ReachabilityRuleEvaluator {

  private final List<ReachabilityEvidenceSource> sources;
  private final InternalOptions options;

  private ReachabilityRuleEvaluator(
      List<ReachabilityEvidenceSource> sources, InternalOptions options) {
    this.sources = sources;
    this.options = options;
  }

  public static ReachabilityRuleEvaluator create(
      DexApplication application,
      ReachabilityConfiguration configuration,
      ReachabilityInputs inputs,
      InternalOptions options) {
    Builder builder = builder(options);
    builder.addSource(
        KeepAnnotatedItemsSource.create(
            application,
            Iterables.concat(
                inputs.getNoOptimizationAnnotations(), configuration.getKeepAnnotations()),
            options));
    builder.addSource(new KeepClassMembersSource(configuration.getKeepClassMembers(), options));
    builder.addSource(new KeepMethodsSource(configuration.getKeepMethods(), options));
    if (configuration.hasApkDir()) {
      builder.addSource(
          new ExternalClassNamesSource(
              configuration.getApkDir(),
              inputs.getManifestClassNameExtractor(),
              inputs.getLayoutClassNameExtractor(),
              inputs.getNativeLibraryClassNameExtractor(),
              options));
    }
    builder.addSource(new ReflectedPackagesSource(configuration.getKeepPackages(), options));
    builder.addSource(new ProguardClassRulesSource(inputs.getKeepRules(), options));
    if (inputs.hasSeedsFile()) {
      builder.addSource(new SeedClassesSource(inputs.getSeedsFile(), options));
    }
    return builder.build();
  }

  public static Builder builder(InternalOptions options) {
    return new Builder(options);
  }

  public List<ReachabilityEvidenceSource> getSources() {
    return sources;
  }

  public ReachabilityStatistics evaluate(ReachabilityMarker marker, ExecutorService executorService)
      throws ExecutionException {
    return evaluate(marker, executorService, Timing.empty());
  }

  public ReachabilityStatistics evaluate(
      ReachabilityMarker marker, ExecutorService executorService, Timing timing)
      throws ExecutionException {
    ReachabilityStatistics statistics = new ReachabilityStatistics();
    for (ReachabilityEvidenceSource source : sources) {
      int marked = timing.time(source.getName(), () -> source.evaluate(marker, executorService));
      statistics.record(source.getName(), marked);
    }
    if (options.printStatistics) {
      statistics.report(options.reporter);
    }
    return statistics;
  }

  public static class Builder {

    private final InternalOptions options;
    private final ImmutableList.Builder<ReachabilityEvidenceSource> sources =
        ImmutableList.builder();

    private Builder(InternalOptions options) {
      this.options = options;
    }

    public Builder addSource(ReachabilityEvidenceSource source) {
      sources.add(source);
      return this;
    }

    public ReachabilityRuleEvaluator build() {
      return new ReachabilityRuleEvaluator(sources.build(), options);
    }
  }
}
