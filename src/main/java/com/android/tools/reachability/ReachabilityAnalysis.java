// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability;

import com.android.tools.reachability.graph.DexApplication;
import com.android.tools.reachability.graph.DexDefinition;
import com.android.tools.reachability.shaking.ReachabilityConfiguration;
import com.android.tools.reachability.shaking.ReachabilityInputs;
import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.shaking.ReachabilityReport;
import com.android.tools.reachability.shaking.ReachabilityReportConsumer;
import com.android.tools.reachability.shaking.ReachabilityReportFileConsumer;
import com.android.tools.reachability.shaking.ReachabilityReporter;
import com.android.tools.reachability.shaking.ReachabilityRuleEvaluator;
import com.android.tools.reachability.shaking.ReachabilityStateCollection;
import com.android.tools.reachability.shaking.ReachabilityStatistics;
import com.android.tools.reachability.shaking.ReachableFromCodeRecomputer;
import com.android.tools.reachability.shaking.SeedClassesReader;
import com.android.tools.reachability.utils.InternalOptions;
import com.android.tools.reachability.utils.ThreadUtils;
import com.android.tools.reachability.utils.timing.Timing;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Decides for every class, method and field of an application whether it can be deleted or
 * renamed by later optimization passes.
 *
 * <p>Typical use:
 *
 * <pre>
 *   ReachabilityAnalysis analysis = ReachabilityAnalysis.create(application, options);
 *   analysis.initReachableClasses(configuration, inputs, executorService);
 *   for (each optimization pass) {
 *     // consult analysis.canDelete(item) and analysis.canRename(item)
 *     analysis.recomputeClassesReachableFromCode(executorService);
 *   }
 *   analysis.writeReport(basePath);
 * </pre>
 */
public class ReachabilityAnalysis {

  private final InternalOptions options;
  private final ReachabilityStateCollection states;
  private final ReachabilityMarker marker;

  private ReachabilityAnalysis(DexApplication application, InternalOptions options) {
    this.options = options;
    this.states = ReachabilityStateCollection.create(application, options);
    this.marker = new ReachabilityMarker(states, options);
  }

  public static ReachabilityAnalysis create(DexApplication application, InternalOptions options) {
    return new ReachabilityAnalysis(application, options);
  }

  public DexApplication getApplication() {
    return states.getApplication();
  }

  public ReachabilityStateCollection getStates() {
    return states;
  }

  public ReachabilityMarker getMarker() {
    return marker;
  }

  /**
   * Marks the items that are reachable independently of the code, and then the items that are
   * reachable from the current code.
   */
  public ReachabilityStatistics initReachableClasses(
      ReachabilityConfiguration configuration,
      ReachabilityInputs inputs,
      ExecutorService executorService)
      throws ExecutionException {
    Timing timing = Timing.create("Reachability", options);
    ReachabilityStatistics statistics =
        ReachabilityRuleEvaluator.create(getApplication(), configuration, inputs, options)
            .evaluate(marker, executorService, timing);
    timing.time(
        "Recompute reachable from code",
        () -> recomputeClassesReachableFromCode(executorService));
    timing.report();
    return statistics;
  }

  public ReachabilityStatistics initReachableClasses(
      ReachabilityConfiguration configuration, ReachabilityInputs inputs)
      throws ExecutionException {
    ExecutorService executorService = ThreadUtils.getExecutorService(options);
    try {
      return initReachableClasses(configuration, inputs, executorService);
    } finally {
      executorService.shutdown();
    }
  }

  /**
   * Marks the classes listed in the seeds file.
   *
   * @return the number of classes marked as seeds; zero if the file is missing or unreadable.
   */
  public int initSeedClasses(Path seedsFile) {
    return new SeedClassesReader(marker, options).readSeeds(seedsFile);
  }

  /** Reasserts the reachability facts derived from code. Run after each pass changing the code. */
  public int recomputeClassesReachableFromCode(ExecutorService executorService)
      throws ExecutionException {
    return new ReachableFromCodeRecomputer(marker, options)
        .recomputeClassesReachableFromCode(executorService);
  }

  public boolean canDelete(DexDefinition definition) {
    return states.canDelete(definition);
  }

  public boolean canRename(DexDefinition definition) {
    return states.canRename(definition);
  }

  public boolean isSeed(DexDefinition definition) {
    return states.isSeed(definition);
  }

  public ReachabilityReport computeReport() {
    return new ReachabilityReporter(states, options).computeReport();
  }

  public void report(ReachabilityReportConsumer consumer) throws IOException {
    new ReachabilityReporter(states, options).report(consumer);
  }

  public void writeReport(Path basePath) throws IOException {
    report(new ReachabilityReportFileConsumer(basePath));
  }
}
