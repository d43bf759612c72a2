// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.utils;

import com.android.tools.reachability.DiagnosticsHandler;
import com.android.tools.reachability.shaking.MemberCascadePolicy;

/** Options that steer the reachability analysis. Not part of the configuration file. */
public class InternalOptions {

  public final Reporter reporter;

  // Number of threads used by the parallel scans, or ThreadUtils.NOT_SPECIFIED to derive it from
  // the number of available processors.
  public int threadCount = ThreadUtils.NOT_SPECIFIED;

  public MemberCascadePolicy memberCascadePolicy = MemberCascadePolicy.ALL_MEMBERS;

  /**
   * When set, a name reference from a string constant in code does not prevent renaming, since
   * identifier strings in code are rewritten together with the entity they name.
   */
  public boolean allowRenamingOfCodeStringReferences = true;

  public boolean verbose = false;
  public boolean printTimes = false;
  public boolean printStatistics = false;

  public InternalOptions() {
    this(new Reporter());
  }

  public InternalOptions(DiagnosticsHandler diagnosticsHandler) {
    this(new Reporter(diagnosticsHandler));
  }

  public InternalOptions(Reporter reporter) {
    this.reporter = reporter;
  }

  public boolean isVerbose() {
    return verbose;
  }

  public MemberCascadePolicy getMemberCascadePolicy() {
    return memberCascadePolicy;
  }

  /** Reports a trace message when running with verbose output. */
  public void trace(String message) {
    if (verbose) {
      reporter.info(message);
    }
  }
}
