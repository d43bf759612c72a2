// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.utils;

import com.android.tools.reachability.Diagnostic;
import com.android.tools.reachability.DiagnosticsHandler;

/** Forwards diagnostics to the client handler. Safe to use from multiple threads. */
public class Reporter implements DiagnosticsHandler {

  private final DiagnosticsHandler clientHandler;

  public Reporter() {
    this(new DiagnosticsHandler() {});
  }

  public Reporter(DiagnosticsHandler clientHandler) {
    this.clientHandler = clientHandler;
  }

  @Override
  public synchronized void info(Diagnostic info) {
    clientHandler.info(info);
  }

  public void info(String message) {
    info(new StringDiagnostic(message));
  }

  @Override
  public synchronized void warning(Diagnostic warning) {
    clientHandler.warning(warning);
  }

  public void warning(String message) {
    warning(new StringDiagnostic(message));
  }

  @Override
  public synchronized void error(Diagnostic error) {
    clientHandler.error(error);
  }

  public void error(String message) {
    error(new StringDiagnostic(message));
  }
}
