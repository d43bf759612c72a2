// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.utils;

import com.android.tools.reachability.Diagnostic;

public class StringDiagnostic implements Diagnostic {

  private final String message;

  public StringDiagnostic(String message) {
    this.message = message;
  }

  @Override
  public String getDiagnosticMessage() {
    return message;
  }

  @Override
  public String toString() {
    return message;
  }
}
