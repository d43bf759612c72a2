// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.diagnostic;

import com.android.tools.reachability.Diagnostic;

/** A seed names a class that is not defined by the program. */
public class UnresolvedSeedClassDiagnostic implements Diagnostic {

  private final String className;

  public UnresolvedSeedClassDiagnostic(String className) {
    this.className = className;
  }

  public String getClassName() {
    return className;
  }

  @Override
  public String getDiagnosticMessage() {
    return "Seeds contain class for which no program class can be found: " + className;
  }
}
