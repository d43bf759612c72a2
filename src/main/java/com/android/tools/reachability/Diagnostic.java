// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability;

/** Interface for all diagnostic messages produced by the reachability analysis. */
public interface Diagnostic {

  /** User friendly description of the problem or fact. */
  String getDiagnosticMessage();
}
