// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking.sources;

import com.android.tools.reachability.shaking.ReachabilityMarker;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * One kind of evidence that items of the program are reachable, e.g., keep annotations or class
 * names in the manifest.
 *
 * <p>Sources only add marks, so the final state does not depend on the order in which sources are
 * evaluated.
 */
public interface ReachabilityEvidenceSource {

  String getName();

  /**
   * Marks the items for which this source has evidence.
   *
   * @return the number of marked items.
   */
  int evaluate(ReachabilityMarker marker, ExecutorService executorService)
      throws ExecutionException;
}
