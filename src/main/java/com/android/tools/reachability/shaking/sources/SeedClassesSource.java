// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking.sources;

import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.shaking.SeedClassesReader;
import com.android.tools.reachability.utils.InternalOptions;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

/** Keeps the classes listed in a seeds file. See {@link SeedClassesReader}. */
public class SeedClassesSource implements ReachabilityEvidenceSource {

  private final Path seedsFile;
  private final InternalOptions options;

  public SeedClassesSource(Path seedsFile, InternalOptions options) {
    this.seedsFile = seedsFile;
    this.options = options;
  }

  @Override
  public String getName() {
    return "seeds";
  }

  @Override
  public int evaluate(ReachabilityMarker marker, ExecutorService executorService) {
    return new SeedClassesReader(marker, options).readSeeds(seedsFile);
  }
}
