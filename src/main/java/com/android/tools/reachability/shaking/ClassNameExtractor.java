// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Extracts the names of classes referenced outside of the program's code, e.g., from the manifest,
 * the layout files or the native libraries of an unpacked application.
 *
 * <p>Names are class descriptors, e.g., {@code Lcom/example/MainActivity;}, or Java class names.
 */
@FunctionalInterface
public interface ClassNameExtractor {

  Collection<String> extractClassNames(Path apkDirectory);

  static ClassNameExtractor empty() {
    return apkDirectory -> ImmutableList.of();
  }
}
