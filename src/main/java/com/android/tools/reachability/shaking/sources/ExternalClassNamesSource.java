// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking.sources;

import com.android.tools.reachability.shaking.ClassNameExtractor;
import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.utils.InternalOptions;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

/**
 * Keeps classes that are named outside of the code: in the manifest (e.g., activities and
 * services), in layouts (views and fragments inflated from XML) and in native libraries.
 *
 * <p>These names cannot be rewritten, so the classes are marked as referenced by name from outside
 * the code, which prevents both removal and renaming.
 */
public class ExternalClassNamesSource implements ReachabilityEvidenceSource {

  private final Path apkDirectory;
  private final ClassNameExtractor manifestClassNameExtractor;
  private final ClassNameExtractor layoutClassNameExtractor;
  private final ClassNameExtractor nativeLibraryClassNameExtractor;
  private final InternalOptions options;

  public ExternalClassNamesSource(
      Path apkDirectory,
      ClassNameExtractor manifestClassNameExtractor,
      ClassNameExtractor layoutClassNameExtractor,
      ClassNameExtractor nativeLibraryClassNameExtractor,
      InternalOptions options) {
    this.apkDirectory = apkDirectory;
    this.manifestClassNameExtractor = manifestClassNameExtractor;
    this.layoutClassNameExtractor = layoutClassNameExtractor;
    this.nativeLibraryClassNameExtractor = nativeLibraryClassNameExtractor;
    this.options = options;
  }

  @Override
  public String getName() {
    return "external_class_names";
  }

  @Override
  public int evaluate(ReachabilityMarker marker, ExecutorService executorService) {
    int marked = 0;
    marked += markClassNames("manifest", manifestClassNameExtractor, marker);
    marked += markClassNames("xml_layout", layoutClassNameExtractor, marker);
    marked += markClassNames("native_lib", nativeLibraryClassNameExtractor, marker);
    return marked;
  }

  private int markClassNames(
      String kind, ClassNameExtractor extractor, ReachabilityMarker marker) {
    int marked = 0;
    for (String className : extractor.extractClassNames(apkDirectory)) {
      if (marker.markByClassName(className, false)) {
        options.trace(kind + ": " + className);
        marked++;
      }
    }
    return marked;
  }
}
