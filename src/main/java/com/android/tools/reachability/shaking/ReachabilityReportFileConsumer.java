// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the report next to a base path: {@code <base>.cant_delete}, {@code <base>.cant_rename} and
 * {@code <base>.must_keep}, one class descriptor per line. Existing files are overwritten.
 */
public class ReachabilityReportFileConsumer implements ReachabilityReportConsumer {

  public static final String CANNOT_DELETE_SUFFIX = ".cant_delete";
  public static final String CANNOT_RENAME_SUFFIX = ".cant_rename";
  public static final String MUST_KEEP_SUFFIX = ".must_keep";

  private final Path basePath;

  public ReachabilityReportFileConsumer(Path basePath) {
    this.basePath = basePath;
  }

  public Path getCannotDeletePath() {
    return withSuffix(CANNOT_DELETE_SUFFIX);
  }

  public Path getCannotRenamePath() {
    return withSuffix(CANNOT_RENAME_SUFFIX);
  }

  public Path getMustKeepPath() {
    return withSuffix(MUST_KEEP_SUFFIX);
  }

  private Path withSuffix(String suffix) {
    return basePath.resolveSibling(basePath.getFileName() + suffix);
  }

  @Override
  public void accept(ReachabilityReport report) throws IOException {
    writeLines(getCannotDeletePath(), report.getCannotDelete());
    writeLines(getCannotRenamePath(), report.getCannotRename());
    writeLines(getMustKeepPath(), report.getMustKeep());
  }

  private static void writeLines(Path path, List<String> lines) throws IOException {
    Files.write(path, lines, StandardCharsets.UTF_8);
  }
}
