// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.android.tools.reachability.diagnostic.UnresolvedSeedClassDiagnostic;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.utils.DescriptorUtils;
import com.android.tools.reachability.utils.InternalOptions;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the seeds: the classes that are explicitly kept by name, one Java class name per line,
 * e.g., {@code com.example.Foo}.
 *
 * <p>Lines that name a member ({@code com.example.Foo: void bar()}) or an inner class ({@code
 * com.example.Foo$Bar}) are not supported and are skipped. Lines are used as is, without trimming.
 */
public class SeedClassesReader {

  private final ReachabilityMarker marker;
  private final InternalOptions options;

  public SeedClassesReader(ReachabilityMarker marker, InternalOptions options) {
    this.marker = marker;
    this.options = options;
  }

  /**
   * Marks the classes listed in the seeds file.
   *
   * <p>A missing or unreadable file is the same as a file without seeds. Bytes that are not valid
   * UTF-8 are decoded as U+FFFD, so only the lines containing them fail to resolve.
   *
   * @return the number of classes marked as seeds.
   */
  public int readSeeds(Path seedsFile) {
    options.trace("Reading seed classes from " + seedsFile);
    long start = System.nanoTime();
    List<String> lines;
    try {
      lines = readLines(seedsFile);
    } catch (IOException e) {
      options.trace("Seeds file " + seedsFile + " could not be read (ignoring error): " + e);
      return 0;
    }
    int count = markSeeds(lines);
    options.trace(
        "Read " + count + " seed classes in " + (System.nanoTime() - start) / 1000000 + "ms");
    return count;
  }

  /**
   * Marks the classes named by the given seed lines.
   *
   * @return the number of classes marked as seeds.
   */
  public int markSeeds(Iterable<String> lines) {
    int count = 0;
    for (String line : lines) {
      if (!isSupportedSeed(line)) {
        continue;
      }
      DexProgramClass clazz =
          marker
              .getApplication()
              .definitionForDescriptor(DescriptorUtils.javaTypeToDescriptor(line));
      if (clazz != null) {
        marker.markBySeed(clazz);
        count++;
      } else if (options.isVerbose()) {
        options.reporter.info(new UnresolvedSeedClassDiagnostic(line));
      }
    }
    return count;
  }

  private static List<String> readLines(Path seedsFile) throws IOException {
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    List<String> lines = new ArrayList<>();
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(Files.newInputStream(seedsFile), decoder))) {
      for (String line = reader.readLine(); line != null; line = reader.readLine()) {
        lines.add(line);
      }
    }
    return lines;
  }

  static boolean isSupportedSeed(String line) {
    return line.indexOf(':') < 0 && line.indexOf('$') < 0;
  }
}
