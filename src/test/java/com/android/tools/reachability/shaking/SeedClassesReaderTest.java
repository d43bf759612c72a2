// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.android.tools.reachability.TestBase;
import com.android.tools.reachability.TestParameters;
import com.android.tools.reachability.diagnostic.UnresolvedSeedClassDiagnostic;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.utils.InternalOptions;
import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class SeedClassesReaderTest extends TestBase {

  @Parameter(0)
  public TestParameters parameters;

  @Parameters(name = "{0}")
  public static List<Object[]> data() {
    return TestParameters.all();
  }

  @Override
  protected TestParameters getParameters() {
    return parameters;
  }

  private Path writeSeeds(String... lines) throws Exception {
    Path seeds = temp.newFile("seeds.txt").toPath();
    Files.write(seeds, ImmutableList.copyOf(lines), StandardCharsets.UTF_8);
    return seeds;
  }

  @Test
  public void testMemberLinesAreSkipped() throws Exception {
    DexProgramClass keep = simpleClass("Lcom/example/Keep;");
    DexProgramClass bad = simpleClass("Lcom/example/Bad;");
    ReachabilityMarker marker = createMarker(buildApplication(keep, bad), createOptions());
    ReachabilityStateCollection states = marker.getStates();

    int count =
        new SeedClassesReader(marker, createOptions())
            .readSeeds(writeSeeds("com.example.Keep", "com.example.Bad:member"));

    assertEquals(1, count);
    assertTrue(states.isSeed(keep));
    assertFalse(states.canDelete(keep));
    assertFalse(states.canRename(keep));
    keep.forEachMember(member -> assertUnmarked(states.get(member)));
    assertClassAndMembersUnmarked(states, bad);
  }

  @Test
  public void testInnerClassLinesAreSkipped() throws Exception {
    DexProgramClass outer = simpleClass("Lcom/example/Outer;");
    DexProgramClass inner = simpleClass("Lcom/example/Outer$Inner;");
    ReachabilityMarker marker = createMarker(buildApplication(outer, inner), createOptions());

    int count =
        new SeedClassesReader(marker, createOptions())
            .markSeeds(ImmutableList.of("com.example.Outer$Inner", "com.example.Outer"));

    assertEquals(1, count);
    assertTrue(marker.getStates().isSeed(outer));
    assertClassAndMembersUnmarked(marker.getStates(), inner);
  }

  @Test
  public void testLinesAreNotTrimmed() throws Exception {
    DexProgramClass keep = simpleClass("Lcom/example/Keep;");
    ReachabilityMarker marker = createMarker(buildApplication(keep), createOptions());

    int count =
        new SeedClassesReader(marker, createOptions())
            .markSeeds(ImmutableList.of(" com.example.Keep", "com.example.Keep ", ""));

    assertEquals(0, count);
    assertClassAndMembersUnmarked(marker.getStates(), keep);
  }

  @Test
  public void testMissingFileMeansNoSeeds() {
    DexProgramClass keep = simpleClass("Lcom/example/Keep;");
    ReachabilityMarker marker = createMarker(buildApplication(keep), createOptions());

    Path missing = temp.getRoot().toPath().resolve("missing.txt");
    assertEquals(0, new SeedClassesReader(marker, createOptions()).readSeeds(missing));
    assertClassAndMembersUnmarked(marker.getStates(), keep);
    diagnostics.assertNoWarningsOrErrors();
  }

  @Test
  public void testInvalidUtf8OnlyDropsTheAffectedLine() throws Exception {
    DexProgramClass keep = simpleClass("Lcom/example/Keep;");
    DexProgramClass other = simpleClass("Lcom/example/Other;");
    ReachabilityMarker marker = createMarker(buildApplication(keep, other), createOptions());
    ReachabilityStateCollection states = marker.getStates();

    Path seeds = temp.newFile("seeds.txt").toPath();
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    bytes.write("com.example.Keep\n".getBytes(StandardCharsets.UTF_8));
    bytes.write(new byte[] {'c', 'o', 'm', '.', (byte) 0xff, '\n'});
    bytes.write("com.example.Other\n".getBytes(StandardCharsets.UTF_8));
    Files.write(seeds, bytes.toByteArray());

    int count = new SeedClassesReader(marker, createOptions()).readSeeds(seeds);

    assertEquals(2, count);
    assertTrue(states.isSeed(keep));
    assertFalse(states.canDelete(keep));
    assertTrue(states.isSeed(other));
    assertFalse(states.canRename(other));
    diagnostics.assertNoWarningsOrErrors();
  }

  @Test
  public void testUnresolvedSeedsAreReportedWhenVerbose() throws Exception {
    DexProgramClass keep = simpleClass("Lcom/example/Keep;");
    InternalOptions options = createOptions();
    options.verbose = true;
    ReachabilityMarker marker = createMarker(buildApplication(keep), options);

    int count =
        new SeedClassesReader(marker, options)
            .readSeeds(writeSeeds("com.example.Keep", "com.example.Gone"));

    assertEquals(1, count);
    assertTrue(
        diagnostics.getInfos().stream()
            .anyMatch(
                info ->
                    info instanceof UnresolvedSeedClassDiagnostic
                        && ((UnresolvedSeedClassDiagnostic) info)
                            .getClassName()
                            .equals("com.example.Gone")));
    assertTrue(diagnostics.hasInfoContaining("Read 1 seed classes"));
    diagnostics.assertNoWarningsOrErrors();
  }

  @Test
  public void testUnresolvedSeedsAreSilentByDefault() throws Exception {
    DexProgramClass keep = simpleClass("Lcom/example/Keep;");
    ReachabilityMarker marker = createMarker(buildApplication(keep), createOptions());

    new SeedClassesReader(marker, createOptions()).readSeeds(writeSeeds("com.example.Gone"));

    assertTrue(diagnostics.getInfos().isEmpty());
  }

  @Test
  public void testSupportedSeedLines() {
    assertTrue(SeedClassesReader.isSupportedSeed("com.example.Foo"));
    assertFalse(SeedClassesReader.isSupportedSeed("com.example.Foo: void bar()"));
    assertFalse(SeedClassesReader.isSupportedSeed("com.example.Foo$Bar"));
  }
}
