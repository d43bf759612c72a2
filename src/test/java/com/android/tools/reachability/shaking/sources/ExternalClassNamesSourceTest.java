// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking.sources;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.android.tools.reachability.TestBase;
import com.android.tools.reachability.TestParameters;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.shaking.ClassNameExtractor;
import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.shaking.ReachabilityStateCollection;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class ExternalClassNamesSourceTest extends TestBase {

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

  @Test
  public void testNamesFromAllExtractors() throws Exception {
    DexProgramClass activity = simpleClass("Lcom/example/MainActivity;");
    DexProgramClass view = simpleClass("Lcom/example/widget/FancyView;");
    DexProgramClass jni = simpleClass("Lcom/example/jni/Bridge;");
    DexProgramClass unused = simpleClass("Lcom/example/Unused;");
    ReachabilityMarker marker =
        createMarker(buildApplication(activity, view, jni, unused), createOptions());
    ReachabilityStateCollection states = marker.getStates();

    Path apkDirectory = Paths.get("unpacked");
    List<Path> requestedDirectories = new ArrayList<>();
    ClassNameExtractor manifest =
        directory -> {
          requestedDirectories.add(directory);
          return ImmutableList.of("com.example.MainActivity", "com.example.MissingService");
        };
    ClassNameExtractor layouts =
        directory -> {
          requestedDirectories.add(directory);
          return ImmutableList.of("Lcom/example/widget/FancyView;");
        };
    ClassNameExtractor nativeLibraries =
        directory -> {
          requestedDirectories.add(directory);
          return ImmutableList.of("Lcom/example/jni/Bridge;");
        };

    ExternalClassNamesSource source =
        new ExternalClassNamesSource(
            apkDirectory, manifest, layouts, nativeLibraries, createOptions());
    assertEquals(3, source.evaluate(marker, getExecutorService()));

    assertEquals(ImmutableList.of(apkDirectory, apkDirectory, apkDirectory), requestedDirectories);
    for (DexProgramClass clazz : ImmutableList.of(activity, view, jni)) {
      assertTrue(states.get(clazz).isStringReferencedExternal());
      assertFalse(states.canDelete(clazz));
      assertFalse(states.canRename(clazz));
      clazz.forEachMember(member -> assertFalse(states.canRename(member)));
    }
    assertClassAndMembersUnmarked(states, unused);
  }

  @Test
  public void testEmptyExtractors() throws Exception {
    DexProgramClass activity = simpleClass("Lcom/example/MainActivity;");
    ReachabilityMarker marker = createMarker(buildApplication(activity), createOptions());

    ExternalClassNamesSource source =
        new ExternalClassNamesSource(
            Paths.get("unpacked"),
            ClassNameExtractor.empty(),
            ClassNameExtractor.empty(),
            ClassNameExtractor.empty(),
            createOptions());
    assertEquals(0, source.evaluate(marker, getExecutorService()));
    assertClassAndMembersUnmarked(marker.getStates(), activity);
  }
}
