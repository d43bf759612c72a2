// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking.sources;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.android.tools.reachability.TestBase;
import com.android.tools.reachability.TestParameters;
import com.android.tools.reachability.graph.DexApplication;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.shaking.ReachabilityStateCollection;
import com.android.tools.reachability.utils.InternalOptions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class KeepAnnotatedItemsSourceTest extends TestBase {

  private static final String KEEP = "Lcom/example/annotations/Keep;";
  private static final String DO_NOT_OPTIMIZE = "Lcom/example/annotations/DoNotOptimize;";

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
  public void testAnnotatedItemsAreMarkedWithoutCascade() throws Exception {
    DexProgramClass annotatedClass =
        classBuilder("Lcom/example/Annotated;")
            .addAnnotation(KEEP)
            .addMethod("run", "()V", PUBLIC)
            .addField("count", "I", PRIVATE)
            .build();
    DexProgramClass withAnnotatedMembers =
        classBuilder("Lcom/example/Members;")
            .addMethod("kept", "()V", PUBLIC, KEEP)
            .addMethod("notKept", "()V", PUBLIC)
            .addField("keptField", "I", PUBLIC | STATIC, DO_NOT_OPTIMIZE)
            .addField("otherField", "I", PUBLIC | STATIC)
            .build();
    DexApplication application = buildApplication(annotatedClass, withAnnotatedMembers);
    InternalOptions options = createOptions();
    ReachabilityMarker marker = createMarker(application, options);
    ReachabilityStateCollection states = marker.getStates();

    KeepAnnotatedItemsSource source =
        KeepAnnotatedItemsSource.create(
            application,
            ImmutableList.of("com.example.annotations.Keep", DO_NOT_OPTIMIZE),
            options);
    assertEquals(3, source.evaluate(marker, getExecutorService()));

    assertTrue(states.get(annotatedClass).isTypeReferenced());
    assertUnmarked(states.get(method(annotatedClass, "run")));
    assertUnmarked(states.get(field(annotatedClass, "count")));

    assertUnmarked(states.get(withAnnotatedMembers));
    assertFalse(states.canDelete(method(withAnnotatedMembers, "kept")));
    assertTrue(states.canRename(method(withAnnotatedMembers, "kept")));
    assertFalse(states.canDelete(field(withAnnotatedMembers, "keptField")));
    assertUnmarked(states.get(method(withAnnotatedMembers, "notKept")));
    assertUnmarked(states.get(field(withAnnotatedMembers, "otherField")));
  }

  @Test
  public void testUnknownAnnotationIsDropped() throws Exception {
    DexProgramClass clazz = classBuilder("Lcom/example/Annotated;").addAnnotation(KEEP).build();
    DexApplication application = buildApplication(clazz);
    InternalOptions options = createOptions();
    options.verbose = true;
    ReachabilityMarker marker = createMarker(application, options);

    KeepAnnotatedItemsSource source =
        KeepAnnotatedItemsSource.create(
            application, ImmutableList.of("com.example.annotations.Unknown"), options);

    assertTrue(source.getAnnotationTypes().isEmpty());
    assertEquals(0, source.evaluate(marker, getExecutorService()));
    assertClassAndMembersUnmarked(marker.getStates(), clazz);
    assertTrue(diagnostics.hasInfoContaining("com.example.annotations.Unknown"));
  }
}
