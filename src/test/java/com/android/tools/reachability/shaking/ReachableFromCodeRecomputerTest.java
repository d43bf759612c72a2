// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.android.tools.reachability.TestBase;
import com.android.tools.reachability.TestParameters;
import com.android.tools.reachability.graph.AccessFlags;
import com.android.tools.reachability.graph.DexAnnotationSet;
import com.android.tools.reachability.graph.DexEncodedMethod;
import com.android.tools.reachability.graph.DexProgramClass;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class ReachableFromCodeRecomputerTest extends TestBase {

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
  public void testNativeMethodHoldersAreReferencedFromCode() throws Exception {
    DexProgramClass jni =
        classBuilder("Lcom/example/Jni;")
            .addMethod("<init>", "()V", PUBLIC | CONSTRUCTOR)
            .addMethod("nativeInit", "()V", PRIVATE | STATIC | NATIVE)
            .addMethod("nativeRun", "(I)I", PUBLIC | NATIVE)
            .addField("handle", "J", PRIVATE)
            .build();
    DexProgramClass plain = simpleClass("Lcom/example/Plain;");
    ReachabilityMarker marker = createMarker(buildApplication(jni, plain), createOptions());
    ReachabilityStateCollection states = marker.getStates();

    int count =
        new ReachableFromCodeRecomputer(marker, createOptions())
            .recomputeClassesReachableFromCode(getExecutorService());

    assertEquals(1, count);
    assertTrue(states.get(jni).isStringReferencedFromCode());
    assertFalse(states.canDelete(jni));
    assertTrue(states.canRename(jni));
    jni.forEachMember(
        member -> {
          assertTrue(states.get(member).isStringReferencedFromCode());
          assertFalse(states.canDelete(member));
        });
    assertClassAndMembersUnmarked(states, plain);
  }

  @Test
  public void testRecomputeAfterProgramChange() throws Exception {
    DexProgramClass jni = simpleClass("Lcom/example/Jni;");
    DexProgramClass other = simpleClass("Lcom/example/Other;");
    ReachabilityMarker marker = createMarker(buildApplication(jni, other), createOptions());
    ReachabilityStateCollection states = marker.getStates();
    ReachableFromCodeRecomputer recomputer =
        new ReachableFromCodeRecomputer(marker, createOptions());

    assertEquals(0, recomputer.recomputeClassesReachableFromCode(getExecutorService()));
    assertClassAndMembersUnmarked(states, jni);

    // A pass adds a native method.
    DexEncodedMethod nativeMethod =
        new DexEncodedMethod(
            jni.getType(),
            "bind",
            "()V",
            AccessFlags.fromFlags(PUBLIC | NATIVE),
            DexAnnotationSet.empty());
    jni.addMethod(nativeMethod);
    assertEquals(1, recomputer.recomputeClassesReachableFromCode(getExecutorService()));
    assertFalse(states.canDelete(jni));
    assertFalse(states.canDelete(nativeMethod));

    // A later pass removes it again; the marks stay.
    jni.removeMethod(nativeMethod);
    assertEquals(0, recomputer.recomputeClassesReachableFromCode(getExecutorService()));
    assertFalse(states.canDelete(jni));
    assertTrue(states.canRename(jni));
    assertClassAndMembersUnmarked(states, other);
  }
}
