// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking.sources;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.android.tools.reachability.TestBase;
import com.android.tools.reachability.TestParameters;
import com.android.tools.reachability.graph.AccessFlags;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.shaking.ProguardClassType;
import com.android.tools.reachability.shaking.ProguardKeepRule;
import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.shaking.ReachabilityStateCollection;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class ProguardClassRulesSourceTest extends TestBase {

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

  private static ProguardKeepRule rule(ProguardClassType classType, String className) {
    return ProguardKeepRule.builder().setClassType(classType).setClassName(className).build();
  }

  @Test
  public void testApplicableRules() {
    assertTrue(ProguardClassRulesSource.isApplicable(ProguardKeepRule.keepClass("com.example.A")));
    assertTrue(
        ProguardClassRulesSource.isApplicable(
            rule(ProguardClassType.INTERFACE, "com.example.Callback")));
    assertTrue(
        ProguardClassRulesSource.isApplicable(
            ProguardKeepRule.builder()
                .setClassType(ProguardClassType.CLASS)
                .setClassName("com.example.WithMembers")
                .addMemberRule("public <init>();")
                .build()));
    assertTrue(ProguardClassRulesSource.isApplicable(ProguardKeepRule.keepClass("abc")));

    assertFalse(ProguardClassRulesSource.isApplicable(ProguardKeepRule.keepClass("ab")));
    assertFalse(ProguardClassRulesSource.isApplicable(ProguardKeepRule.keepClass("**")));
    assertFalse(ProguardClassRulesSource.isApplicable(ProguardKeepRule.keepClass("com.example.*")));
    assertFalse(
        ProguardClassRulesSource.isApplicable(rule(ProguardClassType.ENUM, "com.example.Color")));
    assertFalse(
        ProguardClassRulesSource.isApplicable(
            rule(ProguardClassType.ANNOTATION_INTERFACE, "com.example.Marker")));
    assertFalse(
        ProguardClassRulesSource.isApplicable(
            rule(ProguardClassType.UNSPECIFIED, "com.example.Foo")));
    assertFalse(
        ProguardClassRulesSource.isApplicable(
            ProguardKeepRule.builder().setClassType(ProguardClassType.CLASS).build()));
  }

  @Test
  public void testMatchedClassesAreMarkedWithCascade() throws Exception {
    DexProgramClass kept = simpleClass("Lcom/example/Kept;");
    DexProgramClass callback =
        classBuilder("Lcom/example/Callback;")
            .setAccessFlags(PUBLIC | INTERFACE)
            .addMethod("onDone", "()V", PUBLIC | AccessFlags.ACC_ABSTRACT)
            .build();
    DexProgramClass color = simpleClass("Lcom/example/Color;");
    DexProgramClass ab = simpleClass("Lab;");
    DexProgramClass other = simpleClass("Lcom/example/Other;");
    ReachabilityMarker marker =
        createMarker(buildApplication(kept, callback, color, ab, other), createOptions());
    ReachabilityStateCollection states = marker.getStates();

    ProguardClassRulesSource source =
        new ProguardClassRulesSource(
            ImmutableList.of(
                ProguardKeepRule.keepClass("com.example.Kept"),
                rule(ProguardClassType.INTERFACE, "com.example.Callback"),
                rule(ProguardClassType.ENUM, "com.example.Color"),
                ProguardKeepRule.keepClass("ab"),
                ProguardKeepRule.keepClass("com.example.*"),
                ProguardKeepRule.keepClass("com.example.Kept2")),
            createOptions());
    assertEquals(3, source.getMatchers().size());
    assertEquals(2, source.evaluate(marker, getExecutorService()));

    for (DexProgramClass clazz : ImmutableList.of(kept, callback)) {
      assertTrue(states.get(clazz).isTypeReferenced());
      assertFalse(states.canDelete(clazz));
      assertTrue(states.canRename(clazz));
      clazz.forEachMember(member -> assertFalse(states.canDelete(member)));
    }
    assertClassAndMembersUnmarked(states, color);
    assertClassAndMembersUnmarked(states, ab);
    assertClassAndMembersUnmarked(states, other);
  }
}
