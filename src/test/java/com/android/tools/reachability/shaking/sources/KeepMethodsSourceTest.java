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
import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.shaking.ReachabilityState;
import com.android.tools.reachability.shaking.ReachabilityStateCollection;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class KeepMethodsSourceTest extends TestBase {

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
  public void testExactNameMatch() throws Exception {
    DexProgramClass activity =
        classBuilder("Lcom/example/MainActivity;")
            .addMethod("onCreate", "(Landroid/os/Bundle;)V", PUBLIC)
            .addMethod("onCreate2", "()V", PUBLIC)
            .addMethod("onCreateView", "()Landroid/view/View;", PUBLIC)
            .build();
    DexProgramClass helper =
        classBuilder("Lcom/example/Helper;")
            .addMethod("onCreate", "()V", PRIVATE | STATIC)
            .addField("onCreate", "I", PUBLIC)
            .build();
    ReachabilityMarker marker = createMarker(buildApplication(activity, helper), createOptions());
    ReachabilityStateCollection states = marker.getStates();

    KeepMethodsSource source = new KeepMethodsSource(ImmutableList.of("onCreate"), createOptions());
    assertEquals(2, source.evaluate(marker, getExecutorService()));

    ReachabilityState onCreate = states.get(method(activity, "onCreate"));
    assertTrue(onCreate.isStringReferencedExternal());
    assertFalse(onCreate.canDelete());
    assertFalse(onCreate.canRename());
    assertFalse(states.canRename(method(helper, "onCreate")));

    assertUnmarked(states.get(method(activity, "onCreate2")));
    assertUnmarked(states.get(method(activity, "onCreateView")));
    assertUnmarked(states.get(field(helper, "onCreate")));
    assertUnmarked(states.get(activity));
    assertUnmarked(states.get(helper));
  }

  @Test
  public void testNoNames() throws Exception {
    DexProgramClass foo = simpleClass("Lcom/example/Foo;");
    ReachabilityMarker marker = createMarker(buildApplication(foo), createOptions());

    assertEquals(
        0,
        new KeepMethodsSource(ImmutableList.of(), createOptions())
            .evaluate(marker, getExecutorService()));
    assertClassAndMembersUnmarked(marker.getStates(), foo);
  }
}
