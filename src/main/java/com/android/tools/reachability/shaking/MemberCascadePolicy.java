// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.android.tools.reachability.graph.DexEncodedMember;
import com.android.tools.reachability.graph.DexProgramClass;
import java.util.function.Consumer;

/** Decides which members of a class receive the marks applied to the class itself. */
public enum MemberCascadePolicy {

  // Every method and field declared directly on the class. This over-approximates: a kept class
  // does not need all of its members.
  ALL_MEMBERS,

  NONE;

  public void forEachCascadedMember(
      DexProgramClass clazz, Consumer<? super DexEncodedMember> consumer) {
    if (this == ALL_MEMBERS) {
      clazz.forEachMember(consumer);
    }
  }
}
