// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.android.tools.reachability.errors.Unreachable;

public enum ProguardClassType {
  ANNOTATION_INTERFACE,
  CLASS,
  ENUM,
  INTERFACE,
  UNSPECIFIED;

  /** True for the class types whose rules are matched on the class name alone. */
  public boolean isClassOrInterface() {
    return this == CLASS || this == INTERFACE;
  }

  @Override
  public String toString() {
    switch (this) {
      case ANNOTATION_INTERFACE:
        return "@interface";
      case CLASS:
        return "class";
      case ENUM:
        return "enum";
      case INTERFACE:
        return "interface";
      case UNSPECIFIED:
        return "";
      default:
        throw new Unreachable("Invalid proguard class type '" + name() + "'");
    }
  }
}
