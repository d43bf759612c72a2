// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.utils;

@FunctionalInterface
public interface ThrowingAction<E extends Throwable> {

  void execute() throws E;
}
