// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.utils.timing;

import com.android.tools.reachability.utils.InternalOptions;
import com.android.tools.reachability.utils.ThrowingAction;
import com.android.tools.reachability.utils.ThrowingSupplier;

public abstract class Timing implements AutoCloseable {

  public static Timing empty() {
    return Empty.INSTANCE;
  }

  public static Timing create(String title, InternalOptions options) {
    return options.printTimes ? new TimingImpl(title, options.reporter) : empty();
  }

  public abstract Timing begin(String title);

  public abstract Timing end();

  public abstract <E extends Exception> void time(String title, ThrowingAction<E> action) throws E;

  public abstract <T, E extends Exception> T time(String title, ThrowingSupplier<T, E> supplier)
      throws E;

  public abstract void report();

  // Remove throws from close() in AutoClosable to allow try with resources without explicit catch.
  @Override
  public final void close() {
    end();
  }

  /** Runs the timed code without measuring it. */
  private static final class Empty extends Timing {

    private static final Empty INSTANCE = new Empty();

    @Override
    public Timing begin(String title) {
      return this;
    }

    @Override
    public Timing end() {
      return this;
    }

    @Override
    public <E extends Exception> void time(String title, ThrowingAction<E> action) throws E {
      action.execute();
    }

    @Override
    public <T, E extends Exception> T time(String title, ThrowingSupplier<T, E> supplier)
        throws E {
      return supplier.get();
    }

    @Override
    public void report() {}
  }
}
