// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import java.util.StringJoiner;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The reachability facts of a single class, method or field.
 *
 * <p>Facts are monotone: once set, a fact is never cleared, also not when the analysis is rerun
 * after the program changed. The state may therefore be stale, but it never under-approximates the
 * protection an item needs.
 *
 * <p>Each fact is a bit of one atomic word, so concurrent marking of different facts on the same
 * item does not lose updates.
 */
public final class ReachabilityState {

  private static final int TYPE_REFERENCED = 1;
  private static final int STRING_REFERENCED_FROM_CODE = 1 << 1;
  private static final int STRING_REFERENCED_EXTERNAL = 1 << 2;
  private static final int SEED_REFERENCED = 1 << 3;

  private final AtomicInteger facts = new AtomicInteger();

  // The monitor guarding cascades over the members of a class: the state of the class itself for
  // class states, and the state of the holder class for member states.
  private final Object lock;

  ReachabilityState() {
    this.lock = this;
  }

  ReachabilityState(ReachabilityState holderState) {
    this.lock = holderState.lock;
  }

  Object getLock() {
    return lock;
  }

  private boolean set(int fact) {
    int previous = facts.getAndUpdate(current -> current | fact);
    return (previous & fact) == 0;
  }

  private boolean isSet(int fact) {
    return (facts.get() & fact) != 0;
  }

  /**
   * The item is used directly in code, e.g., by a check-cast, new-instance, const-class or
   * instance-of, or is kept by a rule.
   *
   * @return true if the fact was not set before.
   */
  public boolean markTypeReferenced() {
    return set(TYPE_REFERENCED);
  }

  /**
   * The item is referenced by its name. If {@code fromCode} is true the name occurs in the
   * program's code, e.g., {@code Class.forName("com.example.Foo")}; otherwise it occurs outside
   * the code, e.g., in a layout file, the manifest or a native library.
   *
   * @return true if the fact was not set before.
   */
  public boolean markStringReferenced(boolean fromCode) {
    return set(fromCode ? STRING_REFERENCED_FROM_CODE : STRING_REFERENCED_EXTERNAL);
  }

  /**
   * The item is listed in the seeds, i.e., it is explicitly kept by name.
   *
   * @return true if the fact was not set before.
   */
  public boolean markSeedReferenced() {
    return set(SEED_REFERENCED);
  }

  public boolean isTypeReferenced() {
    return isSet(TYPE_REFERENCED);
  }

  public boolean isStringReferencedFromCode() {
    return isSet(STRING_REFERENCED_FROM_CODE);
  }

  public boolean isStringReferencedExternal() {
    return isSet(STRING_REFERENCED_EXTERNAL);
  }

  public boolean isSeedReferenced() {
    return isSet(SEED_REFERENCED);
  }

  public boolean isUnmarked() {
    return facts.get() == 0;
  }

  public boolean canDelete() {
    return isUnmarked();
  }

  public boolean canRename() {
    return (facts.get() & (STRING_REFERENCED_EXTERNAL | SEED_REFERENCED)) == 0;
  }

  public boolean isSeed() {
    return isSeedReferenced();
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "ReachabilityState{", "}");
    if (isTypeReferenced()) {
      joiner.add("type");
    }
    if (isStringReferencedFromCode()) {
      joiner.add("string-from-code");
    }
    if (isStringReferencedExternal()) {
      joiner.add("string-external");
    }
    if (isSeedReferenced()) {
      joiner.add("seed");
    }
    return joiner.toString();
  }
}
