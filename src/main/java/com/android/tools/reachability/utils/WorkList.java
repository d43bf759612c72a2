// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.utils;

import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/** A worklist that never enqueues the same item twice. */
public class WorkList<T> {

  private final Deque<T> workingList = new ArrayDeque<>();
  private final Set<T> seen;

  public static <T> WorkList<T> newIdentityWorkList() {
    return new WorkList<>(Sets.newIdentityHashSet());
  }

  public static <T> WorkList<T> newIdentityWorkList(T item) {
    WorkList<T> workList = newIdentityWorkList();
    workList.addIfNotSeen(item);
    return workList;
  }

  public static <T> WorkList<T> newEqualityWorkList() {
    return new WorkList<>(new HashSet<>());
  }

  private WorkList(Set<T> seen) {
    this.seen = seen;
  }

  public boolean addIfNotSeen(T item) {
    if (seen.add(item)) {
      workingList.addLast(item);
      return true;
    }
    return false;
  }

  public boolean hasNext() {
    return !workingList.isEmpty();
  }

  public T next() {
    assert hasNext();
    return workingList.removeFirst();
  }

  public boolean isSeen(T item) {
    return seen.contains(item);
  }

  public Set<T> getSeenSet() {
    return Collections.unmodifiableSet(seen);
  }
}
