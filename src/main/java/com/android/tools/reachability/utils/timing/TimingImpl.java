// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.utils.timing;

import com.android.tools.reachability.utils.Reporter;
import com.android.tools.reachability.utils.ThrowingAction;
import com.android.tools.reachability.utils.ThrowingSupplier;
import com.google.common.base.Strings;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/** Timing that records a tree of named, nested intervals and reports them as info diagnostics. */
public class TimingImpl extends Timing {

  private final Reporter reporter;
  private final Node top;
  private final Deque<Node> stack = new ArrayDeque<>();

  TimingImpl(String title, Reporter reporter) {
    this.reporter = reporter;
    this.top = new Node(title);
    stack.push(top);
  }

  static class Node {

    final String title;
    final Map<String, Node> children = new LinkedHashMap<>();
    long duration = 0;
    long startTime;

    Node(String title) {
      this.title = title;
      this.startTime = System.nanoTime();
    }

    void restart() {
      assert startTime == -1;
      startTime = System.nanoTime();
    }

    void end() {
      duration += System.nanoTime() - startTime;
      startTime = -1;
    }

    long durationInMs() {
      return duration / 1000000;
    }

    void report(int depth, Node root, Reporter reporter) {
      long percentage = root.duration == 0 ? 100 : duration * 100 / root.duration;
      reporter.info(
          Strings.repeat("  ", depth)
              + title
              + ": "
              + durationInMs()
              + "ms ("
              + percentage
              + "%)");
      for (Node child : children.values()) {
        child.report(depth + 1, root, reporter);
      }
    }
  }

  @Override
  public Timing begin(String title) {
    Node parent = stack.peek();
    Node child = parent.children.get(title);
    if (child == null) {
      child = new Node(title);
      parent.children.put(title, child);
    } else {
      child.restart();
    }
    stack.push(child);
    return this;
  }

  @Override
  public Timing end() {
    stack.pop().end();
    return this;
  }

  @Override
  public <E extends Exception> void time(String title, ThrowingAction<E> action) throws E {
    begin(title);
    try {
      action.execute();
    } finally {
      end();
    }
  }

  @Override
  public <T, E extends Exception> T time(String title, ThrowingSupplier<T, E> supplier) throws E {
    begin(title);
    try {
      return supplier.get();
    } finally {
      end();
    }
  }

  @Override
  public void report() {
    assert stack.size() == 1 : "Unexpected non-terminated timing: " + stack.peek().title;
    if (top.startTime != -1) {
      top.end();
    }
    top.report(0, top, reporter);
  }
}
