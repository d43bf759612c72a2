// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.android.tools.reachability.utils.Reporter;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

/** Number of items marked by each evidence source, in the order the sources ran. */
public class ReachabilityStatistics {

  private final Object2IntLinkedOpenHashMap<String> markedItemsPerSource =
      new Object2IntLinkedOpenHashMap<>();

  public synchronized void record(String source, int markedItems) {
    markedItemsPerSource.addTo(source, markedItems);
  }

  public synchronized int getMarkedItems(String source) {
    return markedItemsPerSource.getInt(source);
  }

  public synchronized int getTotalMarkedItems() {
    int total = 0;
    for (int count : markedItemsPerSource.values()) {
      total += count;
    }
    return total;
  }

  public synchronized void report(Reporter reporter) {
    for (Object2IntMap.Entry<String> entry : markedItemsPerSource.object2IntEntrySet()) {
      reporter.info(
          "Reachability: " + entry.getKey() + " marked " + entry.getIntValue() + " items");
    }
  }
}
