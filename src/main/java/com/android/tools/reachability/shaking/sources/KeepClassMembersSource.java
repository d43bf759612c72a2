// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking.sources;

import com.android.tools.reachability.graph.DexEncodedField;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.utils.InternalOptions;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Keeps static fields named by the {@code keep_class_members} configuration.
 *
 * <p>Each entry is a part of a class descriptor immediately followed by a part of a field name,
 * e.g., {@code Lcom/example/Constants;VERSION}. For a class, the class part of an entry is the
 * longest prefix of the entry that occurs in the class descriptor, and the rest of the entry is the
 * field part. The first class, in application order, that has a static field whose name contains
 * the field part has that field and the class itself kept; the entry is then done.
 */
public class KeepClassMembersSource implements ReachabilityEvidenceSource {

  private final List<String> classMembers;
  private final InternalOptions options;

  public KeepClassMembersSource(List<String> classMembers, InternalOptions options) {
    this.classMembers = classMembers;
    this.options = options;
  }

  @Override
  public String getName() {
    return "keep_class_members";
  }

  // The first match of an entry depends on the order of the classes, so this is not parallelized.
  @Override
  public int evaluate(ReachabilityMarker marker, ExecutorService executorService) {
    int marked = 0;
    for (String classMember : classMembers) {
      if (classMember.isEmpty()) {
        continue;
      }
      for (DexProgramClass clazz : marker.getApplication().classes()) {
        DexEncodedField field = findKeptField(clazz, classMember);
        if (field != null) {
          options.trace("keep_class_members: " + field.toDescriptorString());
          marker.markOnlyDirectly(field);
          marker.markDirectly(clazz);
          marked += 2;
          break;
        }
      }
    }
    return marked;
  }

  static DexEncodedField findKeptField(DexProgramClass clazz, String classMember) {
    int classPartLength = getClassPartLength(clazz.getType().getDescriptor(), classMember);
    if (classPartLength == 0 || classPartLength == classMember.length()) {
      return null;
    }
    String fieldPart = classMember.substring(classPartLength);
    for (DexEncodedField field : clazz.staticFields()) {
      if (field.getName().contains(fieldPart)) {
        return field;
      }
    }
    return null;
  }

  /** Length of the longest prefix of the entry that occurs in the descriptor. */
  static int getClassPartLength(String descriptor, String classMember) {
    for (int length = Math.min(classMember.length(), descriptor.length()); length > 0; length--) {
      if (descriptor.contains(classMember.substring(0, length))) {
        return length;
      }
    }
    return 0;
  }
}
