// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A parsed keep rule, e.g., {@code -keep class com.example.Foo { *; }}.
 *
 * <p>The class name is in Java form and may contain wildcards. Member rules are recorded but only
 * the class part of a rule is evaluated.
 */
public class ProguardKeepRule {

  private final ProguardClassType classType;
  private final String className;
  private final List<String> memberRules;

  private ProguardKeepRule(
      ProguardClassType classType, String className, List<String> memberRules) {
    this.classType = classType;
    this.className = className;
    this.memberRules = memberRules;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ProguardKeepRule keepClass(String className) {
    return builder().setClassType(ProguardClassType.CLASS).setClassName(className).build();
  }

  public ProguardClassType getClassType() {
    return classType;
  }

  /** The class name pattern, or null if the rule does not name a class. */
  public String getClassName() {
    return className;
  }

  public boolean hasMemberRules() {
    return !memberRules.isEmpty();
  }

  public List<String> getMemberRules() {
    return memberRules;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("-keep ").append(classType);
    if (className != null) {
      builder.append(' ').append(className);
    }
    if (hasMemberRules()) {
      builder.append(" { ").append(String.join(" ", memberRules)).append(" }");
    }
    return builder.toString();
  }

  public static class Builder {

    private ProguardClassType classType = ProguardClassType.UNSPECIFIED;
    private String className;
    private final ImmutableList.Builder<String> memberRules = ImmutableList.builder();

    private Builder() {}

    public Builder setClassType(ProguardClassType classType) {
      this.classType = classType;
      return this;
    }

    public Builder setClassName(String className) {
      this.className = className;
      return this;
    }

    public Builder addMemberRule(String memberRule) {
      memberRules.add(memberRule);
      return this;
    }

    public ProguardKeepRule build() {
      return new ProguardKeepRule(classType, className, memberRules.build());
    }
  }
}
