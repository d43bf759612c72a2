// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking.sources;

import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.shaking.ClassDescriptorMatcher;
import com.android.tools.reachability.shaking.ProguardKeepRule;
import com.android.tools.reachability.shaking.ReachabilityMarker;
import com.android.tools.reachability.utils.InternalOptions;
import com.android.tools.reachability.utils.ThreadUtils;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the classes named by keep rules.
 *
 * <p>Only class and interface rules with a concrete class name are applied for now. Rules such as
 * {@code -keep class * extends Foo} or {@code -keep class ** { @Bar *; }} match on some other
 * attribute than the name, and matching them on the name alone would keep everything. Member rules
 * are not evaluated; a rule with member rules keeps its class like a rule without.
 */
public class ProguardClassRulesSource implements ReachabilityEvidenceSource {

  // Class names of at most this length, such as "*" and "**", are never matched on.
  private static final int MINIMUM_CLASS_NAME_LENGTH = 2;

  private final List<ClassDescriptorMatcher> matchers;
  private final InternalOptions options;

  public ProguardClassRulesSource(List<ProguardKeepRule> rules, InternalOptions options) {
    this.options = options;
    ImmutableList.Builder<ClassDescriptorMatcher> builder = ImmutableList.builder();
    for (ProguardKeepRule rule : rules) {
      if (isApplicable(rule)) {
        ClassDescriptorMatcher matcher =
            ClassDescriptorMatcher.forJavaTypePattern(rule.getClassName());
        options.trace("keep rule pattern: " + matcher);
        builder.add(matcher);
      }
    }
    this.matchers = builder.build();
  }

  static boolean isApplicable(ProguardKeepRule rule) {
    String className = rule.getClassName();
    return className != null
        && rule.getClassType().isClassOrInterface()
        && className.length() > MINIMUM_CLASS_NAME_LENGTH
        && !ClassDescriptorMatcher.hasWildcards(className);
  }

  public List<ClassDescriptorMatcher> getMatchers() {
    return matchers;
  }

  @Override
  public String getName() {
    return "keep_rules";
  }

  @Override
  public int evaluate(ReachabilityMarker marker, ExecutorService executorService)
      throws ExecutionException {
    if (matchers.isEmpty()) {
      return 0;
    }
    AtomicInteger markedClasses = new AtomicInteger();
    ThreadUtils.processItems(
        marker.getApplication().classes(),
        clazz -> {
          if (keepIfMatched(clazz, marker)) {
            markedClasses.incrementAndGet();
          }
        },
        executorService);
    options.trace("matched on " + markedClasses.get() + " classes with class keep rules");
    return markedClasses.get();
  }

  private boolean keepIfMatched(DexProgramClass clazz, ReachabilityMarker marker) {
    String descriptor = clazz.getType().getDescriptor();
    int descriptorLength = descriptor.length();
    for (ClassDescriptorMatcher matcher : matchers) {
      String pattern = matcher.getPattern();
      if (ClassDescriptorMatcher.typeMatches(
          pattern, descriptor, pattern.length(), descriptorLength)) {
        options.trace("matched class " + descriptor + " against pattern " + pattern);
        marker.markDirectly(clazz);
        return true;
      }
    }
    return false;
  }
}
