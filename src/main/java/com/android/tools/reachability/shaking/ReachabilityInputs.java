// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/** Inputs to the reachability analysis that are produced outside of the analysis. */
public class ReachabilityInputs {

  private final ClassNameExtractor manifestClassNameExtractor;
  private final ClassNameExtractor layoutClassNameExtractor;
  private final ClassNameExtractor nativeLibraryClassNameExtractor;
  private final List<ProguardKeepRule> keepRules;
  private final Set<String> noOptimizationAnnotations;
  private final Path seedsFile;

  private ReachabilityInputs(Builder builder) {
    this.manifestClassNameExtractor = builder.manifestClassNameExtractor;
    this.layoutClassNameExtractor = builder.layoutClassNameExtractor;
    this.nativeLibraryClassNameExtractor = builder.nativeLibraryClassNameExtractor;
    this.keepRules = builder.keepRules.build();
    this.noOptimizationAnnotations = builder.noOptimizationAnnotations.build();
    this.seedsFile = builder.seedsFile;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ClassNameExtractor getManifestClassNameExtractor() {
    return manifestClassNameExtractor;
  }

  public ClassNameExtractor getLayoutClassNameExtractor() {
    return layoutClassNameExtractor;
  }

  public ClassNameExtractor getNativeLibraryClassNameExtractor() {
    return nativeLibraryClassNameExtractor;
  }

  public List<ProguardKeepRule> getKeepRules() {
    return keepRules;
  }

  /** Annotation descriptors that are kept in addition to the configured keep annotations. */
  public Set<String> getNoOptimizationAnnotations() {
    return noOptimizationAnnotations;
  }

  public boolean hasSeedsFile() {
    return seedsFile != null;
  }

  public Path getSeedsFile() {
    return seedsFile;
  }

  public static class Builder {

    private ClassNameExtractor manifestClassNameExtractor = ClassNameExtractor.empty();
    private ClassNameExtractor layoutClassNameExtractor = ClassNameExtractor.empty();
    private ClassNameExtractor nativeLibraryClassNameExtractor = ClassNameExtractor.empty();
    private final ImmutableList.Builder<ProguardKeepRule> keepRules = ImmutableList.builder();
    private final ImmutableSet.Builder<String> noOptimizationAnnotations = ImmutableSet.builder();
    private Path seedsFile;

    private Builder() {}

    public Builder setManifestClassNameExtractor(ClassNameExtractor extractor) {
      this.manifestClassNameExtractor = extractor;
      return this;
    }

    public Builder setLayoutClassNameExtractor(ClassNameExtractor extractor) {
      this.layoutClassNameExtractor = extractor;
      return this;
    }

    public Builder setNativeLibraryClassNameExtractor(ClassNameExtractor extractor) {
      this.nativeLibraryClassNameExtractor = extractor;
      return this;
    }

    public Builder addKeepRules(Iterable<ProguardKeepRule> rules) {
      keepRules.addAll(rules);
      return this;
    }

    public Builder addKeepRule(ProguardKeepRule rule) {
      keepRules.add(rule);
      return this;
    }

    public Builder addNoOptimizationAnnotation(String annotationDescriptor) {
      noOptimizationAnnotations.add(annotationDescriptor);
      return this;
    }

    public Builder setSeedsFile(Path seedsFile) {
      this.seedsFile = seedsFile;
      return this;
    }

    public ReachabilityInputs build() {
      return new ReachabilityInputs(this);
    }
  }
}
