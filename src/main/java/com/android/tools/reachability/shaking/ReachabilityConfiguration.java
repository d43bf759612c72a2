// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The configuration of the reachability analysis, as read from the JSON pass configuration.
 *
 * <pre>
 * {
 *   "apk_dir": "/tmp/unpacked-apk",
 *   "keep_packages": ["Lcom/example/reflected/"],
 *   "keep_annotations": ["Lcom/example/DoNotStrip;"],
 *   "keep_class_members": ["Lcom/example/Constants;SOME_FIELD"],
 *   "keep_methods": ["onCreate"]
 * }
 * </pre>
 *
 * <p>All keys are optional.
 */
public class ReachabilityConfiguration {

  private static final Gson GSON =
      new GsonBuilder().excludeFieldsWithoutExposeAnnotation().create();

  @Expose
  @SerializedName("apk_dir")
  private String apkDir;

  @Expose
  @SerializedName("keep_packages")
  private List<String> keepPackages;

  @Expose
  @SerializedName("keep_annotations")
  private List<String> keepAnnotations;

  @Expose
  @SerializedName("keep_class_members")
  private List<String> keepClassMembers;

  @Expose
  @SerializedName("keep_methods")
  private List<String> keepMethods;

  // Used by Gson.
  private ReachabilityConfiguration() {}

  private ReachabilityConfiguration(Builder builder) {
    this.apkDir = builder.apkDir;
    this.keepPackages = builder.keepPackages.build();
    this.keepAnnotations = builder.keepAnnotations.build();
    this.keepClassMembers = builder.keepClassMembers.build();
    this.keepMethods = builder.keepMethods.build();
  }

  public static ReachabilityConfiguration empty() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Parses a configuration from JSON.
   *
   * @throws JsonParseException if the JSON is malformed, or a key has the wrong type or a null
   *     entry.
   */
  public static ReachabilityConfiguration fromJson(String json) {
    return normalize(GSON.fromJson(json, ReachabilityConfiguration.class));
  }

  public static ReachabilityConfiguration fromJson(Reader reader) {
    return normalize(GSON.fromJson(reader, ReachabilityConfiguration.class));
  }

  public static ReachabilityConfiguration fromJson(JsonElement json) {
    return normalize(GSON.fromJson(json, ReachabilityConfiguration.class));
  }

  public static ReachabilityConfiguration fromFile(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return fromJson(reader);
    }
  }

  private static ReachabilityConfiguration normalize(ReachabilityConfiguration configuration) {
    if (configuration == null) {
      return empty();
    }
    return builder()
        .setApkDir(configuration.apkDir)
        .addKeepPackages(checkEntries("keep_packages", configuration.keepPackages))
        .addKeepAnnotations(checkEntries("keep_annotations", configuration.keepAnnotations))
        .addKeepClassMembers(checkEntries("keep_class_members", configuration.keepClassMembers))
        .addKeepMethods(checkEntries("keep_methods", configuration.keepMethods))
        .build();
  }

  private static List<String> checkEntries(String key, List<String> list) {
    if (list == null) {
      return ImmutableList.of();
    }
    for (String entry : list) {
      if (entry == null) {
        throw new JsonParseException("Unexpected null entry in " + key);
      }
    }
    return list;
  }

  public String toJson() {
    return GSON.toJson(this);
  }

  public boolean hasApkDir() {
    return apkDir != null && !apkDir.isEmpty();
  }

  /** The directory of the unpacked application, or null if no directory was configured. */
  public Path getApkDir() {
    return hasApkDir() ? Path.of(apkDir) : null;
  }

  public List<String> getKeepPackages() {
    return keepPackages;
  }

  public List<String> getKeepAnnotations() {
    return keepAnnotations;
  }

  public List<String> getKeepClassMembers() {
    return keepClassMembers;
  }

  public List<String> getKeepMethods() {
    return keepMethods;
  }

  public static class Builder {

    private String apkDir;
    private final ImmutableList.Builder<String> keepPackages = ImmutableList.builder();
    private final ImmutableList.Builder<String> keepAnnotations = ImmutableList.builder();
    private final ImmutableList.Builder<String> keepClassMembers = ImmutableList.builder();
    private final ImmutableList.Builder<String> keepMethods = ImmutableList.builder();

    private Builder() {}

    public Builder setApkDir(String apkDir) {
      this.apkDir = apkDir;
      return this;
    }

    public Builder addKeepPackages(Iterable<String> packages) {
      keepPackages.addAll(packages);
      return this;
    }

    public Builder addKeepPackages(String... packages) {
      keepPackages.add(packages);
      return this;
    }

    public Builder addKeepAnnotations(Iterable<String> annotations) {
      keepAnnotations.addAll(annotations);
      return this;
    }

    public Builder addKeepAnnotations(String... annotations) {
      keepAnnotations.add(annotations);
      return this;
    }

    public Builder addKeepClassMembers(Iterable<String> classMembers) {
      keepClassMembers.addAll(classMembers);
      return this;
    }

    public Builder addKeepClassMembers(String... classMembers) {
      keepClassMembers.add(classMembers);
      return this;
    }

    public Builder addKeepMethods(Iterable<String> methods) {
      keepMethods.addAll(methods);
      return this;
    }

    public Builder addKeepMethods(String... methods) {
      keepMethods.add(methods);
      return this;
    }

    public ReachabilityConfiguration build() {
      return new ReachabilityConfiguration(this);
    }
  }
}
