// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.shaking;

import com.android.tools.reachability.graph.DexApplication;
import com.android.tools.reachability.graph.DexDefinition;
import com.android.tools.reachability.graph.DexProgramClass;
import com.android.tools.reachability.graph.DexType;
import com.android.tools.reachability.utils.DescriptorUtils;
import com.android.tools.reachability.utils.InternalOptions;

/**
 * Applies reachability marks to classes, methods and fields.
 *
 * <p>Marking a class directly or by name also marks the members selected by the {@link
 * MemberCascadePolicy}. Marking by seed never cascades: a seed keeps the identity of the class,
 * not its members.
 *
 * <p>Operations that take a type or a name first resolve it against the application. A type or
 * name that does not denote a program class, e.g., a library class, is ignored.
 */
public class ReachabilityMarker {

  private final DexApplication application;
  private final ReachabilityStateCollection states;
  private final MemberCascadePolicy cascadePolicy;

  public ReachabilityMarker(ReachabilityStateCollection states, InternalOptions options) {
    this(states, options.getMemberCascadePolicy());
  }

  public ReachabilityMarker(
      ReachabilityStateCollection states, MemberCascadePolicy cascadePolicy) {
    this.application = states.getApplication();
    this.states = states;
    this.cascadePolicy = cascadePolicy;
  }

  public DexApplication getApplication() {
    return application;
  }

  public ReachabilityStateCollection getStates() {
    return states;
  }

  /**
   * Class is used directly in code, as opposed to used via reflection.
   *
   * <p>For example, it could be used by one of these instructions: check-cast, new-instance,
   * const-class, instance-of.
   */
  public void markDirectly(DexProgramClass clazz) {
    ReachabilityState classState = states.get(clazz);
    synchronized (classState.getLock()) {
      classState.markTypeReferenced();
      cascadePolicy.forEachCascadedMember(
          clazz, member -> states.get(member).markTypeReferenced());
    }
  }

  public boolean markDirectly(DexType type) {
    DexProgramClass clazz = application.definitionFor(type);
    if (clazz == null) {
      return false;
    }
    markDirectly(clazz);
    return true;
  }

  /** Marks exactly the given class, method or field as used directly, without any cascade. */
  public void markOnlyDirectly(DexDefinition definition) {
    ReachabilityState state = states.get(definition);
    synchronized (state.getLock()) {
      state.markTypeReferenced();
    }
  }

  /**
   * Indicates that a class is being used via reflection.
   *
   * <p>If {@code fromCode} is true, it's used from the program's code, otherwise it is used by an
   * XML file or from native code.
   *
   * <p>Examples:
   *
   * <pre>
   *   Bar.java: (fromCode = true, directly created via reflection)
   *     Object x = Class.forName("com.example.Foo").newInstance();
   *
   *   my_layout.xml: (fromCode = false, created when the view is inflated)
   *     &lt;com.example.MyView /&gt;
   * </pre>
   */
  public void markByName(DexProgramClass clazz, boolean fromCode) {
    ReachabilityState classState = states.get(clazz);
    synchronized (classState.getLock()) {
      classState.markStringReferenced(fromCode);
      cascadePolicy.forEachCascadedMember(
          clazz, member -> states.get(member).markStringReferenced(fromCode));
    }
  }

  public boolean markByName(DexType type, boolean fromCode) {
    DexProgramClass clazz = application.definitionFor(type);
    if (clazz == null) {
      return false;
    }
    markByName(clazz, fromCode);
    return true;
  }

  /**
   * Marks the class with the given name as used via reflection.
   *
   * @param className a class descriptor, e.g., {@code Lcom/example/Foo;}, or a Java class name.
   * @return true if the name denotes a program class.
   */
  public boolean markByClassName(String className, boolean fromCode) {
    DexProgramClass clazz =
        application.definitionForDescriptor(DescriptorUtils.toClassDescriptor(className));
    if (clazz == null) {
      return false;
    }
    markByName(clazz, fromCode);
    return true;
  }

  /** Marks exactly the given class, method or field as referenced by name, without any cascade. */
  public void markOnlyByName(DexDefinition definition, boolean fromCode) {
    ReachabilityState state = states.get(definition);
    synchronized (state.getLock()) {
      state.markStringReferenced(fromCode);
    }
  }

  public void markBySeed(DexProgramClass clazz) {
    ReachabilityState state = states.get(clazz);
    synchronized (state.getLock()) {
      state.markSeedReferenced();
    }
  }

  public boolean markBySeed(DexType type) {
    DexProgramClass clazz = application.definitionFor(type);
    if (clazz == null) {
      return false;
    }
    markBySeed(clazz);
    return true;
  }
}
