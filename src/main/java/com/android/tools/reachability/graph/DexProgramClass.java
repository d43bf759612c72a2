// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

public class DexProgramClass extends DexDefinition {

  private final DexType type;
  private final DexType superType;

  private final List<DexEncodedMethod> directMethods = new ArrayList<>();
  private final List<DexEncodedMethod> virtualMethods = new ArrayList<>();
  private final List<DexEncodedField> staticFields = new ArrayList<>();
  private final List<DexEncodedField> instanceFields = new ArrayList<>();

  public DexProgramClass(
      DexType type, DexType superType, AccessFlags accessFlags, DexAnnotationSet annotations) {
    super(accessFlags, annotations);
    this.type = type;
    this.superType = superType;
  }

  public static Builder builder(DexItemFactory factory, String descriptor) {
    return new Builder(factory, factory.createType(descriptor));
  }

  public DexType getType() {
    return type;
  }

  /** The super type, or null for a class without a super class, e.g., java.lang.Object. */
  public DexType getSuperType() {
    return superType;
  }

  @Override
  public DexType getHolderType() {
    return type;
  }

  public List<DexEncodedMethod> directMethods() {
    return Collections.unmodifiableList(directMethods);
  }

  public List<DexEncodedMethod> virtualMethods() {
    return Collections.unmodifiableList(virtualMethods);
  }

  public List<DexEncodedField> staticFields() {
    return Collections.unmodifiableList(staticFields);
  }

  public List<DexEncodedField> instanceFields() {
    return Collections.unmodifiableList(instanceFields);
  }

  public void forEachMethod(Consumer<? super DexEncodedMethod> consumer) {
    directMethods.forEach(consumer);
    virtualMethods.forEach(consumer);
  }

  public void forEachField(Consumer<? super DexEncodedField> consumer) {
    staticFields.forEach(consumer);
    instanceFields.forEach(consumer);
  }

  public void forEachMember(Consumer<? super DexEncodedMember> consumer) {
    forEachMethod(consumer);
    forEachField(consumer);
  }

  public void addMethod(DexEncodedMethod method) {
    assert method.getHolderType().isIdenticalTo(type);
    if (method.isDirectMethod()) {
      directMethods.add(method);
    } else {
      virtualMethods.add(method);
    }
  }

  public boolean removeMethod(DexEncodedMethod method) {
    return directMethods.remove(method) || virtualMethods.remove(method);
  }

  public void addField(DexEncodedField field) {
    assert field.getHolderType().isIdenticalTo(type);
    if (field.isStatic()) {
      staticFields.add(field);
    } else {
      instanceFields.add(field);
    }
  }

  public boolean removeField(DexEncodedField field) {
    return staticFields.remove(field) || instanceFields.remove(field);
  }

  @Override
  public boolean isProgramClass() {
    return true;
  }

  @Override
  public DexProgramClass asProgramClass() {
    return this;
  }

  @Override
  public String toDescriptorString() {
    return type.getDescriptor();
  }

  public static class Builder {

    private final DexItemFactory factory;
    private final DexType type;
    private DexType superType;
    private AccessFlags accessFlags = AccessFlags.publicFlags();
    private final List<DexType> annotations = new ArrayList<>();
    private final List<MemberBuilder> members = new ArrayList<>();

    private Builder(DexItemFactory factory, DexType type) {
      this.factory = factory;
      this.type = type;
    }

    public Builder setSuperType(String superDescriptor) {
      this.superType = superDescriptor == null ? null : factory.createType(superDescriptor);
      return this;
    }

    public Builder setAccessFlags(int flags) {
      this.accessFlags = AccessFlags.fromFlags(flags);
      return this;
    }

    public Builder addAnnotation(String annotationDescriptor) {
      annotations.add(factory.createType(annotationDescriptor));
      return this;
    }

    public Builder addMethod(String name, String proto, int flags, String... annotations) {
      members.add(new MemberBuilder(true, name, proto, flags, annotations));
      return this;
    }

    public Builder addField(String name, String typeDescriptor, int flags, String... annotations) {
      members.add(new MemberBuilder(false, name, typeDescriptor, flags, annotations));
      return this;
    }

    public DexProgramClass build() {
      DexProgramClass clazz =
          new DexProgramClass(type, superType, accessFlags, DexAnnotationSet.create(annotations));
      for (MemberBuilder member : members) {
        List<DexType> memberAnnotations = new ArrayList<>(member.annotations.length);
        for (String annotation : member.annotations) {
          memberAnnotations.add(factory.createType(annotation));
        }
        DexAnnotationSet annotationSet = DexAnnotationSet.create(memberAnnotations);
        AccessFlags flags = AccessFlags.fromFlags(member.flags);
        if (member.isMethod) {
          clazz.addMethod(
              new DexEncodedMethod(type, member.name, member.signature, flags, annotationSet));
        } else {
          clazz.addField(
              new DexEncodedField(type, member.name, member.signature, flags, annotationSet));
        }
      }
      return clazz;
    }

    private static class MemberBuilder {

      final boolean isMethod;
      final String name;
      final String signature;
      final int flags;
      final String[] annotations;

      MemberBuilder(
          boolean isMethod, String name, String signature, int flags, String[] annotations) {
        this.isMethod = isMethod;
        this.name = name;
        this.signature = signature;
        this.flags = flags;
        this.annotations = annotations;
      }
    }
  }
}
