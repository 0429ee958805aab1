// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.Objects;

import static io.github.simbo1905.module.loader.ModuleLoader.LOGGER;

/// Default [InstanceBuilder]. The strategy is taken from the descriptor:
/// - [TypeDescriptor.Construction.CustomRestoration]: the state is reconciled against the method's declared
///   parameter type, the method runs with graph optimization suspended, then the instance is validated.
/// - [TypeDescriptor.Construction.FieldAssignment]: the state is a dict keyed by attribute name and each
///   declared attribute is copied into its slot in declaration order.
final class ObjectConstructor implements InstanceBuilder {
  private final String archiveName;

  ObjectConstructor(String archiveName) {
    this.archiveName = Objects.requireNonNull(archiveName, "archiveName must not be null");
  }

  @Override
  public ObjectInstance allocate(TypeDescriptor type) {
    Objects.requireNonNull(type, "type must not be null");
    return new ObjectInstance(type);
  }

  @Override
  public void restore(ObjectInstance instance, TaggedValue state) {
    Objects.requireNonNull(instance, "instance must not be null");
    Objects.requireNonNull(state, "state must not be null");
    final var construction = instance.type().construction();
    if (construction instanceof TypeDescriptor.Construction.CustomRestoration custom) {
      restoreWithMethod(instance, state, custom.method());
    } else {
      assignFields(instance, state);
    }
  }

  private void restoreWithMethod(ObjectInstance instance, TaggedValue state, RestorationMethod method) {
    final var typeName = instance.type().qualifiedName();
    LOGGER.fine(() -> "Restoring " + typeName + " with its restoration method");
    // containers decoded so far may still report Any elements; the method relies on its declared type
    TypeTagReconciler.reconcile(typeName, state, method.stateType());
    try (var ignored = GraphOptimization.suspend()) {
      method.restore(instance, state);
    }
    PostRestoreValidator.validate(instance);
  }

  private void assignFields(ObjectInstance instance, TaggedValue state) {
    final var type = instance.type();
    if (!(state instanceof TaggedValue.Mapping mapping)) {
      throw new MalformedArchiveException(archiveName,
          "state of " + type.qualifiedName() + " must be a Dict of attributes but was " + state.variantName());
    }
    final var attributes = type.attributes();
    for (int i = 0; i < attributes.size(); i++) {
      final var name = attributes.get(i).name();
      final var value = mapping.get(name);
      if (value == null) {
        throw new MissingAttributeException(type.qualifiedName(), name);
      }
      instance.setSlot(i, value);
    }
    LOGGER.finer(() -> "Assigned " + attributes.size() + " attributes of " + type.qualifiedName());
  }
}
