package io.b2mash.b2b.dynamicfields.dynamicfield;

import io.b2mash.b2b.dynamicfields.dynamicfield.config.FieldConfig;

/**
 * Input for creating or updating a field. {@code config} may be null, in which case the zero
 * config of the type is used; with {@code autoConfig} set, type defaults replace it for the types
 * that support auto-config.
 */
public record DynamicFieldCommand(
    String name,
    String label,
    int fieldOrder,
    FieldType fieldType,
    ObjectType objectType,
    FieldConfig config,
    boolean valid,
    boolean internal,
    boolean autoConfig) {

  public static DynamicFieldCommand of(
      String name, String label, FieldType fieldType, ObjectType objectType, FieldConfig config) {
    return new DynamicFieldCommand(
        name, label, 1, fieldType, objectType, config, true, false, false);
  }
}
