package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;

/**
 * Type-specific configuration of a dynamic field. There is exactly one variant per {@link
 * FieldType}; {@link #fieldType()} names it, and code that needs the variant's attributes switches
 * on that enum so every type is handled.
 */
public sealed interface FieldConfig
    permits TextConfig,
        TextAreaConfig,
        CheckboxConfig,
        OptionsConfig,
        DateRangeConfig {

  FieldType fieldType();

  /** Default value pre-filled on forms; never null, empty when unset. */
  String defaultValue();

  /** Returns a copy of this config with the given default value. */
  FieldConfig withDefaultValue(String defaultValue);

  static String normalize(String value) {
    return value == null ? "" : value;
  }
}
