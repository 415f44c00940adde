package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;

public record CheckboxConfig(String defaultValue) implements FieldConfig {

  public CheckboxConfig {
    defaultValue = FieldConfig.normalize(defaultValue);
  }

  @Override
  public FieldType fieldType() {
    return FieldType.CHECKBOX;
  }

  @Override
  public CheckboxConfig withDefaultValue(String defaultValue) {
    return new CheckboxConfig(defaultValue);
  }
}
