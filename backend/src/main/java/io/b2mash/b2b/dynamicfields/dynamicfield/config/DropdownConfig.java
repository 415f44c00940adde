package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import java.util.Map;

public record DropdownConfig(
    String defaultValue,
    Map<String, String> possibleValues,
    boolean possibleNone,
    boolean translatableValues,
    boolean treeView)
    implements OptionsConfig {

  public DropdownConfig {
    defaultValue = FieldConfig.normalize(defaultValue);
    possibleValues = OptionsConfig.copyOf(possibleValues);
  }

  public static DropdownConfig of(Map<String, String> possibleValues) {
    return new DropdownConfig("", possibleValues, false, false, false);
  }

  @Override
  public FieldType fieldType() {
    return FieldType.DROPDOWN;
  }

  @Override
  public DropdownConfig withDefaultValue(String defaultValue) {
    return new DropdownConfig(
        defaultValue, possibleValues, possibleNone, translatableValues, treeView);
  }
}
