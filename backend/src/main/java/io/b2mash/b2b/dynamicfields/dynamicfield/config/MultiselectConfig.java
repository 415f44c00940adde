package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import java.util.Map;

public record MultiselectConfig(
    String defaultValue,
    Map<String, String> possibleValues,
    boolean possibleNone,
    boolean translatableValues,
    boolean treeView)
    implements OptionsConfig {

  public MultiselectConfig {
    defaultValue = FieldConfig.normalize(defaultValue);
    possibleValues = OptionsConfig.copyOf(possibleValues);
  }

  public static MultiselectConfig of(Map<String, String> possibleValues) {
    return new MultiselectConfig("", possibleValues, false, false, false);
  }

  @Override
  public FieldType fieldType() {
    return FieldType.MULTISELECT;
  }

  @Override
  public MultiselectConfig withDefaultValue(String defaultValue) {
    return new MultiselectConfig(
        defaultValue, possibleValues, possibleNone, translatableValues, treeView);
  }
}
