package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import java.util.List;

public record TextAreaConfig(
    String defaultValue, int maxLength, List<RegexRule> regexList, int rows, int cols)
    implements FieldConfig {

  public TextAreaConfig {
    defaultValue = FieldConfig.normalize(defaultValue);
    regexList = regexList == null ? List.of() : List.copyOf(regexList);
  }

  @Override
  public FieldType fieldType() {
    return FieldType.TEXT_AREA;
  }

  @Override
  public TextAreaConfig withDefaultValue(String defaultValue) {
    return new TextAreaConfig(defaultValue, maxLength, regexList, rows, cols);
  }
}
