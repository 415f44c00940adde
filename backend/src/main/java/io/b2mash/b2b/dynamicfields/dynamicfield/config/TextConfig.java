package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import java.util.List;

public record TextConfig(
    String defaultValue, int maxLength, List<RegexRule> regexList, String link, String linkPreview)
    implements FieldConfig {

  public TextConfig {
    defaultValue = FieldConfig.normalize(defaultValue);
    regexList = regexList == null ? List.of() : List.copyOf(regexList);
    link = FieldConfig.normalize(link);
    linkPreview = FieldConfig.normalize(linkPreview);
  }

  @Override
  public FieldType fieldType() {
    return FieldType.TEXT;
  }

  @Override
  public TextConfig withDefaultValue(String defaultValue) {
    return new TextConfig(defaultValue, maxLength, regexList, link, linkPreview);
  }
}
