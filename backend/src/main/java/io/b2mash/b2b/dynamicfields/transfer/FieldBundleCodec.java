package io.b2mash.b2b.dynamicfields.transfer;

import io.b2mash.b2b.dynamicfields.exception.DocumentParseException;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.dataformat.yaml.YAMLMapper;

/** YAML encoding of {@link FieldBundle}. */
@Component
public class FieldBundleCodec {

  private final YAMLMapper yamlMapper = new YAMLMapper();

  public String write(FieldBundle bundle) {
    try {
      return yamlMapper.writeValueAsString(bundle);
    } catch (JacksonException e) {
      throw new DocumentParseException(
          "Bundle not serializable", "Could not encode dynamic field export", e);
    }
  }

  public FieldBundle read(String yaml) {
    if (yaml == null || yaml.isBlank()) {
      throw new DocumentParseException("Empty bundle", "The import document is empty", null);
    }
    FieldBundle bundle;
    try {
      bundle = yamlMapper.readValue(yaml, FieldBundle.class);
    } catch (JacksonException e) {
      throw new DocumentParseException(
          "Malformed bundle", "Import document is not valid YAML: " + e.getOriginalMessage(), e);
    }
    if (bundle == null) {
      throw new DocumentParseException("Empty bundle", "The import document is empty", null);
    }
    for (var entry : bundle.dynamicFields()) {
      if (entry == null || entry.name() == null || entry.name().isBlank()) {
        throw new DocumentParseException(
            "Malformed bundle", "Every DynamicFields entry needs a Name", null);
      }
    }
    for (var screen : bundle.screens()) {
      if (screen == null || screen.fieldName() == null || screen.screenKey() == null) {
        throw new DocumentParseException(
            "Malformed bundle",
            "Every DynamicFieldScreens entry needs FieldName and ScreenKey",
            null);
      }
    }
    return bundle;
  }
}
