package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.exception.DocumentParseException;
import io.b2mash.b2b.dynamicfields.exception.FieldValidationException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.dataformat.yaml.YAMLMapper;

/**
 * Encodes field configs to the YAML blob stored in {@code dynamic_field.config} and back.
 *
 * <p>An empty blob decodes to the zero-valued variant of the field type, so fields created
 * without a config (or by older tooling) still load.
 */
@Component
public class FieldConfigCodec {

  private static final byte[] EMPTY = new byte[0];

  private final YAMLMapper yamlMapper = new YAMLMapper();

  public byte[] serialize(FieldConfig config) {
    if (config == null) {
      return EMPTY;
    }
    try {
      return yamlMapper.writeValueAsBytes(toDocument(config));
    } catch (JacksonException e) {
      throw new DocumentParseException(
          "Config not serializable",
          "Could not encode " + config.fieldType().externalName() + " config",
          e);
    }
  }

  public FieldConfig parse(FieldType type, byte[] blob) {
    if (blob == null || new String(blob, StandardCharsets.UTF_8).isBlank()) {
      return FieldConfigs.empty(type);
    }
    ConfigDocument document;
    try {
      document = yamlMapper.readValue(blob, ConfigDocument.class);
    } catch (JacksonException e) {
      throw new DocumentParseException(
          "Malformed field config",
          "Stored " + type.externalName() + " config is not valid YAML: " + e.getOriginalMessage(),
          e);
    }
    return fromDocument(type, document);
  }

  /** Flattens a variant into its wire shape, dropping zero values. */
  public ConfigDocument toDocument(FieldConfig config) {
    if (config == null) {
      return ConfigDocument.empty();
    }
    return switch (config.fieldType()) {
      case TEXT -> {
        var text = (TextConfig) config;
        yield new ConfigDocument(
            text.defaultValue(),
            positive(text.maxLength()),
            text.regexList(),
            text.link(),
            text.linkPreview(),
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null);
      }
      case TEXT_AREA -> {
        var area = (TextAreaConfig) config;
        yield new ConfigDocument(
            area.defaultValue(),
            positive(area.maxLength()),
            area.regexList(),
            null,
            null,
            positive(area.rows()),
            positive(area.cols()),
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null);
      }
      case CHECKBOX ->
          new ConfigDocument(
              config.defaultValue(),
              null,
              null,
              null,
              null,
              null,
              null,
              null,
              null,
              null,
              null,
              null,
              null,
              null,
              null);
      case DROPDOWN, MULTISELECT -> {
        var options = (OptionsConfig) config;
        yield new ConfigDocument(
            options.defaultValue(),
            null,
            null,
            null,
            null,
            null,
            null,
            options.possibleValues(),
            flag(options.possibleNone()),
            flag(options.translatableValues()),
            flag(options.treeView()),
            null,
            null,
            null,
            null);
      }
      case DATE, DATE_TIME -> {
        var range = (DateRangeConfig) config;
        yield new ConfigDocument(
            range.defaultValue(),
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            positive(range.yearsInPast()),
            positive(range.yearsInFuture()),
            positive(range.yearsPeriod()),
            range.dateRestriction() == DateRestriction.NONE
                ? null
                : range.dateRestriction().externalName());
      }
    };
  }

  /** Builds the variant for {@code type}; attributes that do not belong to the type are ignored. */
  public FieldConfig fromDocument(FieldType type, ConfigDocument document) {
    if (type == null) {
      throw new FieldValidationException("fieldType", "Field type is required");
    }
    if (document == null) {
      return FieldConfigs.empty(type);
    }
    return switch (type) {
      case TEXT ->
          new TextConfig(
              document.defaultValue(),
              intValue(document.maxLength()),
              document.regexList(),
              document.link(),
              document.linkPreview());
      case TEXT_AREA ->
          new TextAreaConfig(
              document.defaultValue(),
              intValue(document.maxLength()),
              document.regexList(),
              intValue(document.rows()),
              intValue(document.cols()));
      case CHECKBOX -> new CheckboxConfig(document.defaultValue());
      case DROPDOWN ->
          new DropdownConfig(
              document.defaultValue(),
              possibleValues(document.possibleValues()),
              intValue(document.possibleNone()) == 1,
              intValue(document.translatableValues()) == 1,
              intValue(document.treeView()) == 1);
      case MULTISELECT ->
          new MultiselectConfig(
              document.defaultValue(),
              possibleValues(document.possibleValues()),
              intValue(document.possibleNone()) == 1,
              intValue(document.translatableValues()) == 1,
              intValue(document.treeView()) == 1);
      case DATE ->
          new DateConfig(
              document.defaultValue(),
              intValue(document.yearsInPast()),
              intValue(document.yearsInFuture()),
              intValue(document.yearsPeriod()),
              DateRestriction.fromExternalName(document.dateRestriction()));
      case DATE_TIME ->
          new DateTimeConfig(
              document.defaultValue(),
              intValue(document.yearsInPast()),
              intValue(document.yearsInFuture()),
              intValue(document.yearsPeriod()),
              DateRestriction.fromExternalName(document.dateRestriction()));
    };
  }

  private static Map<String, String> possibleValues(Map<String, String> values) {
    return values == null ? Map.of() : values;
  }

  private static Integer positive(int value) {
    return value > 0 ? value : null;
  }

  private static Integer flag(boolean value) {
    return value ? 1 : null;
  }

  private static int intValue(Integer value) {
    return value == null ? 0 : value;
  }
}
