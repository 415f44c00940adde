package io.b2mash.b2b.dynamicfields.dynamicfield;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.CheckboxConfig;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.DateConfig;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.DateTimeConfig;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.DropdownConfig;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.FieldConfig;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.MultiselectConfig;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.TextAreaConfig;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.TextConfig;
import io.b2mash.b2b.dynamicfields.exception.FieldValidationException;
import java.util.Arrays;
import java.util.List;

/** Supported dynamic field types. External names match the OTRS spelling used in exports. */
public enum FieldType {
  TEXT("Text", ValueColumn.TEXT, TextConfig.class),
  TEXT_AREA("TextArea", ValueColumn.TEXT, TextAreaConfig.class),
  CHECKBOX("Checkbox", ValueColumn.INTEGER, CheckboxConfig.class),
  DROPDOWN("Dropdown", ValueColumn.TEXT, DropdownConfig.class),
  MULTISELECT("Multiselect", ValueColumn.TEXT, MultiselectConfig.class),
  DATE("Date", ValueColumn.DATE, DateConfig.class),
  DATE_TIME("DateTime", ValueColumn.DATE, DateTimeConfig.class);

  private final String externalName;
  private final ValueColumn valueColumn;
  private final Class<? extends FieldConfig> configType;

  FieldType(String externalName, ValueColumn valueColumn, Class<? extends FieldConfig> configType) {
    this.externalName = externalName;
    this.valueColumn = valueColumn;
    this.configType = configType;
  }

  @JsonValue
  public String externalName() {
    return externalName;
  }

  public ValueColumn valueColumn() {
    return valueColumn;
  }

  public Class<? extends FieldConfig> configType() {
    return configType;
  }

  /** Dropdown and Multiselect need an explicit key to label mapping. */
  public boolean requiresPossibleValues() {
    return this == DROPDOWN || this == MULTISELECT;
  }

  public boolean supportsAutoConfig() {
    return !requiresPossibleValues();
  }

  public static List<String> externalNames() {
    return Arrays.stream(values()).map(FieldType::externalName).toList();
  }

  /** Resolves "TextArea" as well as "TEXT_AREA"; anything else is a validation failure. */
  @JsonCreator
  public static FieldType fromExternalName(String name) {
    if (name != null) {
      for (var type : values()) {
        if (type.externalName.equals(name) || type.name().equalsIgnoreCase(name)) {
          return type;
        }
      }
    }
    throw new FieldValidationException(
        "fieldType", "Invalid field type: " + name + ". Expected one of " + externalNames());
  }
}
