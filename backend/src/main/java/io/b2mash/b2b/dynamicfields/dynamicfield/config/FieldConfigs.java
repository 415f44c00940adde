package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import java.util.List;

/** Factory for the zero-valued and auto-configured variant of each field type. */
public final class FieldConfigs {

  private FieldConfigs() {}

  /** The variant a blank config blob decodes to. */
  public static FieldConfig empty(FieldType type) {
    return switch (type) {
      case TEXT -> new TextConfig("", 0, List.of(), "", "");
      case TEXT_AREA -> new TextAreaConfig("", 0, List.of(), 0, 0);
      case CHECKBOX -> new CheckboxConfig("");
      case DROPDOWN -> DropdownConfig.of(null);
      case MULTISELECT -> MultiselectConfig.of(null);
      case DATE -> new DateConfig("", 0, 0, 0, DateRestriction.NONE);
      case DATE_TIME -> new DateTimeConfig("", 0, 0, 0, DateRestriction.NONE);
    };
  }

  /**
   * Sensible defaults used when an administrator opts into auto-config. Dropdown and Multiselect
   * have no meaningful default and come back empty; callers check {@link
   * FieldType#supportsAutoConfig()} first.
   */
  public static FieldConfig autoDefaults(FieldType type) {
    return switch (type) {
      case TEXT -> new TextConfig("", 200, List.of(), "", "");
      case TEXT_AREA -> new TextAreaConfig("", 0, List.of(), 4, 60);
      case CHECKBOX -> new CheckboxConfig("0");
      case DATE -> new DateConfig("", 5, 5, 0, DateRestriction.NONE);
      case DATE_TIME -> new DateTimeConfig("", 5, 5, 0, DateRestriction.NONE);
      case DROPDOWN, MULTISELECT -> empty(type);
    };
  }
}
