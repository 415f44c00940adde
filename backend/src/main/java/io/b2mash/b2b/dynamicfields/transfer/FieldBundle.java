package io.b2mash.b2b.dynamicfields.transfer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.ConfigDocument;
import java.util.List;

/**
 * Portable export of field definitions and, optionally, their screen placement. Types are kept
 * as strings so one unknown type fails only its own entry on import.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldBundle(
    @JsonProperty("DynamicFields") List<FieldEntry> dynamicFields,
    @JsonProperty("DynamicFieldScreens") List<ScreenEntry> screens) {

  public FieldBundle {
    dynamicFields = dynamicFields == null ? List.of() : List.copyOf(dynamicFields);
    screens = screens == null ? List.of() : List.copyOf(screens);
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record FieldEntry(
      @JsonProperty("Name") String name,
      @JsonProperty("Label") String label,
      @JsonProperty("FieldOrder") Integer fieldOrder,
      @JsonProperty("FieldType") String fieldType,
      @JsonProperty("ObjectType") String objectType,
      @JsonProperty("Valid") Boolean valid,
      @JsonProperty("Config") ConfigDocument config) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ScreenEntry(
      @JsonProperty("FieldName") String fieldName,
      @JsonProperty("ScreenKey") String screenKey,
      @JsonProperty("Level") Integer level) {}

  public boolean hasScreensFor(String fieldName) {
    return screens.stream().anyMatch(screen -> screen.fieldName().equals(fieldName));
  }
}
