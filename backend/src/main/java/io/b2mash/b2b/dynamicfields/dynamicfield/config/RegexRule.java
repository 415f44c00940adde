package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A validation pattern applied to Text/TextArea input, with the message shown on mismatch. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RegexRule(
    @JsonProperty("Value") String value, @JsonProperty("ErrorMessage") String errorMessage) {

  public RegexRule {
    value = FieldConfig.normalize(value);
    errorMessage = FieldConfig.normalize(errorMessage);
  }
}
