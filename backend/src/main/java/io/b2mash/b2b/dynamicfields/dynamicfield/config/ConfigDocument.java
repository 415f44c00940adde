package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Flat wire shape of a field config, keyed the way OTRS stores {@code dynamic_field.config}.
 * Absent attributes are omitted and flags are written as 0/1. The same shape is used in REST
 * requests and import bundles so an exported config can be pasted back unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConfigDocument(
    @JsonProperty("DefaultValue") String defaultValue,
    @JsonProperty("MaxLength") Integer maxLength,
    @JsonProperty("RegExList") List<RegexRule> regexList,
    @JsonProperty("Link") String link,
    @JsonProperty("LinkPreview") String linkPreview,
    @JsonProperty("Rows") Integer rows,
    @JsonProperty("Cols") Integer cols,
    @JsonProperty("PossibleValues") Map<String, String> possibleValues,
    @JsonProperty("PossibleNone") Integer possibleNone,
    @JsonProperty("TranslatableValues") Integer translatableValues,
    @JsonProperty("TreeView") Integer treeView,
    @JsonProperty("YearsInPast") Integer yearsInPast,
    @JsonProperty("YearsInFuture") Integer yearsInFuture,
    @JsonProperty("YearsPeriod") Integer yearsPeriod,
    @JsonProperty("DateRestriction") String dateRestriction) {

  public static ConfigDocument empty() {
    return new ConfigDocument(
        null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
  }
}
