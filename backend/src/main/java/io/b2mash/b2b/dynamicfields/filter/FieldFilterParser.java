package io.b2mash.b2b.dynamicfields.filter;

import io.b2mash.b2b.dynamicfields.config.DynamicFieldProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Reads dynamic field filters from query parameters of the form {@code df_Name=value} or
 * {@code df_Name_op=value}. Keys are processed in sorted order so alias numbering is stable.
 */
@Component
public class FieldFilterParser {

  private final String prefix;

  public FieldFilterParser(DynamicFieldProperties properties) {
    this.prefix = properties.filterParamPrefix();
  }

  public List<FieldFilter> parse(Map<String, List<String>> queryParams) {
    var filters = new ArrayList<FieldFilter>();
    for (var entry : new TreeMap<>(queryParams).entrySet()) {
      var key = entry.getKey();
      var values = entry.getValue();
      if (!key.startsWith(prefix) || values == null || values.isEmpty()) {
        continue;
      }
      var value = values.get(0);
      if (value == null || value.isEmpty()) {
        continue;
      }
      filters.add(toFilter(key.substring(prefix.length()), value));
    }
    return filters;
  }

  /** The longest operator suffix wins, so {@code _notempty} beats {@code _empty}. */
  private static FieldFilter toFilter(String remainder, String value) {
    FilterOperator matched = null;
    for (var operator : FilterOperator.values()) {
      var suffix = operator.suffix();
      if (remainder.endsWith(suffix)
          && remainder.length() > suffix.length()
          && (matched == null || suffix.length() > matched.suffix().length())) {
        matched = operator;
      }
    }
    if (matched == null) {
      return FieldFilter.byName(remainder, FilterOperator.EQ, value);
    }
    var name = remainder.substring(0, remainder.length() - matched.suffix().length());
    return FieldFilter.byName(name, matched, value);
  }
}
