package io.b2mash.b2b.dynamicfields.filter;

import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldDefinition;
import java.util.List;
import java.util.Map;

/**
 * A ticket field offered in search forms. {@code options} holds {@code {key, value}} pairs in
 * possible-value order and is empty for non-enumerated types.
 */
public record SearchableField(DynamicFieldDefinition field, List<Map<String, String>> options) {

  public SearchableField {
    options = List.copyOf(options);
  }
}
