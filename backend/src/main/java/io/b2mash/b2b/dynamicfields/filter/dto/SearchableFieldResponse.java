package io.b2mash.b2b.dynamicfields.filter.dto;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.filter.SearchableField;
import java.util.List;
import java.util.Map;

public record SearchableFieldResponse(
    Long id,
    String name,
    String label,
    int fieldOrder,
    FieldType fieldType,
    List<Map<String, String>> options) {

  public static SearchableFieldResponse from(SearchableField searchable) {
    var field = searchable.field();
    return new SearchableFieldResponse(
        field.id(),
        field.name(),
        field.label(),
        field.fieldOrder(),
        field.fieldType(),
        searchable.options());
  }
}
