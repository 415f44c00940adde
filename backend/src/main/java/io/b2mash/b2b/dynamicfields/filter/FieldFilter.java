package io.b2mash.b2b.dynamicfields.filter;

/**
 * One user filter on a dynamic field. The field is referenced by id when {@code fieldId} is set,
 * otherwise by name. For {@code in}/{@code notin} the value is a comma-separated list.
 */
public record FieldFilter(Long fieldId, String fieldName, FilterOperator operator, String value) {

  public FieldFilter {
    if (operator == null) {
      operator = FilterOperator.EQ;
    }
    if (value == null) {
      value = "";
    }
  }

  public static FieldFilter byName(String fieldName, FilterOperator operator, String value) {
    return new FieldFilter(null, fieldName, operator, value);
  }

  public static FieldFilter byId(Long fieldId, FilterOperator operator, String value) {
    return new FieldFilter(fieldId, null, operator, value);
  }
}
