package io.b2mash.b2b.dynamicfields.dynamicfield;

/** Physical value slot of {@code dynamic_field_value} that a field type reads and writes. */
public enum ValueColumn {
  TEXT("value_text"),
  INTEGER("value_int"),
  DATE("value_date");

  private final String columnName;

  ValueColumn(String columnName) {
    this.columnName = columnName;
  }

  public String columnName() {
    return columnName;
  }
}
