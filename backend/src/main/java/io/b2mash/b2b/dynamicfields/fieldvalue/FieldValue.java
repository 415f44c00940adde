package io.b2mash.b2b.dynamicfields.fieldvalue;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.b2mash.b2b.dynamicfields.dynamicfield.ValueColumn;
import java.time.LocalDateTime;

/** A dynamic field value as seen outside the storage layer. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = FieldValue.TextValue.class, name = "text"),
  @JsonSubTypes.Type(value = FieldValue.IntegerValue.class, name = "integer"),
  @JsonSubTypes.Type(value = FieldValue.DateValue.class, name = "date")
})
public sealed interface FieldValue {

  ValueColumn column();

  static FieldValue text(String value) {
    return new TextValue(value);
  }

  static FieldValue integer(long value) {
    return new IntegerValue(value);
  }

  static FieldValue date(LocalDateTime value) {
    return new DateValue(value);
  }

  /** True for null, and for a text or date value without payload; such values are not stored. */
  static boolean isEmpty(FieldValue value) {
    if (value instanceof TextValue text) {
      return text.value() == null;
    }
    if (value instanceof DateValue date) {
      return date.value() == null;
    }
    return value == null;
  }

  record TextValue(String value) implements FieldValue {
    @Override
    public ValueColumn column() {
      return ValueColumn.TEXT;
    }
  }

  record IntegerValue(long value) implements FieldValue {
    @Override
    public ValueColumn column() {
      return ValueColumn.INTEGER;
    }
  }

  record DateValue(LocalDateTime value) implements FieldValue {
    @Override
    public ValueColumn column() {
      return ValueColumn.DATE;
    }
  }
}
