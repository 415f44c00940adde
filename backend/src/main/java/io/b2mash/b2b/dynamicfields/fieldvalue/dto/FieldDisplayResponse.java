package io.b2mash.b2b.dynamicfields.fieldvalue.dto;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.fieldvalue.FieldDisplay;
import io.b2mash.b2b.dynamicfields.fieldvalue.FieldValue;

public record FieldDisplayResponse(
    Long fieldId,
    String name,
    String label,
    FieldType fieldType,
    FieldValue value,
    String displayValue) {

  public static FieldDisplayResponse from(FieldDisplay display) {
    var field = display.field();
    return new FieldDisplayResponse(
        field.id(),
        field.name(),
        field.label(),
        field.fieldType(),
        display.value(),
        display.displayValue());
  }
}
