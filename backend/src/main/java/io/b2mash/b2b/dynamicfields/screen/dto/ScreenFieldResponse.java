package io.b2mash.b2b.dynamicfields.screen.dto;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.screen.FieldWithScreenConfig;
import io.b2mash.b2b.dynamicfields.screen.ScreenVisibility;

public record ScreenFieldResponse(
    Long fieldId, String name, String label, FieldType fieldType, ScreenVisibility level) {

  public static ScreenFieldResponse from(FieldWithScreenConfig placed) {
    var field = placed.field();
    return new ScreenFieldResponse(
        field.id(), field.name(), field.label(), field.fieldType(), placed.visibility());
  }
}
