package io.b2mash.b2b.dynamicfields.screen.dto;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import io.b2mash.b2b.dynamicfields.screen.ScreenConfigMatrix;
import io.b2mash.b2b.dynamicfields.screen.ScreenDefinition;
import io.b2mash.b2b.dynamicfields.screen.ScreenVisibility;
import java.util.List;
import java.util.Map;

public record ScreenMatrixResponse(
    ObjectType objectType,
    List<FieldSummary> fields,
    List<ScreenDefinition> screens,
    Map<Long, Map<String, ScreenVisibility>> cells) {

  public record FieldSummary(
      Long id, String name, String label, int fieldOrder, FieldType fieldType, boolean valid) {}

  public static ScreenMatrixResponse from(ScreenConfigMatrix matrix) {
    var fields =
        matrix.fields().stream()
            .map(
                f ->
                    new FieldSummary(
                        f.id(), f.name(), f.label(), f.fieldOrder(), f.fieldType(), f.valid()))
            .toList();
    return new ScreenMatrixResponse(matrix.objectType(), fields, matrix.screens(), matrix.cells());
  }
}
