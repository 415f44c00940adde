package io.b2mash.b2b.dynamicfields.screen;

import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldDefinition;
import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import java.util.List;
import java.util.Map;

/**
 * Full field x screen grid for one object type. Every field has an entry for every screen; cells
 * without a stored row are {@link ScreenVisibility#DISABLED}.
 */
public record ScreenConfigMatrix(
    ObjectType objectType,
    List<DynamicFieldDefinition> fields,
    List<ScreenDefinition> screens,
    Map<Long, Map<String, ScreenVisibility>> cells) {

  public ScreenVisibility visibility(Long fieldId, String screenKey) {
    var row = cells.get(fieldId);
    if (row == null) {
      return ScreenVisibility.DISABLED;
    }
    return row.getOrDefault(screenKey, ScreenVisibility.DISABLED);
  }
}
