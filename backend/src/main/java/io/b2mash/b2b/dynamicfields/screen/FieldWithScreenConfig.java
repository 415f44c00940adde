package io.b2mash.b2b.dynamicfields.screen;

import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldDefinition;

/** A field placed on a screen, with the level it is shown at. */
public record FieldWithScreenConfig(DynamicFieldDefinition field, ScreenVisibility visibility) {

  public boolean isRequired() {
    return visibility == ScreenVisibility.REQUIRED;
  }
}
