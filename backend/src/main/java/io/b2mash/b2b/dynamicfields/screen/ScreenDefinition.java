package io.b2mash.b2b.dynamicfields.screen;

import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;

/**
 * A UI screen that can show dynamic fields.
 *
 * @param key stable identifier stored in {@code dynamic_field_screen_config.screen_key}
 * @param name display name
 * @param objectType the only object type whose fields may be placed on the screen
 * @param supportsRequired whether fields may be marked required here
 * @param displayOnly read-only screens never accept input
 */
public record ScreenDefinition(
    String key, String name, ObjectType objectType, boolean supportsRequired, boolean displayOnly) {

  public boolean allows(ScreenVisibility visibility) {
    return visibility != ScreenVisibility.REQUIRED || (supportsRequired && !displayOnly);
  }
}
