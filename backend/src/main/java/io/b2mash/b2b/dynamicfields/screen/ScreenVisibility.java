package io.b2mash.b2b.dynamicfields.screen;

import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.b2b.dynamicfields.exception.FieldValidationException;

/** Per-screen level of a field: stored as 0, 1 or 2. */
public enum ScreenVisibility {
  DISABLED(0),
  ENABLED(1),
  REQUIRED(2);

  private final int level;

  ScreenVisibility(int level) {
    this.level = level;
  }

  @JsonValue
  public int level() {
    return level;
  }

  public boolean isShown() {
    return level > 0;
  }

  public static ScreenVisibility fromLevel(int level) {
    for (var visibility : values()) {
      if (visibility.level == level) {
        return visibility;
      }
    }
    throw new FieldValidationException("level", "Screen level must be 0, 1 or 2 but was " + level);
  }
}
