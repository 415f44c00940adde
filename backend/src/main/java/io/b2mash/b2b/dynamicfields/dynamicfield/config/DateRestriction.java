package io.b2mash.b2b.dynamicfields.dynamicfield.config;

/** Which side of "today" a Date/DateTime picker blocks. */
public enum DateRestriction {
  NONE("none"),
  DISABLE_PAST_DATES("DisablePastDates"),
  DISABLE_FUTURE_DATES("DisableFutureDates");

  private final String externalName;

  DateRestriction(String externalName) {
    this.externalName = externalName;
  }

  public String externalName() {
    return externalName;
  }

  /** Unknown or blank values mean no restriction. */
  public static DateRestriction fromExternalName(String name) {
    if (name != null) {
      for (var restriction : values()) {
        if (restriction.externalName.equalsIgnoreCase(name)
            || restriction.name().equalsIgnoreCase(name)) {
          return restriction;
        }
      }
    }
    return NONE;
  }
}
