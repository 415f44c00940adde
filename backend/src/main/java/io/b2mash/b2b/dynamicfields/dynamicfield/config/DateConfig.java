package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;

public record DateConfig(
    String defaultValue,
    int yearsInPast,
    int yearsInFuture,
    int yearsPeriod,
    DateRestriction dateRestriction)
    implements DateRangeConfig {

  public DateConfig {
    defaultValue = FieldConfig.normalize(defaultValue);
    if (dateRestriction == null) {
      dateRestriction = DateRestriction.NONE;
    }
  }

  @Override
  public FieldType fieldType() {
    return FieldType.DATE;
  }

  @Override
  public DateConfig withDefaultValue(String defaultValue) {
    return new DateConfig(defaultValue, yearsInPast, yearsInFuture, yearsPeriod, dateRestriction);
  }
}
