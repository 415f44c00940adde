package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;

public record DateTimeConfig(
    String defaultValue,
    int yearsInPast,
    int yearsInFuture,
    int yearsPeriod,
    DateRestriction dateRestriction)
    implements DateRangeConfig {

  public DateTimeConfig {
    defaultValue = FieldConfig.normalize(defaultValue);
    if (dateRestriction == null) {
      dateRestriction = DateRestriction.NONE;
    }
  }

  @Override
  public FieldType fieldType() {
    return FieldType.DATE_TIME;
  }

  @Override
  public DateTimeConfig withDefaultValue(String defaultValue) {
    return new DateTimeConfig(
        defaultValue, yearsInPast, yearsInFuture, yearsPeriod, dateRestriction);
  }
}
