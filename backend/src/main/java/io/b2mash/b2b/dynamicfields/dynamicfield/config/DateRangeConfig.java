package io.b2mash.b2b.dynamicfields.dynamicfield.config;

/** Shared shape of Date and DateTime configuration. */
public sealed interface DateRangeConfig extends FieldConfig permits DateConfig, DateTimeConfig {

  int yearsInPast();

  int yearsInFuture();

  int yearsPeriod();

  DateRestriction dateRestriction();
}
