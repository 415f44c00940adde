package io.b2mash.b2b.dynamicfields.fieldvalue;

import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldDefinition;

/** A field paired with its raw value (null when unset) and the string shown to users. */
public record FieldDisplay(DynamicFieldDefinition field, FieldValue value, String displayValue) {}
