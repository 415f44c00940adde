package io.b2mash.b2b.dynamicfields.dynamicfield.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Shared shape of the enumerated field types (Dropdown and Multiselect). */
public sealed interface OptionsConfig extends FieldConfig
    permits DropdownConfig, MultiselectConfig {

  /** Stored key to display label, in declaration order. */
  Map<String, String> possibleValues();

  /** Whether an explicit "none" entry is offered. */
  boolean possibleNone();

  boolean translatableValues();

  boolean treeView();

  /** Resolves a stored key to its label, falling back to the key itself. */
  default String labelFor(String key) {
    var label = possibleValues().get(key);
    return label != null ? label : key;
  }

  static Map<String, String> copyOf(Map<String, String> possibleValues) {
    if (possibleValues == null || possibleValues.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(possibleValues));
  }
}
