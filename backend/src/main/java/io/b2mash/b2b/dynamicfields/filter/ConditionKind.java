package io.b2mash.b2b.dynamicfields.filter;

/** Typed condition applied to the value column inside a field predicate. */
public enum ConditionKind {
  /** Checkbox is ticked: {@code col = 1}. */
  CHECKED,
  /** Checkbox row exists but is not ticked: {@code col = 0 OR col IS NULL}. */
  UNCHECKED,
  EQ,
  NE_OR_NULL,
  LIKE,
  GT,
  LT,
  GTE,
  LTE,
  IN,
  NOT_IN,
  /** Non-null, and non-empty on the text column. */
  HAS_VALUE
}
