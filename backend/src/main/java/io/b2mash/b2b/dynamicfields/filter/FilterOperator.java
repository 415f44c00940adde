package io.b2mash.b2b.dynamicfields.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Comparison requested by a dynamic field filter. */
public enum FilterOperator {
  EQ("eq"),
  NE("ne"),
  CONTAINS("contains"),
  GT("gt"),
  LT("lt"),
  GTE("gte"),
  LTE("lte"),
  IN("in"),
  NOT_IN("notin"),
  EMPTY("empty"),
  NOT_EMPTY("notempty");

  private final String token;

  FilterOperator(String token) {
    this.token = token;
  }

  @JsonValue
  public String token() {
    return token;
  }

  /** Query-parameter suffix selecting this operator, e.g. {@code _gte}. */
  public String suffix() {
    return "_" + token;
  }

  /** Blank and unrecognised tokens mean equality. */
  @JsonCreator
  public static FilterOperator fromToken(String token) {
    if (token != null) {
      for (var operator : values()) {
        if (operator.token.equalsIgnoreCase(token)) {
          return operator;
        }
      }
    }
    return EQ;
  }
}
