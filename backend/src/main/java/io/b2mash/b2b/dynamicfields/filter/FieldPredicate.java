package io.b2mash.b2b.dynamicfields.filter;

import io.b2mash.b2b.dynamicfields.dynamicfield.ValueColumn;
import java.util.List;

/**
 * A correlated sub-query on {@code dynamic_field_value}: "a row of {@code fieldId} exists for the
 * object (or, when {@code negated}, does not) whose {@code column} satisfies {@code condition}".
 *
 * @param parameters condition operands in binding order; the field id is bound separately
 */
public record FieldPredicate(
    String alias,
    Long fieldId,
    ValueColumn column,
    boolean negated,
    ConditionKind condition,
    List<String> parameters) {

  public FieldPredicate {
    parameters = List.copyOf(parameters);
  }
}
