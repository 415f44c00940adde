package io.b2mash.b2b.dynamicfields.filter;

import java.util.List;

/** Compiled filters; predicates are combined with AND in order. */
public record FilterPlan(List<FieldPredicate> predicates) {

  public FilterPlan {
    predicates = List.copyOf(predicates);
  }

  public static FilterPlan empty() {
    return new FilterPlan(List.of());
  }

  public boolean isEmpty() {
    return predicates.isEmpty();
  }
}
