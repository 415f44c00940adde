package io.b2mash.b2b.dynamicfields.filter;

import io.b2mash.b2b.dynamicfields.dynamicfield.ValueColumn;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link FilterPlan} as PostgreSQL with JPA positional parameters. Every bound value
 * takes the next index from one counter, starting at the caller's offset. Operands are bound as
 * strings and cast to the column type for the integer and date slots.
 */
@Component
public class SqlFilterRenderer {

  private static final Pattern COLUMN_REFERENCE = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

  public SqlFragment render(FilterPlan plan, int startIndex, String outerIdColumn) {
    if (startIndex < 1) {
      throw new IllegalArgumentException("Parameter indices start at 1, got " + startIndex);
    }
    if (!COLUMN_REFERENCE.matcher(outerIdColumn).matches()) {
      throw new IllegalArgumentException("Invalid id column reference: " + outerIdColumn);
    }
    var state = new RenderState(startIndex);
    var clauses = new ArrayList<String>();
    for (var predicate : plan.predicates()) {
      clauses.add(renderPredicate(predicate, outerIdColumn, state));
    }
    return new SqlFragment(String.join(" AND ", clauses), state.parameters, state.next);
  }

  private static String renderPredicate(
      FieldPredicate predicate, String outerIdColumn, RenderState state) {
    var alias = predicate.alias();
    var sql = new StringBuilder();
    sql.append(predicate.negated() ? "NOT EXISTS" : "EXISTS")
        .append(" (SELECT 1 FROM dynamic_field_value ")
        .append(alias)
        .append(" WHERE ")
        .append(alias)
        .append(".object_id = ")
        .append(outerIdColumn)
        .append(" AND ")
        .append(alias)
        .append(".field_id = ")
        .append(state.bind(predicate.fieldId()));

    var column = alias + "." + predicate.column().columnName();
    var operands = predicate.parameters();
    sql.append(" AND ").append(condition(predicate, column, operands, state)).append(')');
    return sql.toString();
  }

  private static String condition(
      FieldPredicate predicate, String column, List<String> operands, RenderState state) {
    var type = predicate.column();
    return switch (predicate.condition()) {
      case CHECKED -> column + " = 1";
      case UNCHECKED -> "(" + column + " = 0 OR " + column + " IS NULL)";
      case EQ -> column + " = " + typed(type, state.bind(operands.get(0)));
      case NE_OR_NULL ->
          "(" + column + " <> " + typed(type, state.bind(operands.get(0))) + " OR " + column
              + " IS NULL)";
      case LIKE -> asText(type, column) + " LIKE " + state.bind(operands.get(0));
      case GT -> column + " > " + typed(type, state.bind(operands.get(0)));
      case LT -> column + " < " + typed(type, state.bind(operands.get(0)));
      case GTE -> column + " >= " + typed(type, state.bind(operands.get(0)));
      case LTE -> column + " <= " + typed(type, state.bind(operands.get(0)));
      case IN -> column + " IN (" + list(type, operands, state) + ")";
      case NOT_IN -> column + " NOT IN (" + list(type, operands, state) + ")";
      case HAS_VALUE ->
          type == ValueColumn.TEXT
              ? column + " IS NOT NULL AND " + column + " <> ''"
              : column + " IS NOT NULL";
    };
  }

  private static String list(ValueColumn type, List<String> operands, RenderState state) {
    return operands.stream()
        .map(operand -> typed(type, state.bind(operand)))
        .collect(Collectors.joining(", "));
  }

  private static String typed(ValueColumn type, String placeholder) {
    return switch (type) {
      case TEXT -> placeholder;
      case INTEGER -> "CAST(" + placeholder + " AS bigint)";
      case DATE -> "CAST(" + placeholder + " AS timestamp)";
    };
  }

  private static String asText(ValueColumn type, String column) {
    return type == ValueColumn.TEXT ? column : "CAST(" + column + " AS text)";
  }

  private static final class RenderState {
    private final List<Object> parameters = new ArrayList<>();
    private int next;

    private RenderState(int start) {
      this.next = start;
    }

    private String bind(Object value) {
      parameters.add(value);
      return "?" + next++;
    }
  }
}
