package io.b2mash.b2b.dynamicfields.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.dynamicfields.dynamicfield.ValueColumn;
import java.util.List;
import org.junit.jupiter.api.Test;

class SqlFilterRendererTest {

  private final SqlFilterRenderer renderer = new SqlFilterRenderer();

  private static FieldPredicate predicate(
      String alias, long fieldId, ValueColumn column, ConditionKind kind, String... operands) {
    return new FieldPredicate(alias, fieldId, column, false, kind, List.of(operands));
  }

  @Test
  void emptyPlanRendersNothingAndKeepsOffset() {
    var fragment = renderer.render(FilterPlan.empty(), 4, "t.id");

    assertThat(fragment.isEmpty()).isTrue();
    assertThat(fragment.parameters()).isEmpty();
    assertThat(fragment.nextParameterIndex()).isEqualTo(4);
  }

  @Test
  void parametersAreNumberedFromCallerOffset() {
    var plan =
        new FilterPlan(
            List.of(
                predicate("dfv0", 7L, ValueColumn.INTEGER, ConditionKind.GT, "1"),
                predicate("dfv1", 8L, ValueColumn.TEXT, ConditionKind.EQ, "open")));

    var fragment = renderer.render(plan, 3, "ticket.id");

    assertThat(fragment.sql())
        .isEqualTo(
            "EXISTS (SELECT 1 FROM dynamic_field_value dfv0 WHERE dfv0.object_id = ticket.id"
                + " AND dfv0.field_id = ?3 AND dfv0.value_int > CAST(?4 AS bigint))"
                + " AND EXISTS (SELECT 1 FROM dynamic_field_value dfv1 WHERE dfv1.object_id ="
                + " ticket.id AND dfv1.field_id = ?5 AND dfv1.value_text = ?6)");
    assertThat(fragment.parameters()).containsExactly(7L, "1", 8L, "open");
    assertThat(fragment.nextParameterIndex()).isEqualTo(7);
  }

  @Test
  void dateComparisonCastsToTimestamp() {
    var plan =
        new FilterPlan(
            List.of(predicate("dfv0", 2L, ValueColumn.DATE, ConditionKind.LTE, "2024-01-31")));

    assertThat(renderer.render(plan, 1, "t.id").sql())
        .contains("dfv0.value_date <= CAST(?2 AS timestamp)");
  }

  @Test
  void containsOnNonTextColumnComparesTextForm() {
    var plan =
        new FilterPlan(
            List.of(predicate("dfv0", 2L, ValueColumn.INTEGER, ConditionKind.LIKE, "%4%")));

    assertThat(renderer.render(plan, 1, "t.id").sql())
        .contains("CAST(dfv0.value_int AS text) LIKE ?2");
  }

  @Test
  void inListBindsOneParameterPerValue() {
    var plan =
        new FilterPlan(
            List.of(
                predicate("dfv0", 5L, ValueColumn.TEXT, ConditionKind.NOT_IN, "a", "b", "c")));

    var fragment = renderer.render(plan, 1, "t.id");

    assertThat(fragment.sql()).contains("dfv0.value_text NOT IN (?2, ?3, ?4)");
    assertThat(fragment.nextParameterIndex()).isEqualTo(5);
  }

  @Test
  void emptyCheckRendersNotExists() {
    var plan =
        new FilterPlan(
            List.of(
                new FieldPredicate(
                    "dfv0", 5L, ValueColumn.TEXT, true, ConditionKind.HAS_VALUE, List.of())));

    assertThat(renderer.render(plan, 1, "t.id").sql())
        .startsWith("NOT EXISTS (")
        .endsWith("dfv0.value_text IS NOT NULL AND dfv0.value_text <> '')");
  }

  @Test
  void checkboxConditionsNeedNoOperand() {
    var plan =
        new FilterPlan(
            List.of(
                predicate("dfv0", 1L, ValueColumn.INTEGER, ConditionKind.CHECKED),
                predicate("dfv1", 2L, ValueColumn.INTEGER, ConditionKind.UNCHECKED)));

    var fragment = renderer.render(plan, 1, "t.id");

    assertThat(fragment.sql())
        .contains("dfv0.value_int = 1)")
        .contains("(dfv1.value_int = 0 OR dfv1.value_int IS NULL)");
    assertThat(fragment.parameters()).containsExactly(1L, 2L);
  }

  @Test
  void rejectsInvalidOffsetAndColumnReference() {
    assertThatThrownBy(() -> renderer.render(FilterPlan.empty(), 0, "t.id"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> renderer.render(FilterPlan.empty(), 1, "t.id; DROP TABLE x"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
