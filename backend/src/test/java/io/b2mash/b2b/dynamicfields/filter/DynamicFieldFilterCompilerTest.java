package io.b2mash.b2b.dynamicfields.filter;

import static io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldFixtures.ticketField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldRepository;
import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.dynamicfield.ValueColumn;
import io.b2mash.b2b.dynamicfields.exception.FieldValidationException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DynamicFieldFilterCompilerTest {

  @Mock private DynamicFieldRepository dynamicFieldRepository;

  private DynamicFieldFilterCompiler compiler;

  @BeforeEach
  void setUp() {
    compiler = new DynamicFieldFilterCompiler(dynamicFieldRepository);
  }

  @Test
  void noFiltersCompileToEmptyPlan() {
    assertThat(compiler.compile(List.of()).isEmpty()).isTrue();
    assertThat(compiler.compile(null).isEmpty()).isTrue();
    verifyNoInteractions(dynamicFieldRepository);
  }

  @Test
  void unknownFieldsAreSkippedButKeepAliasPositions() {
    when(dynamicFieldRepository.findByName("Gone")).thenReturn(Optional.empty());
    when(dynamicFieldRepository.findByName("Priority1"))
        .thenReturn(Optional.of(ticketField(1L, "Priority1", FieldType.TEXT)));

    var plan =
        compiler.compile(
            List.of(
                FieldFilter.byName("Gone", FilterOperator.EQ, "x"),
                FieldFilter.byName("Priority1", FilterOperator.EQ, "2")));

    assertThat(plan.predicates()).hasSize(1);
    var predicate = plan.predicates().get(0);
    assertThat(predicate.alias()).isEqualTo("dfv1");
    assertThat(predicate.fieldId()).isEqualTo(1L);
    assertThat(predicate.column()).isEqualTo(ValueColumn.TEXT);
    assertThat(predicate.condition()).isEqualTo(ConditionKind.EQ);
    assertThat(predicate.parameters()).containsExactly("2");
  }

  @Test
  void fieldIdTakesPrecedenceOverName() {
    when(dynamicFieldRepository.findById(4L))
        .thenReturn(Optional.of(ticketField(4L, "Due", FieldType.DATE)));

    var plan =
        compiler.compile(
            List.of(new FieldFilter(4L, "Ignored", FilterOperator.GTE, "2024-01-01 00:00:00")));

    var predicate = plan.predicates().get(0);
    assertThat(predicate.column()).isEqualTo(ValueColumn.DATE);
    assertThat(predicate.condition()).isEqualTo(ConditionKind.GTE);
  }

  @Test
  void checkboxEqualityMapsToCheckedOrUnchecked() {
    when(dynamicFieldRepository.findByName("Urgent"))
        .thenReturn(Optional.of(ticketField(2L, "Urgent", FieldType.CHECKBOX)));

    var plan =
        compiler.compile(
            List.of(
                FieldFilter.byName("Urgent", FilterOperator.EQ, "on"),
                FieldFilter.byName("Urgent", FilterOperator.EQ, "0")));

    assertThat(plan.predicates())
        .extracting(FieldPredicate::condition)
        .containsExactly(ConditionKind.CHECKED, ConditionKind.UNCHECKED);
    assertThat(plan.predicates().get(0).parameters()).isEmpty();
  }

  @Test
  void operatorsMapToConditions() {
    when(dynamicFieldRepository.findByName("Notes"))
        .thenReturn(Optional.of(ticketField(3L, "Notes", FieldType.TEXT)));

    var plan =
        compiler.compile(
            List.of(
                FieldFilter.byName("Notes", FilterOperator.CONTAINS, "abc"),
                FieldFilter.byName("Notes", FilterOperator.IN, "a, b ,c"),
                FieldFilter.byName("Notes", FilterOperator.NE, "x"),
                FieldFilter.byName("Notes", FilterOperator.EMPTY, ""),
                FieldFilter.byName("Notes", FilterOperator.NOT_EMPTY, "")));

    var predicates = plan.predicates();
    assertThat(predicates.get(0).parameters()).containsExactly("%abc%");
    assertThat(predicates.get(1).parameters()).containsExactly("a", "b", "c");
    assertThat(predicates.get(2).condition()).isEqualTo(ConditionKind.NE_OR_NULL);
    assertThat(predicates.get(3).negated()).isTrue();
    assertThat(predicates.get(3).condition()).isEqualTo(ConditionKind.HAS_VALUE);
    assertThat(predicates.get(4).negated()).isFalse();
    assertThat(predicates.get(4).condition()).isEqualTo(ConditionKind.HAS_VALUE);
  }

  @Test
  void nonNumericOperandOnIntegerSlotIsRejected() {
    when(dynamicFieldRepository.findByName("Urgent"))
        .thenReturn(Optional.of(ticketField(2L, "Urgent", FieldType.CHECKBOX)));

    assertThatThrownBy(
            () -> compiler.compile(List.of(FieldFilter.byName("Urgent", FilterOperator.GT, "abc"))))
        .isInstanceOf(FieldValidationException.class)
        .hasMessageStartingWith("value:")
        .hasMessageContaining("abc");
  }

  @Test
  void unparseableDateInListIsRejected() {
    when(dynamicFieldRepository.findByName("Due"))
        .thenReturn(Optional.of(ticketField(4L, "Due", FieldType.DATE)));

    assertThatThrownBy(
            () ->
                compiler.compile(
                    List.of(
                        FieldFilter.byName("Due", FilterOperator.IN, "2024-05-01,next week"))))
        .isInstanceOf(FieldValidationException.class)
        .hasMessageContaining("next week");
  }

  @Test
  void dateOperandsInCommonFormatsAreAccepted() {
    when(dynamicFieldRepository.findByName("Due"))
        .thenReturn(Optional.of(ticketField(4L, "Due", FieldType.DATE_TIME)));

    var plan =
        compiler.compile(
            List.of(
                FieldFilter.byName("Due", FilterOperator.GT, "2024-05-01"),
                FieldFilter.byName("Due", FilterOperator.LT, "2024-05-01T10:15"),
                FieldFilter.byName("Due", FilterOperator.LTE, "2024-05-01 10:15"),
                FieldFilter.byName("Due", FilterOperator.CONTAINS, "2024-05")));

    assertThat(plan.predicates()).hasSize(4);
  }
}
