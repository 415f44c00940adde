package io.b2mash.b2b.dynamicfields.filter;

import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicField;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldRepository;
import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.dynamicfield.ValueColumn;
import io.b2mash.b2b.dynamicfields.exception.FieldValidationException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves user filters against the field registry and turns them into a {@link FilterPlan}.
 * Filters on unknown fields are dropped so they never break the surrounding query. Operands that
 * the integer or date slot cannot hold are rejected with a {@link FieldValidationException}.
 */
@Component
public class DynamicFieldFilterCompiler {

  private static final Logger log = LoggerFactory.getLogger(DynamicFieldFilterCompiler.class);
  private static final Set<String> CHECKED_TOKENS = Set.of("1", "true", "on");
  private static final Set<ConditionKind> TYPED_CONDITIONS =
      EnumSet.of(
          ConditionKind.EQ,
          ConditionKind.NE_OR_NULL,
          ConditionKind.GT,
          ConditionKind.LT,
          ConditionKind.GTE,
          ConditionKind.LTE,
          ConditionKind.IN,
          ConditionKind.NOT_IN);
  private static final List<DateTimeFormatter> DATE_TIME_OPERANDS =
      List.of(
          DateTimeFormatter.ISO_LOCAL_DATE_TIME,
          DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
          DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"));
  static final String ALIAS_PREFIX = "dfv";

  private final DynamicFieldRepository dynamicFieldRepository;

  public DynamicFieldFilterCompiler(DynamicFieldRepository dynamicFieldRepository) {
    this.dynamicFieldRepository = dynamicFieldRepository;
  }

  public FilterPlan compile(List<FieldFilter> filters) {
    if (filters == null || filters.isEmpty()) {
      return FilterPlan.empty();
    }
    var predicates = new ArrayList<FieldPredicate>();
    for (int i = 0; i < filters.size(); i++) {
      var filter = filters.get(i);
      var field = resolve(filter);
      if (field.isEmpty()) {
        log.debug(
            "Skipping filter on unknown dynamic field: id={}, name={}",
            filter.fieldId(),
            filter.fieldName());
        continue;
      }
      var predicate = toPredicate(ALIAS_PREFIX + i, field.get(), filter);
      checkOperands(field.get(), predicate);
      predicates.add(predicate);
    }
    return new FilterPlan(predicates);
  }

  private Optional<DynamicField> resolve(FieldFilter filter) {
    if (filter.fieldId() != null && filter.fieldId() > 0) {
      return dynamicFieldRepository.findById(filter.fieldId());
    }
    if (filter.fieldName() != null && !filter.fieldName().isBlank()) {
      return dynamicFieldRepository.findByName(filter.fieldName());
    }
    return Optional.empty();
  }

  private static FieldPredicate toPredicate(String alias, DynamicField field, FieldFilter filter) {
    var column = field.getFieldType().valueColumn();
    var value = filter.value();
    return switch (filter.operator()) {
      case EQ -> {
        if (field.getFieldType() == FieldType.CHECKBOX) {
          var kind =
              CHECKED_TOKENS.contains(value) ? ConditionKind.CHECKED : ConditionKind.UNCHECKED;
          yield new FieldPredicate(alias, field.getId(), column, false, kind, List.of());
        }
        yield new FieldPredicate(
            alias, field.getId(), column, false, ConditionKind.EQ, List.of(value));
      }
      case NE ->
          new FieldPredicate(
              alias, field.getId(), column, false, ConditionKind.NE_OR_NULL, List.of(value));
      case CONTAINS ->
          new FieldPredicate(
              alias, field.getId(), column, false, ConditionKind.LIKE, List.of("%" + value + "%"));
      case GT ->
          new FieldPredicate(alias, field.getId(), column, false, ConditionKind.GT, List.of(value));
      case LT ->
          new FieldPredicate(alias, field.getId(), column, false, ConditionKind.LT, List.of(value));
      case GTE ->
          new FieldPredicate(
              alias, field.getId(), column, false, ConditionKind.GTE, List.of(value));
      case LTE ->
          new FieldPredicate(
              alias, field.getId(), column, false, ConditionKind.LTE, List.of(value));
      case IN ->
          new FieldPredicate(alias, field.getId(), column, false, ConditionKind.IN, split(value));
      case NOT_IN ->
          new FieldPredicate(
              alias, field.getId(), column, false, ConditionKind.NOT_IN, split(value));
      case EMPTY ->
          new FieldPredicate(
              alias, field.getId(), column, true, ConditionKind.HAS_VALUE, List.of());
      case NOT_EMPTY ->
          new FieldPredicate(
              alias, field.getId(), column, false, ConditionKind.HAS_VALUE, List.of());
    };
  }

  private static void checkOperands(DynamicField field, FieldPredicate predicate) {
    if (predicate.column() == ValueColumn.TEXT
        || !TYPED_CONDITIONS.contains(predicate.condition())) {
      return;
    }
    for (var operand : predicate.parameters()) {
      if (predicate.column() == ValueColumn.INTEGER && !isInteger(operand)) {
        throw new FieldValidationException(
            "value", "Filter on " + field.getName() + " expects a number: " + operand);
      }
      if (predicate.column() == ValueColumn.DATE && !isDate(operand)) {
        throw new FieldValidationException(
            "value", "Filter on " + field.getName() + " expects a date: " + operand);
      }
    }
  }

  private static boolean isInteger(String operand) {
    try {
      Long.parseLong(operand.trim());
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static boolean isDate(String operand) {
    var trimmed = operand.trim();
    try {
      LocalDate.parse(trimmed);
      return true;
    } catch (DateTimeParseException e) {
      log.trace("Date operand '{}' is not a plain date", operand);
    }
    for (var format : DATE_TIME_OPERANDS) {
      try {
        LocalDateTime.parse(trimmed, format);
        return true;
      } catch (DateTimeParseException e) {
        log.trace("Date operand '{}' does not match {}", operand, format);
      }
    }
    return false;
  }

  private static List<String> split(String value) {
    return Arrays.stream(value.split(",", -1)).map(String::trim).toList();
  }
}
