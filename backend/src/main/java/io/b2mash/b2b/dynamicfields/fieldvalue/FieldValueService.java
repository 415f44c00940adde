package io.b2mash.b2b.dynamicfields.fieldvalue;

import io.b2mash.b2b.dynamicfields.config.DynamicFieldProperties;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldDefinition;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldMapper;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldRepository;
import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import io.b2mash.b2b.dynamicfields.exception.ResourceNotFoundException;
import io.b2mash.b2b.dynamicfields.exception.StorageException;
import io.b2mash.b2b.dynamicfields.screen.FieldWithScreenConfig;
import io.b2mash.b2b.dynamicfields.screen.ScreenConfigService;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Value Store: reads and writes dynamic field values of business objects. */
@Service
public class FieldValueService {

  private static final Logger log = LoggerFactory.getLogger(FieldValueService.class);

  private static final Set<String> CHECKED_TOKENS = Set.of("1", "on", "true");
  private static final List<DateTimeFormatter> DATE_TIME_INPUTS =
      List.of(
          DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm"),
          DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));

  private final DynamicFieldValueRepository valueRepository;
  private final DynamicFieldRepository dynamicFieldRepository;
  private final DynamicFieldMapper mapper;
  private final ScreenConfigService screenConfigService;
  private final FieldValueFormatter formatter;
  private final DynamicFieldProperties properties;

  public FieldValueService(
      DynamicFieldValueRepository valueRepository,
      DynamicFieldRepository dynamicFieldRepository,
      DynamicFieldMapper mapper,
      ScreenConfigService screenConfigService,
      FieldValueFormatter formatter,
      DynamicFieldProperties properties) {
    this.valueRepository = valueRepository;
    this.dynamicFieldRepository = dynamicFieldRepository;
    this.mapper = mapper;
    this.screenConfigService = screenConfigService;
    this.formatter = formatter;
    this.properties = properties;
  }

  @Transactional(readOnly = true)
  public List<StoredFieldValue> getValues(long objectId) {
    return valueRepository.findByObjectIdOrderByFieldId(objectId).stream()
        .map(StoredFieldValue::from)
        .toList();
  }

  /**
   * Replaces the value of one field on one object. A null {@code value}, or one without payload,
   * clears it; the existing row is always removed first.
   */
  @Transactional
  public void setValue(Long fieldId, long objectId, FieldValue value) {
    if (!dynamicFieldRepository.existsById(fieldId)) {
      throw new ResourceNotFoundException("DynamicField", fieldId);
    }
    write(fieldId, objectId, value);
    log.debug("Set dynamic field value: fieldId={}, objectId={}", fieldId, objectId);
  }

  @Transactional(readOnly = true)
  public boolean hasValues(Long fieldId) {
    return valueRepository.existsByFieldId(fieldId);
  }

  /** Removes every value of the field. Part of field deletion. */
  @Transactional
  public int deleteValuesForField(Long fieldId) {
    try {
      return valueRepository.deleteByFieldId(fieldId);
    } catch (DataAccessException e) {
      throw new StorageException("delete values of field " + fieldId, e);
    }
  }

  /** Distinct non-empty text values of the field, sorted, for filter dropdowns. */
  @Transactional(readOnly = true)
  public List<String> getDistinctTextValues(Long fieldId, Integer limit) {
    int effectiveLimit =
        limit == null || limit <= 0 ? properties.distinctValuesLimit() : limit;
    return valueRepository.findDistinctTextValues(fieldId, effectiveLimit);
  }

  /**
   * Fields shown on {@code screenKey} (or every valid field of the object type when no screen is
   * given), each with its raw value and display string.
   */
  @Transactional(readOnly = true)
  public List<FieldDisplay> getValuesForDisplay(
      long objectId, ObjectType objectType, String screenKey) {
    List<DynamicFieldDefinition> fields;
    if (screenKey == null || screenKey.isEmpty()) {
      fields =
          dynamicFieldRepository.findValidByObjectTypeOrdered(objectType).stream()
              .map(mapper::toDefinition)
              .toList();
    } else {
      fields =
          screenConfigService.getFieldsForScreen(screenKey, objectType).stream()
              .map(FieldWithScreenConfig::field)
              .toList();
    }

    var values = new HashMap<Long, FieldValue>();
    for (var row : valueRepository.findByObjectIdOrderByFieldId(objectId)) {
      values.put(row.getFieldId(), row.toFieldValue());
    }

    var result = new ArrayList<FieldDisplay>(fields.size());
    for (var field : fields) {
      var value = values.get(field.id());
      result.add(new FieldDisplay(field, value, formatter.format(field, value)));
    }
    return result;
  }

  /**
   * Stores the submitted values of every field enabled on the screen. Fields that were not
   * submitted, or whose first value is empty, keep their current value.
   *
   * @return number of values written
   */
  @Transactional
  public int processForm(
      Map<String, List<String>> form, long objectId, ObjectType objectType, String screenKey) {
    int written = 0;
    for (var placed : screenConfigService.getFieldsForScreen(screenKey, objectType)) {
      var field = placed.field();
      var key = objectType.formPrefix() + field.name();
      var submitted = form.get(key);
      if (submitted == null) {
        submitted = form.get(key + "[]");
      }
      if (submitted == null || submitted.isEmpty()) {
        continue;
      }
      var first = submitted.get(0);
      if (first == null || first.isEmpty()) {
        continue;
      }

      write(field.id(), objectId, fromForm(field, first, submitted));
      written++;
    }
    log.info(
        "Processed dynamic field form: objectId={}, objectType={}, screenKey={}, written={}",
        objectId,
        objectType,
        screenKey,
        written);
    return written;
  }

  private FieldValue fromForm(DynamicFieldDefinition field, String first, List<String> all) {
    return switch (field.fieldType()) {
      case TEXT, TEXT_AREA, DROPDOWN -> FieldValue.text(first);
      case MULTISELECT -> FieldValue.text(String.join(properties.multiselectDelimiter(), all));
      case CHECKBOX -> FieldValue.integer(CHECKED_TOKENS.contains(first) ? 1 : 0);
      case DATE -> {
        try {
          yield FieldValue.date(LocalDate.parse(first).atStartOfDay());
        } catch (DateTimeParseException e) {
          yield FieldValue.text(first);
        }
      }
      case DATE_TIME -> parseDateTime(first);
    };
  }

  /** Unparseable input is kept verbatim in the text slot. */
  private static FieldValue parseDateTime(String input) {
    for (var format : DATE_TIME_INPUTS) {
      try {
        return FieldValue.date(LocalDateTime.parse(input, format));
      } catch (DateTimeParseException e) {
        log.trace("DateTime input '{}' does not match {}", input, format);
      }
    }
    return FieldValue.text(input);
  }

  private void write(Long fieldId, long objectId, FieldValue value) {
    try {
      valueRepository.deleteByFieldIdAndObjectId(fieldId, objectId);
      if (!FieldValue.isEmpty(value)) {
        valueRepository.saveAndFlush(new DynamicFieldValue(fieldId, objectId, value));
      }
    } catch (DataAccessException e) {
      throw new StorageException(
          "write value of field " + fieldId + " for object " + objectId, e);
    }
  }
}
