package io.b2mash.b2b.dynamicfields.dynamicfield;

import io.b2mash.b2b.dynamicfields.actor.ActorResolver;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.FieldConfig;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.FieldConfigCodec;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.FieldConfigs;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.OptionsConfig;
import io.b2mash.b2b.dynamicfields.exception.FieldValidationException;
import io.b2mash.b2b.dynamicfields.exception.ForbiddenException;
import io.b2mash.b2b.dynamicfields.exception.ResourceConflictException;
import io.b2mash.b2b.dynamicfields.exception.ResourceNotFoundException;
import io.b2mash.b2b.dynamicfields.exception.StorageException;
import io.b2mash.b2b.dynamicfields.fieldvalue.FieldValueService;
import io.b2mash.b2b.dynamicfields.screen.ScreenConfigService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Field Registry: CRUD over dynamic field definitions. */
@Service
public class DynamicFieldService {

  private static final Logger log = LoggerFactory.getLogger(DynamicFieldService.class);
  private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9]+$");
  private static final String NAME_CONSTRAINT = "uq_dynamic_field_name";

  private final DynamicFieldRepository dynamicFieldRepository;
  private final DynamicFieldMapper mapper;
  private final FieldConfigCodec configCodec;
  private final FieldValueService fieldValueService;
  private final ScreenConfigService screenConfigService;
  private final ActorResolver actorResolver;

  public DynamicFieldService(
      DynamicFieldRepository dynamicFieldRepository,
      DynamicFieldMapper mapper,
      FieldConfigCodec configCodec,
      FieldValueService fieldValueService,
      ScreenConfigService screenConfigService,
      ActorResolver actorResolver) {
    this.dynamicFieldRepository = dynamicFieldRepository;
    this.mapper = mapper;
    this.configCodec = configCodec;
    this.fieldValueService = fieldValueService;
    this.screenConfigService = screenConfigService;
    this.actorResolver = actorResolver;
  }

  /** Fields matching the optional filters, ordered by object type, field order and name. */
  @Transactional(readOnly = true)
  public List<DynamicFieldDefinition> list(ObjectType objectType, FieldType fieldType) {
    return dynamicFieldRepository.findFiltered(objectType, fieldType).stream()
        .map(mapper::toDefinition)
        .toList();
  }

  /** Every object type is present as a key, in declaration order, even without fields. */
  @Transactional(readOnly = true)
  public Map<ObjectType, List<DynamicFieldDefinition>> listGroupedByObjectType() {
    var grouped = new LinkedHashMap<ObjectType, List<DynamicFieldDefinition>>();
    for (var objectType : ObjectType.values()) {
      grouped.put(objectType, new ArrayList<>());
    }
    for (var definition : list(null, null)) {
      grouped.get(definition.objectType()).add(definition);
    }
    return grouped;
  }

  @Transactional(readOnly = true)
  public Optional<DynamicFieldDefinition> findById(Long id) {
    return dynamicFieldRepository.findById(id).map(mapper::toDefinition);
  }

  @Transactional(readOnly = true)
  public DynamicFieldDefinition getById(Long id) {
    return findById(id).orElseThrow(() -> new ResourceNotFoundException("DynamicField", id));
  }

  @Transactional(readOnly = true)
  public Optional<DynamicFieldDefinition> findByName(String name) {
    return dynamicFieldRepository.findByName(name).map(mapper::toDefinition);
  }

  @Transactional(readOnly = true)
  public DynamicFieldDefinition getByName(String name) {
    return findByName(name)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "DynamicField not found", "No dynamic field found with name " + name));
  }

  /** Whether another field already uses {@code name}; {@code excludeId} may be null. */
  @Transactional(readOnly = true)
  public boolean nameExists(String name, Long excludeId) {
    return excludeId == null
        ? dynamicFieldRepository.existsByName(name)
        : dynamicFieldRepository.existsByNameAndIdNot(name, excludeId);
  }

  @Transactional
  public DynamicFieldDefinition create(DynamicFieldCommand command) {
    var config = validate(command);
    if (nameExists(command.name(), null)) {
      throw duplicateName(command.name());
    }

    long userId = actorResolver.currentUserId();
    var field =
        new DynamicField(
            command.name(), command.fieldType(), command.objectType(), command.internal(), userId);
    field.update(
        command.name(),
        command.label(),
        normalizeOrder(command.fieldOrder()),
        command.fieldType(),
        command.objectType(),
        configCodec.serialize(config),
        command.valid(),
        userId);
    field = persist(field, command.name(), "create dynamic field " + command.name());

    log.info(
        "Created dynamic field: id={}, name={}, fieldType={}, objectType={}",
        field.getId(),
        field.getName(),
        field.getFieldType(),
        field.getObjectType());
    return mapper.toDefinition(field);
  }

  @Transactional
  public DynamicFieldDefinition update(Long id, DynamicFieldCommand command) {
    var config = validate(command);
    var field =
        dynamicFieldRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("DynamicField", id));
    if (nameExists(command.name(), id)) {
      throw duplicateName(command.name());
    }
    if (field.getFieldType().valueColumn() != command.fieldType().valueColumn()
        && fieldValueService.hasValues(id)) {
      throw new FieldValidationException(
          "fieldType",
          "Cannot change field type of "
              + field.getName()
              + " from "
              + field.getFieldType().externalName()
              + " to "
              + command.fieldType().externalName()
              + " while values are stored");
    }

    field.update(
        command.name(),
        command.label(),
        normalizeOrder(command.fieldOrder()),
        command.fieldType(),
        command.objectType(),
        configCodec.serialize(config),
        command.valid(),
        actorResolver.currentUserId());
    field = persist(field, command.name(), "update dynamic field " + id);

    log.info("Updated dynamic field: id={}, name={}", field.getId(), field.getName());
    return mapper.toDefinition(field);
  }

  /** Removes the field's values, then its screen rows, then the field itself. */
  @Transactional
  public void delete(Long id) {
    var field =
        dynamicFieldRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("DynamicField", id));
    if (field.isInternalField()) {
      throw new ForbiddenException(
          "Internal field",
          "Dynamic field " + field.getName() + " is internal and cannot be deleted");
    }

    int values = fieldValueService.deleteValuesForField(id);
    int screens = screenConfigService.deleteForField(id);
    try {
      dynamicFieldRepository.delete(field);
      dynamicFieldRepository.flush();
    } catch (DataAccessException e) {
      throw new StorageException("delete dynamic field " + id, e);
    }

    log.info(
        "Deleted dynamic field: id={}, name={}, values={}, screenConfigs={}",
        id,
        field.getName(),
        values,
        screens);
  }

  private DynamicField persist(DynamicField field, String name, String operation) {
    try {
      return dynamicFieldRepository.saveAndFlush(field);
    } catch (DataIntegrityViolationException e) {
      if (violatesNameConstraint(e)) {
        throw duplicateName(name);
      }
      throw new StorageException(operation, e);
    } catch (DataAccessException e) {
      throw new StorageException(operation, e);
    }
  }

  private static boolean violatesNameConstraint(Throwable e) {
    for (var cause = e; cause != null; cause = cause.getCause()) {
      if (cause instanceof ConstraintViolationException violation) {
        return NAME_CONSTRAINT.equalsIgnoreCase(violation.getConstraintName());
      }
    }
    return false;
  }

  private static ResourceConflictException duplicateName(String name) {
    return new ResourceConflictException(
        "Duplicate name", "A dynamic field with name '" + name + "' already exists");
  }

  private static int normalizeOrder(int fieldOrder) {
    return Math.max(fieldOrder, 1);
  }

  /** Validates the command and returns the config that will be stored. */
  FieldConfig validate(DynamicFieldCommand command) {
    if (command.name() == null || command.name().isBlank()) {
      throw new FieldValidationException("name", "Name is required");
    }
    if (!NAME_PATTERN.matcher(command.name()).matches()) {
      throw new FieldValidationException(
          "name", "Name must contain only letters and digits: " + command.name());
    }
    if (command.label() == null || command.label().isBlank()) {
      throw new FieldValidationException("label", "Label is required");
    }
    if (command.fieldType() == null) {
      throw new FieldValidationException("fieldType", "Field type is required");
    }
    if (command.objectType() == null) {
      throw new FieldValidationException("objectType", "Object type is required");
    }

    var type = command.fieldType();
    FieldConfig config = command.config();
    if (config != null && !type.configType().isInstance(config)) {
      throw new FieldValidationException(
          "config",
          config.fieldType().externalName()
              + " config does not match field type "
              + type.externalName());
    }
    if (command.autoConfig() && type.supportsAutoConfig()) {
      var defaults = FieldConfigs.autoDefaults(type);
      config =
          config == null || config.defaultValue().isEmpty()
              ? defaults
              : defaults.withDefaultValue(config.defaultValue());
    } else if (config == null) {
      config = FieldConfigs.empty(type);
    }

    if (type.requiresPossibleValues() && ((OptionsConfig) config).possibleValues().isEmpty()) {
      throw new FieldValidationException(
          "possibleValues", type.externalName() + " fields require at least one possible value");
    }
    return config;
  }
}
