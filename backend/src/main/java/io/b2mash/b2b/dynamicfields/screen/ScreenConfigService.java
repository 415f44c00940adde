package io.b2mash.b2b.dynamicfields.screen;

import io.b2mash.b2b.dynamicfields.actor.ActorResolver;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicField;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldMapper;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldRepository;
import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import io.b2mash.b2b.dynamicfields.exception.FieldValidationException;
import io.b2mash.b2b.dynamicfields.exception.ResourceNotFoundException;
import io.b2mash.b2b.dynamicfields.exception.StorageException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Screen Matrix: which fields each screen shows and whether they are required. Concurrent edits
 * of the same field are last-write-wins.
 */
@Service
public class ScreenConfigService {

  private static final Logger log = LoggerFactory.getLogger(ScreenConfigService.class);

  private final ScreenConfigRepository screenConfigRepository;
  private final DynamicFieldRepository dynamicFieldRepository;
  private final DynamicFieldMapper mapper;
  private final ActorResolver actorResolver;

  public ScreenConfigService(
      ScreenConfigRepository screenConfigRepository,
      DynamicFieldRepository dynamicFieldRepository,
      DynamicFieldMapper mapper,
      ActorResolver actorResolver) {
    this.screenConfigRepository = screenConfigRepository;
    this.dynamicFieldRepository = dynamicFieldRepository;
    this.mapper = mapper;
    this.actorResolver = actorResolver;
  }

  @Transactional(readOnly = true)
  public ScreenConfigMatrix getMatrix(ObjectType objectType) {
    var fields = dynamicFieldRepository.findByObjectTypeOrdered(objectType);
    var screens = ScreenDefinitions.forObjectType(objectType);

    var stored = new HashMap<Long, Map<String, ScreenVisibility>>();
    var fieldIds = fields.stream().map(DynamicField::getId).toList();
    if (!fieldIds.isEmpty()) {
      for (var row : screenConfigRepository.findByFieldIdIn(fieldIds)) {
        stored
            .computeIfAbsent(row.getFieldId(), id -> new HashMap<>())
            .put(row.getScreenKey(), row.getVisibility());
      }
    }

    var cells = new LinkedHashMap<Long, Map<String, ScreenVisibility>>();
    for (var field : fields) {
      var row = new LinkedHashMap<String, ScreenVisibility>();
      var storedRow = stored.getOrDefault(field.getId(), Map.of());
      for (var screen : screens) {
        row.put(screen.key(), storedRow.getOrDefault(screen.key(), ScreenVisibility.DISABLED));
      }
      cells.put(field.getId(), row);
    }
    return new ScreenConfigMatrix(
        objectType, fields.stream().map(mapper::toDefinition).toList(), screens, cells);
  }

  /** Replaces every screen row of the field; screens not in {@code levels} become disabled. */
  @Transactional
  public Map<String, ScreenVisibility> bulkSet(Long fieldId, Map<String, Integer> levels) {
    var field = requireField(fieldId);
    var validated = new LinkedHashMap<String, ScreenVisibility>();
    for (var entry : levels.entrySet()) {
      validated.put(entry.getKey(), validate(field, entry.getKey(), entry.getValue()));
    }

    long userId = actorResolver.currentUserId();
    try {
      screenConfigRepository.deleteByFieldId(fieldId);
      var rows = new ArrayList<ScreenConfig>();
      validated.forEach(
          (screenKey, visibility) -> {
            if (visibility.isShown()) {
              rows.add(new ScreenConfig(fieldId, screenKey, visibility, userId));
            }
          });
      screenConfigRepository.saveAllAndFlush(rows);
    } catch (DataAccessException e) {
      throw new StorageException("replace screen config of field " + fieldId, e);
    }

    log.info("Replaced screen config: fieldId={}, screens={}", fieldId, validated);
    return getConfigForField(fieldId);
  }

  /** Sets a single cell; level 0 removes the row. */
  @Transactional
  public void set(Long fieldId, String screenKey, int level) {
    var field = requireField(fieldId);
    var visibility = validate(field, screenKey, level);
    try {
      screenConfigRepository.deleteByFieldIdAndScreenKey(fieldId, screenKey);
      if (visibility.isShown()) {
        screenConfigRepository.saveAndFlush(
            new ScreenConfig(fieldId, screenKey, visibility, actorResolver.currentUserId()));
      }
    } catch (DataAccessException e) {
      throw new StorageException("set screen config " + screenKey + " of field " + fieldId, e);
    }
    log.info(
        "Set screen config: fieldId={}, screenKey={}, level={}",
        fieldId,
        screenKey,
        visibility.level());
  }

  /** Valid fields of {@code objectType} shown on the screen, by field order and name. */
  @Transactional(readOnly = true)
  public List<FieldWithScreenConfig> getFieldsForScreen(String screenKey, ObjectType objectType) {
    var levels = new HashMap<Long, ScreenVisibility>();
    for (var row : screenConfigRepository.findEnabledByScreenKey(screenKey)) {
      levels.put(row.getFieldId(), row.getVisibility());
    }
    if (levels.isEmpty()) {
      return List.of();
    }
    return dynamicFieldRepository.findValidByObjectTypeOrdered(objectType).stream()
        .filter(field -> levels.containsKey(field.getId()))
        .map(
            field ->
                new FieldWithScreenConfig(mapper.toDefinition(field), levels.get(field.getId())))
        .toList();
  }

  /** Stored (enabled or required) screens of the field, keyed by screen key. */
  @Transactional(readOnly = true)
  public Map<String, ScreenVisibility> getConfigForField(Long fieldId) {
    var config = new LinkedHashMap<String, ScreenVisibility>();
    for (var row : screenConfigRepository.findByFieldIdOrderByScreenKey(fieldId)) {
      config.put(row.getScreenKey(), row.getVisibility());
    }
    return config;
  }

  /** Removes every screen row of the field. Part of field deletion. */
  @Transactional
  public int deleteForField(Long fieldId) {
    try {
      return screenConfigRepository.deleteByFieldId(fieldId);
    } catch (DataAccessException e) {
      throw new StorageException("delete screen config of field " + fieldId, e);
    }
  }

  private DynamicField requireField(Long fieldId) {
    return dynamicFieldRepository
        .findById(fieldId)
        .orElseThrow(() -> new ResourceNotFoundException("DynamicField", fieldId));
  }

  private ScreenVisibility validate(DynamicField field, String screenKey, Integer level) {
    var screen =
        ScreenDefinitions.find(screenKey)
            .orElseThrow(
                () -> new FieldValidationException("screenKey", "Unknown screen: " + screenKey));
    if (level == null) {
      throw new FieldValidationException("level", "Level is required for screen " + screenKey);
    }
    var visibility = ScreenVisibility.fromLevel(level);
    if (screen.objectType() != field.getObjectType()) {
      throw new FieldValidationException(
          "screenKey",
          "Screen "
              + screenKey
              + " shows "
              + screen.objectType().externalName()
              + " fields, not "
              + field.getObjectType().externalName());
    }
    if (!screen.allows(visibility)) {
      throw new FieldValidationException(
          "level", "Screen " + screenKey + " does not support required fields");
    }
    return visibility;
  }
}
